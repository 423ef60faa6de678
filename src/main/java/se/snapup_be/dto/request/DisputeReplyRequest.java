package se.snapup_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisputeReplyRequest {

    @NotBlank(message = "Response is required")
    @Size(max = 2000)
    private String response;

    private boolean acceptRefund;
}
