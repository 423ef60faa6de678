package se.snapup_be.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import se.snapup_be.pojo.enums.DisputeReason;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenDisputeRequest {

    @NotNull(message = "Reason is required")
    private DisputeReason reason;

    @NotBlank(message = "Description is required")
    @Size(max = 2000, message = "Description cannot exceed 2000 characters")
    private String description;

    @Size(max = 10, message = "At most 10 evidence links")
    @Builder.Default
    private List<String> evidenceUrls = new ArrayList<>();
}
