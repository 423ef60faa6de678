package se.snapup_be.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConfirmDeliveryRequest {

    @Size(max = 512, message = "Photo URL cannot exceed 512 characters")
    private String photoUrl;
}
