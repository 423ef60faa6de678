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
public class ShipOrderRequest {

    @NotBlank(message = "Tracking number is required")
    @Size(max = 100)
    private String trackingNumber;

    @NotBlank(message = "Carrier is required")
    @Size(max = 100)
    private String carrier;
}
