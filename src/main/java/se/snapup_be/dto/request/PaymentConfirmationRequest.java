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
public class PaymentConfirmationRequest {

    @NotBlank(message = "Payment reference is required")
    @Size(max = 100, message = "Payment reference cannot exceed 100 characters")
    private String paymentReference;
}
