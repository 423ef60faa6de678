package se.snapup_be.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessageRequest {

    @NotNull(message = "Listing ID is required")
    private Long listingId;

    @NotNull(message = "Receiver ID is required")
    private Long receiverId;

    @Size(max = 2000, message = "Message cannot exceed 2000 characters")
    private String content;

    // send despite a WARN verdict
    private boolean overrideWarning;
}
