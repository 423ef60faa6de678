package se.snapup_be.dto.response;

import lombok.*;
import se.snapup_be.guard.GuardResult;
import se.snapup_be.pojo.ChatMessage;
import se.snapup_be.pojo.enums.MessageType;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatMessageResponse {
    private Long messageId;
    private Long listingId;
    private Long senderId;
    private String senderUsername;
    private Long receiverId;
    private String receiverUsername;
    private String content;
    private MessageType type;
    private Instant createdAt;
    // sender-only: guard outcome and quota left
    private GuardResult guard;

    public static ChatMessageResponse fromEntity(ChatMessage message) {
        return ChatMessageResponse.builder()
                .messageId(message.getMessageId())
                .listingId(message.getListing().getListingId())
                .senderId(message.getSender().getUserId())
                .senderUsername(message.getSender().getUsername())
                .receiverId(message.getReceiver().getUserId())
                .receiverUsername(message.getReceiver().getUsername())
                .content(message.getContent())
                .type(message.getType())
                .createdAt(message.getCreatedAt())
                .build();
    }
}
