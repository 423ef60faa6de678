package se.snapup_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageSendingOperations;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import se.snapup_be.dto.response.ChatMessageResponse;
import se.snapup_be.exception.BusinessLogicException;
import se.snapup_be.exception.ContentBlockedException;
import se.snapup_be.exception.ContentWarnedException;
import se.snapup_be.exception.RateLimitedException;
import se.snapup_be.exception.ResourceNotFoundException;
import se.snapup_be.exception.UnauthorizedException;
import se.snapup_be.guard.GuardResult;
import se.snapup_be.guard.MessageGuard;
import se.snapup_be.pojo.ChatMessage;
import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.User;
import se.snapup_be.pojo.enums.MessageType;
import se.snapup_be.repository.ChatMessageRepository;
import se.snapup_be.repository.ListingRepository;
import se.snapup_be.repository.UserRepository;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
public class ChatService {

    public static final String MESSAGES_QUEUE = "/queue/messages";

    private final ChatMessageRepository chatMessageRepository;
    private final ListingRepository listingRepository;
    private final UserRepository userRepository;
    private final MessageGuard messageGuard;
    private final SimpMessageSendingOperations messagingTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ChatService(ChatMessageRepository chatMessageRepository,
                       ListingRepository listingRepository,
                       UserRepository userRepository,
                       MessageGuard messageGuard,
                       SimpMessageSendingOperations messagingTemplate,
                       PlatformTransactionManager transactionManager,
                       Clock clock) {
        this.chatMessageRepository = chatMessageRepository;
        this.listingRepository = listingRepository;
        this.userRepository = userRepository;
        this.messageGuard = messageGuard;
        this.messagingTemplate = messagingTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Sends a user-typed chat message about a listing. Runs the guard first and throws a
     * soft guard exception when the message may not go out as typed. The quota slot is taken
     * by the guard check and given back if the message cannot be stored.
     */
    public ChatMessageResponse sendMessage(Long listingId, Long senderId, Long receiverId,
                                           String content, boolean overrideWarning) {
        GuardResult guard = messageGuard.reserve(senderId, content, overrideWarning);
        switch (guard.getVerdict()) {
            case RATE_LIMITED:
                throw new RateLimitedException(guard);
            case BLOCK:
                throw new ContentBlockedException(guard);
            case WARN:
                if (!guard.isOverridden()) {
                    throw new ContentWarnedException(guard);
                }
                log.info("Sender {} overrode content warning: {}", senderId, guard.getDetails());
                break;
            default:
                break;
        }

        ChatMessageResponse response;
        try {
            response = transactionTemplate.execute(status ->
                    ChatMessageResponse.fromEntity(persist(listingId, senderId, receiverId, content, MessageType.CHAT)));
        } catch (RuntimeException e) {
            messageGuard.cancelReservation(senderId, guard);
            throw e;
        }
        push(response);

        response.setGuard(guard.toBuilder().remainingQuota(messageGuard.remaining(senderId)).reservedAt(null).build());
        return response;
    }

    /**
     * Sends a system notice produced by the offer workflow. Never throws: a guard
     * rejection or any failure skips the notice.
     */
    public void sendOfferNotice(Long listingId, Long senderId, Long receiverId, String content) {
        try {
            GuardResult guard = messageGuard.check(senderId, content, false);
            if (!guard.isSendable()) {
                log.warn("Offer notice on listing {} from {} skipped by guard: {} {}",
                        listingId, senderId, guard.getVerdict(), guard.getDetails());
                return;
            }
            ChatMessageResponse response = transactionTemplate.execute(status ->
                    ChatMessageResponse.fromEntity(persist(listingId, senderId, receiverId, content, MessageType.OFFER_NOTICE)));
            push(response);
        } catch (Exception e) {
            log.warn("Failed to send offer notice on listing {} from {} to {}: {}",
                    listingId, senderId, receiverId, e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public List<ChatMessageResponse> getConversation(Long listingId, Long userId, Long counterpartyId) {
        Listing listing = listingRepository.findById(listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Listing", listingId));
        requireSellerInvolved(listing, userId, counterpartyId);

        return chatMessageRepository.findConversation(listingId, userId, counterpartyId).stream()
                .map(ChatMessageResponse::fromEntity)
                .collect(Collectors.toList());
    }

    public int remainingQuota(Long senderId) {
        return messageGuard.remaining(senderId);
    }

    private ChatMessage persist(Long listingId, Long senderId, Long receiverId, String content, MessageType type) {
        if (senderId.equals(receiverId)) {
            throw new BusinessLogicException("You cannot send a message to yourself");
        }
        Listing listing = listingRepository.findById(listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Listing", listingId));
        requireSellerInvolved(listing, senderId, receiverId);

        User sender = userRepository.findById(senderId)
                .orElseThrow(() -> new ResourceNotFoundException("User", senderId));
        User receiver = userRepository.findById(receiverId)
                .orElseThrow(() -> new ResourceNotFoundException("User", receiverId));

        ChatMessage message = ChatMessage.builder()
                .listing(listing)
                .sender(sender)
                .receiver(receiver)
                .content(content == null ? "" : content)
                .type(type)
                .createdAt(clock.instant())
                .build();
        return chatMessageRepository.save(message);
    }

    private void requireSellerInvolved(Listing listing, Long userA, Long userB) {
        Long sellerId = listing.getSeller().getUserId();
        if (!sellerId.equals(userA) && !sellerId.equals(userB)) {
            throw new UnauthorizedException("Conversations about a listing must include its seller");
        }
    }

    private void push(ChatMessageResponse response) {
        try {
            messagingTemplate.convertAndSendToUser(response.getReceiverUsername(), MESSAGES_QUEUE, response);
            messagingTemplate.convertAndSendToUser(response.getSenderUsername(), MESSAGES_QUEUE, response);
        } catch (Exception e) {
            log.warn("Failed to push message {}: {}", response.getMessageId(), e.getMessage());
        }
    }
}
