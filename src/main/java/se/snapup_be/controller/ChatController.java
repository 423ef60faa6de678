package se.snapup_be.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;
import se.snapup_be.dto.request.ChatMessageRequest;
import se.snapup_be.dto.response.ApiResponse;
import se.snapup_be.exception.BusinessLogicException;
import se.snapup_be.exception.GuardRejectedException;
import se.snapup_be.pojo.User;
import se.snapup_be.service.ChatService;
import se.snapup_be.service.UserService;

import java.security.Principal;
import java.util.Map;

/**
 * STOMP entry point for chat. Delivery to both parties happens in {@link ChatService};
 * rejections go back to the sender on {@code /user/queue/errors}.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ChatService chatService;
    private final UserService userService;

    @MessageMapping("/chat.send")
    public void sendMessage(@Payload ChatMessageRequest request, Principal principal) {
        User sender = userService.findByUsername(principal.getName());
        chatService.sendMessage(request.getListingId(), sender.getUserId(), request.getReceiverId(),
                request.getContent(), request.isOverrideWarning());
    }

    @MessageExceptionHandler(BusinessLogicException.class)
    @SendToUser(destinations = "/queue/errors", broadcast = false)
    public ApiResponse<Object> handleRejected(BusinessLogicException ex) {
        log.info("Chat message rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        ApiResponse<Object> response = ApiResponse.error(ex.getMessage());
        response.setErrorCode(ex.getErrorCode().name());
        response.setRetryPolicy(ex.getErrorCode().getRetryPolicy().name());
        if (ex instanceof GuardRejectedException) {
            response.setMetadata(Map.of("guard", ((GuardRejectedException) ex).getGuardResult()));
        }
        return response;
    }
}
