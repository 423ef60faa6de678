package se.snapup_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;
import se.snapup_be.dto.request.ChatMessageRequest;
import se.snapup_be.dto.response.ApiResponse;
import se.snapup_be.dto.response.ChatMessageResponse;
import se.snapup_be.pojo.User;
import se.snapup_be.service.ChatService;
import se.snapup_be.service.UserService;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/chat")
@Tag(name = "Chat", description = "Listing conversations between buyer and seller")
@RequiredArgsConstructor
@SecurityRequirement(name = "basicAuth")
public class ChatRestController {

    private final ChatService chatService;
    private final UserService userService;

    @Operation(summary = "Send a message",
            description = "Rate limited and content checked. Warned messages can be resent with overrideWarning=true; blocked ones must be edited.")
    @PostMapping("/messages")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<ChatMessageResponse>> sendMessage(
            @Valid @RequestBody ChatMessageRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User sender = userService.findByUsername(userDetails.getUsername());
        ChatMessageResponse message = chatService.sendMessage(request.getListingId(), sender.getUserId(),
                request.getReceiverId(), request.getContent(), request.isOverrideWarning());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(message));
    }

    @GetMapping("/listings/{listingId}/with/{counterpartyId}")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<List<ChatMessageResponse>>> getConversation(
            @PathVariable Long listingId,
            @PathVariable Long counterpartyId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(chatService.getConversation(listingId, user.getUserId(), counterpartyId)));
    }

    @GetMapping("/quota")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> getRemainingQuota(
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(Map.of("remaining", chatService.remainingQuota(user.getUserId()))));
    }
}
