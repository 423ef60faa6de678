package se.snapup_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import se.snapup_be.dto.response.ApiResponse;
import se.snapup_be.dto.response.EscrowStatusResponse;
import se.snapup_be.dto.response.EscrowSummaryResponse;
import se.snapup_be.pojo.User;
import se.snapup_be.service.AutoReleaseResult;
import se.snapup_be.service.EscrowService;
import se.snapup_be.service.UserService;

@RestController
@RequestMapping("/api/escrow")
@Tag(name = "Escrow", description = "Escrow holds on delivered orders")
@RequiredArgsConstructor
@SecurityRequirement(name = "basicAuth")
public class EscrowController {

    private final EscrowService escrowService;
    private final UserService userService;

    @Operation(summary = "Escrow status of an order",
            description = "Hold, active dispute and release decision evaluated on the server clock.")
    @GetMapping("/orders/{orderId}")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<EscrowStatusResponse>> getEscrowStatus(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(escrowService.getEscrowStatus(orderId, user.getUserId())));
    }

    @Operation(summary = "Verify release",
            description = "Called when a client countdown reaches zero. Releases the hold if it is due; otherwise returns the current state.")
    @PostMapping("/orders/{orderId}/verify-release")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<AutoReleaseResult>> verifyRelease(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        escrowService.getEscrowStatus(orderId, user.getUserId());
        AutoReleaseResult result = escrowService.autoRelease(orderId);
        return ResponseEntity.ok(ApiResponse.success(result.isReleased() ? "Funds released" : "Not released", result));
    }

    @GetMapping("/summary")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<EscrowSummaryResponse>> getSellerSummary(
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User seller = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(escrowService.getSellerEscrowSummary(seller.getUserId())));
    }
}
