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
import se.snapup_be.dto.request.DisputeReplyRequest;
import se.snapup_be.dto.request.OpenDisputeRequest;
import se.snapup_be.dto.request.ResolveDisputeRequest;
import se.snapup_be.dto.response.ApiResponse;
import se.snapup_be.dto.response.DisputeResponse;
import se.snapup_be.pojo.User;
import se.snapup_be.service.DisputeService;
import se.snapup_be.service.UserService;

import java.util.List;

@RestController
@RequestMapping("/api/disputes")
@Tag(name = "Disputes", description = "Buyer disputes, seller responses and administrator resolution")
@RequiredArgsConstructor
@SecurityRequirement(name = "basicAuth")
public class DisputeController {

    private final DisputeService disputeService;
    private final UserService userService;

    @Operation(summary = "Open a dispute", description = "Buyer only, on a shipped or delivered order. Pauses the escrow hold.")
    @PostMapping("/orders/{orderId}")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<DisputeResponse>> openDispute(
            @PathVariable Long orderId,
            @Valid @RequestBody OpenDisputeRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User buyer = userService.findByUsername(userDetails.getUsername());
        DisputeResponse dispute = disputeService.openDispute(orderId, buyer.getUserId(), request.getReason(),
                request.getDescription(), request.getEvidenceUrls());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Dispute opened", dispute));
    }

    @GetMapping("/orders/{orderId}")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<DisputeResponse>> getOrderDispute(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(disputeService.getOrderDispute(orderId, user.getUserId())));
    }

    @GetMapping
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<List<DisputeResponse>>> getDisputes(
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(disputeService.getDisputes(user.getUserId(), user.isAdmin())));
    }

    @Operation(summary = "Seller response", description = "Accepting a refund resolves the dispute; otherwise it goes to review.")
    @PostMapping("/{disputeId}/respond")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<DisputeResponse>> respondToDispute(
            @PathVariable Long disputeId,
            @Valid @RequestBody DisputeReplyRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User seller = userService.findByUsername(userDetails.getUsername());
        DisputeResponse dispute = disputeService.respondToDispute(disputeId, seller.getUserId(),
                request.getResponse(), request.isAcceptRefund());
        return ResponseEntity.ok(ApiResponse.success("Response recorded", dispute));
    }

    @PostMapping("/{disputeId}/review")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<DisputeResponse>> markUnderReview(
            @PathVariable Long disputeId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User admin = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Dispute under review",
                disputeService.markUnderReview(disputeId, admin.getUserId())));
    }

    @Operation(summary = "Resolve a dispute",
            description = "CLOSE resumes the hold on its original release time; the other outcomes settle it.")
    @PostMapping("/{disputeId}/resolve")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<ApiResponse<DisputeResponse>> resolveDispute(
            @PathVariable Long disputeId,
            @Valid @RequestBody ResolveDisputeRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User admin = userService.findByUsername(userDetails.getUsername());
        DisputeResponse dispute = disputeService.resolveDispute(disputeId, admin.getUserId(), request.getOutcome(),
                request.getResolutionAmount(), request.getNotes());
        return ResponseEntity.ok(ApiResponse.success("Dispute resolved", dispute));
    }
}
