package se.snapup_be.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.web.bind.annotation.*;
import se.snapup_be.dto.request.ConfirmDeliveryRequest;
import se.snapup_be.dto.request.PaymentConfirmationRequest;
import se.snapup_be.dto.request.ShipOrderRequest;
import se.snapup_be.dto.request.TrackingUpdateRequest;
import se.snapup_be.dto.response.ApiResponse;
import se.snapup_be.dto.response.DeliveryConfirmationResponse;
import se.snapup_be.dto.response.OrderResponse;
import se.snapup_be.dto.response.TrackingResponse;
import se.snapup_be.exception.UnauthorizedException;
import se.snapup_be.pojo.User;
import se.snapup_be.service.DeliveryConfirmationService;
import se.snapup_be.service.OrderService;
import se.snapup_be.service.UserService;

import java.util.List;

@RestController
@RequestMapping("/api/orders")
@Tag(name = "Order Management",
     description = "Orders created from accepted offers: payment, shipping, tracking, delivery confirmation and cancellation.")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "basicAuth")
public class OrderController {

    private final OrderService orderService;
    private final DeliveryConfirmationService deliveryConfirmationService;
    private final UserService userService;

    @Operation(summary = "Get user's orders", description = "Filter with role=buyer or role=seller; both when omitted.")
    @GetMapping
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<List<OrderResponse>>> getUserOrders(
            @Parameter(description = "buyer or seller") @RequestParam(required = false) String role,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(orderService.getUserOrders(user.getUserId(), role)));
    }

    @GetMapping("/{orderId}")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<OrderResponse>> getOrder(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(orderService.getOrder(orderId, user.getUserId())));
    }

    @Operation(summary = "Confirm payment",
            description = "Payment hook for the buyer or an administrator. Repeating it with the same reference is harmless.")
    @PostMapping("/{orderId}/pay")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<OrderResponse>> markPaid(
            @PathVariable Long orderId,
            @Valid @RequestBody PaymentConfirmationRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        if (!user.isAdmin()) {
            OrderResponse order = orderService.getOrder(orderId, user.getUserId());
            if (!user.getUserId().equals(order.getBuyerId())) {
                throw new UnauthorizedException("Only the buyer can pay for this order");
            }
        }
        OrderResponse paid = orderService.markPaid(orderId, request.getPaymentReference());
        return ResponseEntity.ok(ApiResponse.success("Payment confirmed", paid));
    }

    @PostMapping("/{orderId}/ship")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<OrderResponse>> markShipped(
            @PathVariable Long orderId,
            @Valid @RequestBody ShipOrderRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User seller = userService.findByUsername(userDetails.getUsername());
        OrderResponse order = orderService.markShipped(orderId, seller.getUserId(),
                request.getTrackingNumber(), request.getCarrier());
        return ResponseEntity.ok(ApiResponse.success("Order marked as shipped", order));
    }

    @Operation(summary = "Add a tracking update", description = "Seller or administrator (courier feed). Order status is unchanged.")
    @PostMapping("/{orderId}/tracking")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<TrackingResponse>> addTrackingUpdate(
            @PathVariable Long orderId,
            @Valid @RequestBody TrackingUpdateRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        TrackingResponse entry = orderService.addTrackingUpdate(orderId, user.getUserId(), user.isAdmin(),
                request.getStatus(), request.getNotes());
        return ResponseEntity.ok(ApiResponse.success("Tracking updated", entry));
    }

    @GetMapping("/{orderId}/tracking")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<List<TrackingResponse>>> getTrackingHistory(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success(orderService.getTrackingHistory(orderId, user.getUserId())));
    }

    @Operation(summary = "Confirm delivery",
            description = "Buyer confirms receipt, optionally with a photo. Starts the 48 hour escrow hold; " +
                          "if that fails the delivery still stands and escrowPending is true.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Delivery confirmed",
                    content = @Content(schema = @Schema(implementation = DeliveryConfirmationResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Order not shipped")
    })
    @PostMapping("/{orderId}/confirm-delivery")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<DeliveryConfirmationResponse>> confirmDelivery(
            @PathVariable Long orderId,
            @Valid @RequestBody(required = false) ConfirmDeliveryRequest request,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User buyer = userService.findByUsername(userDetails.getUsername());
        DeliveryConfirmationResponse result = deliveryConfirmationService.confirmDelivery(orderId, buyer.getUserId(),
                request != null ? request.getPhotoUrl() : null);
        String message = result.isEscrowPending()
                ? "Delivery confirmed, escrow will start shortly"
                : "Delivery confirmed, payment held for 48 hours";
        return ResponseEntity.ok(ApiResponse.success(message, result));
    }

    @PostMapping("/{orderId}/cancel")
    @PreAuthorize("hasRole('USER')")
    public ResponseEntity<ApiResponse<OrderResponse>> cancelOrder(
            @PathVariable Long orderId,
            @Parameter(hidden = true) @AuthenticationPrincipal UserDetails userDetails) {

        User user = userService.findByUsername(userDetails.getUsername());
        return ResponseEntity.ok(ApiResponse.success("Order cancelled", orderService.cancelOrder(orderId, user.getUserId())));
    }
}
