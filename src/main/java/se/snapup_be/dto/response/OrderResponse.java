package se.snapup_be.dto.response;

import lombok.*;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.enums.OrderStatus;
import se.snapup_be.pojo.enums.TrackingStatus;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderResponse {
    private Long orderId;
    private Long offerId;
    private Long listingId;
    private String listingTitle;
    private Long buyerId;
    private String buyerUsername;
    private Long sellerId;
    private String sellerUsername;
    private Long amount;
    private Long serviceFee;
    private Long total;
    private OrderStatus status;
    private String paymentReference;
    private String trackingNumber;
    private String carrier;
    private TrackingStatus trackingStatus;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant paidAt;
    private Instant shippedAt;
    private Instant deliveredAt;
    private Instant cancelledAt;

    public static OrderResponse fromEntity(Order order) {
        return OrderResponse.builder()
                .orderId(order.getOrderId())
                .offerId(order.getOffer() != null ? order.getOffer().getOfferId() : null)
                .listingId(order.getListing().getListingId())
                .listingTitle(order.getListing().getTitle())
                .buyerId(order.getBuyer().getUserId())
                .buyerUsername(order.getBuyer().getUsername())
                .sellerId(order.getSeller().getUserId())
                .sellerUsername(order.getSeller().getUsername())
                .amount(order.getAmount())
                .serviceFee(order.getServiceFee())
                .total(order.getTotal())
                .status(order.getStatus())
                .paymentReference(order.getPaymentReference())
                .trackingNumber(order.getTrackingNumber())
                .carrier(order.getCarrier())
                .trackingStatus(order.getTrackingStatus())
                .createdAt(order.getCreatedAt())
                .updatedAt(order.getUpdatedAt())
                .paidAt(order.getPaidAt())
                .shippedAt(order.getShippedAt())
                .deliveredAt(order.getDeliveredAt())
                .cancelledAt(order.getCancelledAt())
                .build();
    }
}
