package se.snapup_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.OrderTracking;
import se.snapup_be.pojo.enums.TrackingStatus;
import se.snapup_be.repository.OrderTrackingRepository;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingService {

    private final OrderTrackingRepository trackingRepository;
    private final Clock clock;

    /**
     * Appends an entry to the order's tracking history.
     */
    @Transactional
    public OrderTracking record(Order order, TrackingStatus status, String updatedBy, String notes) {
        return record(order, status, updatedBy, notes, null, null, null);
    }

    @Transactional
    public OrderTracking record(Order order, TrackingStatus status, String updatedBy, String notes,
                                String trackingNumber, String carrier, String photoUrl) {
        log.debug("Tracking entry for order {}: {} by {}", order.getOrderId(), status, updatedBy);

        return trackingRepository.save(OrderTracking.builder()
                .order(order)
                .status(status)
                .updatedBy(updatedBy)
                .notes(notes)
                .trackingNumber(trackingNumber)
                .carrier(carrier)
                .photoUrl(photoUrl)
                .occurredAt(clock.instant())
                .build());
    }

    public List<OrderTracking> getHistory(Long orderId) {
        return trackingRepository.findByOrderOrderIdOrderByOccurredAtAsc(orderId);
    }
}
