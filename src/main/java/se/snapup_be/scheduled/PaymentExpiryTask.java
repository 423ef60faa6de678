package se.snapup_be.scheduled;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import se.snapup_be.service.OrderService;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentExpiryTask {

    private final OrderService orderService;

    @Scheduled(fixedDelayString = "${snapup.orders.expiry-interval-ms:300000}",
               initialDelayString = "${snapup.orders.expiry-initial-delay-ms:60000}")
    public void expireUnpaidOrders() {
        List<Long> expired = orderService.findExpiredPendingOrderIds();
        if (expired.isEmpty()) {
            log.debug("No unpaid orders past the payment window");
            return;
        }

        int cancelled = 0;
        for (Long orderId : expired) {
            try {
                if (orderService.expirePendingOrder(orderId)) {
                    cancelled++;
                }
            } catch (Exception e) {
                log.error("Failed to expire order {}: {}", orderId, e.getMessage(), e);
            }
        }
        log.info("Cancelled {} of {} unpaid orders past the payment window", cancelled, expired.size());
    }
}
