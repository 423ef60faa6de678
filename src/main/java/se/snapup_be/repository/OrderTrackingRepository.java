package se.snapup_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import se.snapup_be.pojo.OrderTracking;

import java.util.List;

public interface OrderTrackingRepository extends JpaRepository<OrderTracking, Long> {
    List<OrderTracking> findByOrderOrderIdOrderByOccurredAtAsc(Long orderId);
}
