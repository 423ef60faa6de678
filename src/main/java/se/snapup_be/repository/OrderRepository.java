package se.snapup_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.enums.OrderStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OrderRepository extends JpaRepository<Order, Long> {

    Optional<Order> findByOfferOfferId(Long offerId);

    @Query("SELECT o FROM Order o WHERE o.buyer.userId = :userId OR o.seller.userId = :userId ORDER BY o.createdAt DESC")
    List<Order> findByParticipant(@Param("userId") Long userId);

    List<Order> findByBuyerUserIdOrderByCreatedAtDesc(Long buyerId);

    List<Order> findBySellerUserIdOrderByCreatedAtDesc(Long sellerId);

    List<Order> findByStatusAndCreatedAtBefore(OrderStatus status, Instant cutoff);

    @Query("SELECT o FROM Order o WHERE o.status = se.snapup_be.pojo.enums.OrderStatus.DELIVERED " +
           "AND NOT EXISTS (SELECT h FROM EscrowHold h WHERE h.order = o)")
    List<Order> findDeliveredWithoutHold();

    @Query("SELECT o FROM Order o WHERE o.listing.listingId = :listingId " +
           "AND o.status = se.snapup_be.pojo.enums.OrderStatus.PENDING_PAYMENT AND o.orderId <> :keepOrderId")
    List<Order> findStalePendingOrders(@Param("listingId") Long listingId,
                                       @Param("keepOrderId") Long keepOrderId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = :status, o.updatedAt = :now " +
           "WHERE o.orderId = :orderId AND o.status = :expected")
    int compareAndSetStatus(@Param("orderId") Long orderId,
                            @Param("expected") OrderStatus expected,
                            @Param("status") OrderStatus status,
                            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = se.snapup_be.pojo.enums.OrderStatus.PAID, " +
           "o.paymentReference = :reference, o.paidAt = :now, o.updatedAt = :now " +
           "WHERE o.orderId = :orderId AND o.status = se.snapup_be.pojo.enums.OrderStatus.PENDING_PAYMENT")
    int markPaid(@Param("orderId") Long orderId,
                 @Param("reference") String reference,
                 @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = se.snapup_be.pojo.enums.OrderStatus.SHIPPED, " +
           "o.trackingNumber = :trackingNumber, o.carrier = :carrier, " +
           "o.trackingStatus = se.snapup_be.pojo.enums.TrackingStatus.SHIPPED, " +
           "o.shippedAt = :now, o.updatedAt = :now " +
           "WHERE o.orderId = :orderId AND o.status = se.snapup_be.pojo.enums.OrderStatus.PAID")
    int markShipped(@Param("orderId") Long orderId,
                    @Param("trackingNumber") String trackingNumber,
                    @Param("carrier") String carrier,
                    @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = se.snapup_be.pojo.enums.OrderStatus.DELIVERED, " +
           "o.trackingStatus = se.snapup_be.pojo.enums.TrackingStatus.DELIVERED, " +
           "o.deliveredAt = :now, o.updatedAt = :now " +
           "WHERE o.orderId = :orderId AND o.status = se.snapup_be.pojo.enums.OrderStatus.SHIPPED")
    int markDelivered(@Param("orderId") Long orderId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = se.snapup_be.pojo.enums.OrderStatus.CANCELLED, " +
           "o.cancelledAt = :now, o.updatedAt = :now " +
           "WHERE o.orderId = :orderId AND o.status = se.snapup_be.pojo.enums.OrderStatus.PENDING_PAYMENT")
    int cancelPending(@Param("orderId") Long orderId, @Param("now") Instant now);
}
