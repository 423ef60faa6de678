package se.snapup_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.snapup_be.pojo.EscrowHold;
import se.snapup_be.pojo.enums.EscrowStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface EscrowHoldRepository extends JpaRepository<EscrowHold, Long> {

    Optional<EscrowHold> findByOrderOrderId(Long orderId);

    boolean existsByOrderOrderId(Long orderId);

    @Query("SELECT h FROM EscrowHold h WHERE h.status = se.snapup_be.pojo.enums.EscrowStatus.PENDING " +
           "AND h.releaseAt <= :now ORDER BY h.releaseAt ASC")
    List<EscrowHold> findDueForRelease(@Param("now") Instant now);

    @Query("SELECT h FROM EscrowHold h WHERE h.buyer.userId = :userId OR h.seller.userId = :userId ORDER BY h.updatedAt DESC")
    List<EscrowHold> findByParticipant(@Param("userId") Long userId);

    List<EscrowHold> findBySellerUserId(Long sellerId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE EscrowHold h SET h.status = :status, h.updatedAt = :now " +
           "WHERE h.order.orderId = :orderId AND h.status = :expected")
    int compareAndSetStatus(@Param("orderId") Long orderId,
                            @Param("expected") EscrowStatus expected,
                            @Param("status") EscrowStatus status,
                            @Param("now") Instant now);

    /**
     * Claims the transition to RELEASED. The payout split and flags are written by the
     * caller on the re-fetched row.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE EscrowHold h SET h.status = se.snapup_be.pojo.enums.EscrowStatus.RELEASED, " +
           "h.releasedAt = :now, h.updatedAt = :now " +
           "WHERE h.order.orderId = :orderId AND h.status = :expected")
    int release(@Param("orderId") Long orderId,
                @Param("expected") EscrowStatus expected,
                @Param("now") Instant now);
}
