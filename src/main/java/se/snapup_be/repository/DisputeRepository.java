package se.snapup_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.snapup_be.pojo.Dispute;
import se.snapup_be.pojo.enums.DisputeStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface DisputeRepository extends JpaRepository<Dispute, Long> {

    Optional<Dispute> findByActiveKey(Long orderId);

    boolean existsByActiveKey(Long orderId);

    List<Dispute> findByOrderOrderIdOrderByCreatedAtDesc(Long orderId);

    Optional<Dispute> findFirstByOrderOrderIdAndStatusInOrderByResolvedAtDesc(Long orderId, Collection<DisputeStatus> statuses);

    boolean existsByOrderOrderIdAndStatusIn(Long orderId, Collection<DisputeStatus> statuses);

    @Query("SELECT d FROM Dispute d WHERE d.order.buyer.userId = :userId OR d.order.seller.userId = :userId " +
           "ORDER BY d.createdAt DESC")
    List<Dispute> findByParticipant(@Param("userId") Long userId);

    List<Dispute> findByStatusInOrderByCreatedAtAsc(List<DisputeStatus> statuses);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Dispute d SET d.status = :status, d.updatedAt = :now " +
           "WHERE d.disputeId = :disputeId AND d.status = :expected")
    int compareAndSetStatus(@Param("disputeId") Long disputeId,
                            @Param("expected") DisputeStatus expected,
                            @Param("status") DisputeStatus status,
                            @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Dispute d SET d.status = :status, d.activeKey = null, d.resolvedAt = :now, d.updatedAt = :now " +
           "WHERE d.disputeId = :disputeId AND d.status = :expected")
    int close(@Param("disputeId") Long disputeId,
              @Param("expected") DisputeStatus expected,
              @Param("status") DisputeStatus status,
              @Param("now") Instant now);
}
