package se.snapup_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.snapup_be.pojo.Offer;
import se.snapup_be.pojo.enums.OfferStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface OfferRepository extends JpaRepository<Offer, Long> {

    Optional<Offer> findByActiveKey(String activeKey);

    boolean existsByActiveKey(String activeKey);

    @Query("SELECT o FROM Offer o " +
           "WHERE o.listing.listingId = :listingId AND o.buyer.userId = :buyerId AND o.seller.userId = :sellerId " +
           "ORDER BY o.createdAt DESC")
    List<Offer> findConversationOffers(@Param("listingId") Long listingId,
                                       @Param("buyerId") Long buyerId,
                                       @Param("sellerId") Long sellerId);

    List<Offer> findByListingListingIdOrderByCreatedAtDesc(Long listingId);

    @Query("SELECT o FROM Offer o WHERE o.buyer.userId = :userId OR o.seller.userId = :userId ORDER BY o.updatedAt DESC")
    List<Offer> findByParticipant(@Param("userId") Long userId);

    /**
     * Counters a PENDING offer. Returns 0 when the offer has moved on.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Offer o SET o.status = se.snapup_be.pojo.enums.OfferStatus.COUNTERED, " +
           "o.counterAmount = :counterAmount, o.updatedAt = :now " +
           "WHERE o.offerId = :offerId AND o.status = se.snapup_be.pojo.enums.OfferStatus.PENDING")
    int counter(@Param("offerId") Long offerId,
                @Param("counterAmount") Long counterAmount,
                @Param("now") Instant now);

    /**
     * Moves the offer to a terminal status and frees the thread key.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Offer o SET o.status = :status, o.activeKey = null, o.updatedAt = :now " +
           "WHERE o.offerId = :offerId AND o.status = :expected")
    int close(@Param("offerId") Long offerId,
              @Param("expected") OfferStatus expected,
              @Param("status") OfferStatus status,
              @Param("now") Instant now);
}
