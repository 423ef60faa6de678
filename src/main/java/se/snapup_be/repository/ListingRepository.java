package se.snapup_be.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.enums.ListingStatus;

import java.time.Instant;
import java.util.Collection;

public interface ListingRepository extends JpaRepository<Listing, Long> {

    /**
     * Moves the listing to {@code status} only from one of {@code expected}. Returns 0 when
     * the listing was already in some other state, for example SOLD.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Listing l SET l.status = :status, l.updatedAt = :now " +
           "WHERE l.listingId = :listingId AND l.status IN :expected")
    int claimStatus(@Param("listingId") Long listingId,
                    @Param("expected") Collection<ListingStatus> expected,
                    @Param("status") ListingStatus status,
                    @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Listing l SET l.status = :status, l.updatedAt = :now " +
           "WHERE l.listingId = :listingId AND l.status = :expected")
    int compareAndSetStatus(@Param("listingId") Long listingId,
                            @Param("expected") ListingStatus expected,
                            @Param("status") ListingStatus status,
                            @Param("now") Instant now);
}
