package se.snapup_be.support;

import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.User;
import se.snapup_be.pojo.enums.ListingStatus;
import se.snapup_be.pojo.enums.UserRole;
import se.snapup_be.repository.ListingRepository;
import se.snapup_be.repository.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates users and listings with unique names, so tests sharing one application
 * context do not collide.
 */
public class MarketplaceFixtures {

    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final UserRepository userRepository;
    private final ListingRepository listingRepository;
    private final Clock clock;

    public MarketplaceFixtures(UserRepository userRepository, ListingRepository listingRepository, Clock clock) {
        this.userRepository = userRepository;
        this.listingRepository = listingRepository;
        this.clock = clock;
    }

    public User user(String prefix) {
        return createUser(prefix, UserRole.USER);
    }

    public User admin() {
        return createUser("admin", UserRole.ADMIN);
    }

    public Listing listing(User seller, long price) {
        Instant now = clock.instant();
        return listingRepository.save(Listing.builder()
                .seller(seller)
                .title("Listing " + SEQUENCE.incrementAndGet())
                .price(price)
                .status(ListingStatus.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .build());
    }

    private User createUser(String prefix, UserRole role) {
        String username = prefix + SEQUENCE.incrementAndGet();
        return userRepository.save(User.builder()
                .username(username)
                .email(username + "@test.local")
                .passwordHash("{noop}password")
                .role(role)
                .joinedAt(clock.instant())
                .build());
    }
}
