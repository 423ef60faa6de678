package se.snapup_be.dbinit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import se.snapup_be.pojo.CommissionTier;
import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.User;
import se.snapup_be.pojo.enums.ListingStatus;
import se.snapup_be.pojo.enums.UserRole;
import se.snapup_be.repository.CommissionTierRepository;
import se.snapup_be.repository.ListingRepository;
import se.snapup_be.repository.UserRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

@Component
@Slf4j
public class DataInitializer implements CommandLineRunner {

    private final CommissionTierRepository commissionTierRepository;
    private final UserRepository userRepository;
    private final ListingRepository listingRepository;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;
    private final boolean demoData;

    public DataInitializer(CommissionTierRepository commissionTierRepository,
                           UserRepository userRepository,
                           ListingRepository listingRepository,
                           PasswordEncoder passwordEncoder,
                           Clock clock,
                           @Value("${snapup.seed.demo-data:false}") boolean demoData) {
        this.commissionTierRepository = commissionTierRepository;
        this.userRepository = userRepository;
        this.listingRepository = listingRepository;
        this.passwordEncoder = passwordEncoder;
        this.clock = clock;
        this.demoData = demoData;
    }

    @Override
    public void run(String... args) {
        initCommissionTiers();
        if (demoData) {
            initUsers();
            initListings();
        }
    }

    private void initCommissionTiers() {
        try {
            if (commissionTierRepository.count() > 0) {
                return;
            }
            commissionTierRepository.save(CommissionTier.builder()
                    .lowThreshold(50000L)
                    .lowRate(new BigDecimal("0.1200"))
                    .midThreshold(200000L)
                    .midRate(new BigDecimal("0.1000"))
                    .highRate(new BigDecimal("0.0500"))
                    .createdAt(clock.instant())
                    .build());
            log.info("Seeded default commission tiers");
        } catch (Exception e) {
            log.error("Failed to seed commission tiers: {}", e.getMessage(), e);
        }
    }

    private void initUsers() {
        try {
            createUserIfMissing("admin", "admin@snapup.local", "Platform Admin", UserRole.ADMIN);
            createUserIfMissing("thandi", "thandi@snapup.local", "Thandi Buyer", UserRole.USER);
            createUserIfMissing("sipho", "sipho@snapup.local", "Sipho Seller", UserRole.USER);
        } catch (Exception e) {
            log.error("Failed to seed users: {}", e.getMessage(), e);
        }
    }

    private void initListings() {
        try {
            if (listingRepository.count() > 0) {
                return;
            }
            User seller = userRepository.findByUsername("sipho").orElse(null);
            if (seller == null) {
                return;
            }
            Instant now = clock.instant();
            listingRepository.save(Listing.builder()
                    .seller(seller)
                    .title("Vintage denim jacket")
                    .price(100000L)
                    .status(ListingStatus.ACTIVE)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            listingRepository.save(Listing.builder()
                    .seller(seller)
                    .title("Road bike, 54cm")
                    .price(450000L)
                    .status(ListingStatus.ACTIVE)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            log.info("Seeded demo listings for seller {}", seller.getUsername());
        } catch (Exception e) {
            log.error("Failed to seed listings: {}", e.getMessage(), e);
        }
    }

    private void createUserIfMissing(String username, String email, String fullName, UserRole role) {
        if (userRepository.existsByUsername(username)) {
            return;
        }
        userRepository.save(User.builder()
                .username(username)
                .email(email)
                .fullName(fullName)
                .passwordHash(passwordEncoder.encode("password"))
                .role(role)
                .accountStatus("active")
                .joinedAt(clock.instant())
                .build());
        log.info("Seeded user {}", username);
    }
}
