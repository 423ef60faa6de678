package se.snapup_be.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import se.snapup_be.pojo.EscrowHold;
import se.snapup_be.pojo.Listing;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.User;
import se.snapup_be.pojo.enums.EscrowStatus;
import se.snapup_be.pojo.enums.OrderStatus;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@DisplayName("EscrowHoldRepository Tests")
class EscrowHoldRepositoryTest {

    private static final Instant DELIVERED = Instant.parse("2025-03-01T10:00:00Z");
    private static final Instant RELEASE_AT = DELIVERED.plus(Duration.ofHours(48));

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private EscrowHoldRepository escrowHoldRepository;

    @Autowired
    private OrderRepository orderRepository;

    private Order order;

    @BeforeEach
    void setUp() {
        User buyer = entityManager.persist(User.builder()
                .username("thandi").email("thandi@test.local").passwordHash("x").joinedAt(DELIVERED).build());
        User seller = entityManager.persist(User.builder()
                .username("sipho").email("sipho@test.local").passwordHash("x").joinedAt(DELIVERED).build());
        Listing listing = entityManager.persist(Listing.builder()
                .seller(seller).title("Denim jacket").price(100000L).createdAt(DELIVERED).updatedAt(DELIVERED).build());
        order = entityManager.persist(Order.builder()
                .listing(listing).buyer(buyer).seller(seller)
                .amount(90000L).serviceFee(9000L).total(99000L)
                .status(OrderStatus.DELIVERED)
                .deliveredAt(DELIVERED)
                .createdAt(DELIVERED).updatedAt(DELIVERED)
                .build());
        entityManager.flush();
    }

    private EscrowHold newHold() {
        return EscrowHold.builder()
                .order(order)
                .buyer(order.getBuyer())
                .seller(order.getSeller())
                .amount(90000L)
                .commissionAmount(9000L)
                .netSellerAmount(81000L)
                .status(EscrowStatus.PENDING)
                .deliveryConfirmedAt(DELIVERED)
                .releaseAt(RELEASE_AT)
                .createdAt(DELIVERED)
                .updatedAt(DELIVERED)
                .build();
    }

    @Test
    @DisplayName("An order can have only one hold")
    void oneHoldPerOrder() {
        escrowHoldRepository.saveAndFlush(newHold());

        assertThatThrownBy(() -> escrowHoldRepository.saveAndFlush(newHold()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Only holds past their release time are due")
    void findDueForRelease() {
        escrowHoldRepository.saveAndFlush(newHold());

        assertThat(escrowHoldRepository.findDueForRelease(RELEASE_AT.minusSeconds(1))).isEmpty();
        assertThat(escrowHoldRepository.findDueForRelease(RELEASE_AT)).hasSize(1);
    }

    @Test
    @DisplayName("Release happens once; the second attempt updates nothing")
    void releaseIsConditional() {
        escrowHoldRepository.saveAndFlush(newHold());

        assertThat(escrowHoldRepository.release(order.getOrderId(), EscrowStatus.PENDING, RELEASE_AT)).isEqualTo(1);
        assertThat(escrowHoldRepository.release(order.getOrderId(), EscrowStatus.PENDING, RELEASE_AT.plusSeconds(1))).isZero();

        EscrowHold released = escrowHoldRepository.findByOrderOrderId(order.getOrderId()).orElseThrow();
        assertThat(released.getStatus()).isEqualTo(EscrowStatus.RELEASED);
        assertThat(released.getReleasedAt()).isEqualTo(RELEASE_AT);
        assertThat(released.getReleaseAt()).isEqualTo(RELEASE_AT);
    }

    @Test
    @DisplayName("Delivered orders without a hold are found for repair")
    void deliveredWithoutHold() {
        assertThat(orderRepository.findDeliveredWithoutHold()).extracting(Order::getOrderId)
                .containsExactly(order.getOrderId());

        escrowHoldRepository.saveAndFlush(newHold());

        assertThat(orderRepository.findDeliveredWithoutHold()).isEmpty();
    }
}
