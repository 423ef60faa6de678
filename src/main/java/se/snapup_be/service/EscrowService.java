package se.snapup_be.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import se.snapup_be.dto.response.DisputeResponse;
import se.snapup_be.dto.response.EscrowHoldResponse;
import se.snapup_be.dto.response.EscrowStatusResponse;
import se.snapup_be.dto.response.EscrowSummaryResponse;
import se.snapup_be.exception.BusinessLogicException;
import se.snapup_be.exception.ErrorCode;
import se.snapup_be.exception.InvalidStateTransitionException;
import se.snapup_be.exception.ResourceNotFoundException;
import se.snapup_be.exception.UnauthorizedException;
import se.snapup_be.pojo.Dispute;
import se.snapup_be.pojo.EscrowHold;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.ReleaseConditions;
import se.snapup_be.pojo.enums.DisputeOutcome;
import se.snapup_be.pojo.enums.DisputeStatus;
import se.snapup_be.pojo.enums.EscrowStatus;
import se.snapup_be.pojo.enums.OrderStatus;
import se.snapup_be.repository.DisputeRepository;
import se.snapup_be.repository.EscrowHoldRepository;
import se.snapup_be.repository.OrderRepository;
import se.snapup_be.sync.ChangePublisher;
import se.snapup_be.sync.ChangeType;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Escrow hold lifecycle for delivered orders.
 *
 * <p>A hold is created once per order with a release time fixed at
 * {@code deliveryConfirmedAt + hold window}. Disputes pause and resume it without moving
 * that time. Release happens either automatically once due or as part of a dispute
 * settlement, and a released hold is never written again.
 */
@Service
@Slf4j
public class EscrowService {

    /**
     * Dispute results that settle the hold. A dispute resolved this way before delivery is
     * applied to the hold as soon as it is created.
     */
    public static final Set<DisputeStatus> SETTLING_STATUSES =
            EnumSet.of(DisputeStatus.RESOLVED_NO_REFUND, DisputeStatus.RESOLVED_PARTIAL_REFUND);

    private final EscrowHoldRepository escrowHoldRepository;
    private final OrderRepository orderRepository;
    private final DisputeRepository disputeRepository;
    private final CommissionSchedule commissionSchedule;
    private final EscrowReleasePolicy releasePolicy;
    private final ChangePublisher changePublisher;
    private final TransactionTemplate requiresNewTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final Clock clock;
    private final Duration holdWindow;

    public EscrowService(EscrowHoldRepository escrowHoldRepository,
                         OrderRepository orderRepository,
                         DisputeRepository disputeRepository,
                         CommissionSchedule commissionSchedule,
                         EscrowReleasePolicy releasePolicy,
                         ChangePublisher changePublisher,
                         PlatformTransactionManager transactionManager,
                         Clock clock,
                         @Value("${snapup.escrow.hold-window:PT48H}") Duration holdWindow) {
        this.escrowHoldRepository = escrowHoldRepository;
        this.orderRepository = orderRepository;
        this.disputeRepository = disputeRepository;
        this.commissionSchedule = commissionSchedule;
        this.releasePolicy = releasePolicy;
        this.changePublisher = changePublisher;
        this.requiresNewTemplate = new TransactionTemplate(transactionManager);
        this.requiresNewTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
        this.clock = clock;
        this.holdWindow = holdWindow;
    }

    /**
     * Creates the hold for a delivered order in its own transaction. An existing hold,
     * including one inserted concurrently, is returned with {@code alreadyHeld = true}.
     */
    public HoldResult startHold(Long orderId, Instant deliveryConfirmedAt) {
        try {
            return requiresNewTemplate.execute(status -> createHold(orderId, deliveryConfirmedAt));
        } catch (DataIntegrityViolationException e) {
            log.info("Hold for order {} created concurrently, returning existing", orderId);
            return readOnlyTemplate.execute(status -> escrowHoldRepository.findByOrderOrderId(orderId)
                    .map(hold -> new HoldResult(EscrowHoldResponse.fromEntity(hold), true))
                    .orElseThrow(() -> e));
        }
    }

    /**
     * PENDING to DISPUTED. Returns empty when the order has no hold yet; a hold created
     * later starts out DISPUTED while the dispute is active.
     */
    @Transactional
    public Optional<EscrowHoldResponse> pauseForDispute(Long orderId) {
        Optional<EscrowHold> existing = escrowHoldRepository.findByOrderOrderId(orderId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        EscrowHold hold = existing.get();
        if (hold.getStatus() == EscrowStatus.DISPUTED) {
            return Optional.of(EscrowHoldResponse.fromEntity(hold));
        }
        if (escrowHoldRepository.compareAndSetStatus(orderId, EscrowStatus.PENDING, EscrowStatus.DISPUTED, clock.instant()) == 0) {
            EscrowHold current = loadHold(orderId);
            throw new BusinessLogicException(ErrorCode.INVALID_STATE_TRANSITION,
                    "Escrow for order " + orderId + " is already " + current.getStatus());
        }
        EscrowHold paused = loadHold(orderId);
        paused.getReleaseConditions().setNoActiveDispute(false);
        paused = escrowHoldRepository.save(paused);
        changePublisher.holdChanged(paused, ChangeType.UPDATE);

        log.info("Escrow for order {} paused by dispute, release time stays {}", orderId, paused.getReleaseAt());
        return Optional.of(EscrowHoldResponse.fromEntity(paused));
    }

    /**
     * DISPUTED back to PENDING on the original release time. If that time has passed the
     * next sweep releases the hold.
     */
    @Transactional
    public Optional<EscrowHoldResponse> resumeAfterDispute(Long orderId) {
        if (escrowHoldRepository.compareAndSetStatus(orderId, EscrowStatus.DISPUTED, EscrowStatus.PENDING, clock.instant()) == 0) {
            return escrowHoldRepository.findByOrderOrderId(orderId).map(EscrowHoldResponse::fromEntity);
        }
        EscrowHold resumed = loadHold(orderId);
        resumed.getReleaseConditions().setNoActiveDispute(true);
        resumed = escrowHoldRepository.save(resumed);
        changePublisher.holdChanged(resumed, ChangeType.UPDATE);

        log.info("Escrow for order {} resumed, releases at {}", orderId, resumed.getReleaseAt());
        return Optional.of(EscrowHoldResponse.fromEntity(resumed));
    }

    /**
     * Releases the hold if the server clock says it is due. Safe to call any number of
     * times: only one call performs the release, the rest see SETTLED.
     */
    @Transactional
    public AutoReleaseResult autoRelease(Long orderId) {
        EscrowHold hold = loadHold(orderId);
        Instant now = clock.instant();
        ReleaseDecision decision = releasePolicy.evaluateRelease(hold, now);
        if (decision.getType() != ReleaseDecisionType.RELEASE) {
            return new AutoReleaseResult(EscrowHoldResponse.fromEntity(hold), decision, false);
        }

        if (disputeRepository.existsByActiveKey(orderId)) {
            // dispute committed alongside a hold that started PENDING
            log.warn("Escrow for order {} is due but has an active dispute, pausing instead of releasing", orderId);
            pauseForDispute(orderId);
            EscrowHold paused = loadHold(orderId);
            return new AutoReleaseResult(EscrowHoldResponse.fromEntity(paused),
                    releasePolicy.evaluateRelease(paused, now), false);
        }
        if (escrowHoldRepository.release(orderId, EscrowStatus.PENDING, now) == 0) {
            EscrowHold current = loadHold(orderId);
            return new AutoReleaseResult(EscrowHoldResponse.fromEntity(current),
                    releasePolicy.evaluateRelease(current, now), false);
        }

        EscrowHold released = loadHold(orderId);
        ReleaseConditions conditions = released.getReleaseConditions();
        conditions.setDeliveryConfirmed(true);
        conditions.setDisputeWindowPassed(true);
        conditions.setNoActiveDispute(true);
        conditions.setAutoReleased(true);
        conditions.setSellerAmount(released.getNetSellerAmount());
        conditions.setRefundAmount(0L);
        released = escrowHoldRepository.save(released);
        changePublisher.holdChanged(released, ChangeType.UPDATE);

        log.info("Escrow for order {} auto-released: {} to seller {} after commission {}",
                orderId, released.getNetSellerAmount(), released.getSeller().getUserId(), released.getCommissionAmount());
        return new AutoReleaseResult(EscrowHoldResponse.fromEntity(released),
                releasePolicy.evaluateRelease(released, now), true);
    }

    /**
     * Final settlement of a disputed hold. {@code refundAmount} is used by SPLIT only.
     */
    @Transactional
    public EscrowHoldResponse settleDispute(Long orderId, DisputeOutcome outcome, Long refundAmount) {
        if (outcome == DisputeOutcome.CLOSE) {
            throw new IllegalArgumentException("CLOSE resumes the hold, it does not settle it");
        }
        EscrowHold hold = loadHold(orderId);
        long amount = hold.getAmount();
        if (outcome == DisputeOutcome.SPLIT && (refundAmount == null || refundAmount <= 0 || refundAmount >= amount)) {
            throw new BusinessLogicException(ErrorCode.INVALID_AMOUNT,
                    "Split refund must be greater than 0 and less than the held amount " + amount);
        }
        Instant now = clock.instant();
        // a hold created while the dispute was still uncommitted can be PENDING here
        if (escrowHoldRepository.release(orderId, EscrowStatus.DISPUTED, now) == 0
                && escrowHoldRepository.release(orderId, EscrowStatus.PENDING, now) == 0) {
            throw new InvalidStateTransitionException(loadHold(orderId).getStatus().name(), "settle dispute on hold");
        }
        return recordSettlement(orderId, outcome, refundAmount);
    }

    /**
     * Hold, active dispute and release decision for one order. Creates a missing hold for
     * a delivered order first.
     */
    public EscrowStatusResponse getEscrowStatus(Long orderId, Long userId) {
        Instant deliveredAt = readOnlyTemplate.execute(status -> {
            Order order = orderRepository.findById(orderId)
                    .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
            if (!order.isParticipant(userId)) {
                throw new UnauthorizedException("You are not a party to this order");
            }
            return order.getStatus() == OrderStatus.DELIVERED ? order.getDeliveredAt() : null;
        });
        if (deliveredAt != null) {
            repairMissingHold(orderId, deliveredAt);
        }

        return readOnlyTemplate.execute(status -> {
            Optional<EscrowHold> hold = escrowHoldRepository.findByOrderOrderId(orderId);
            DisputeResponse activeDispute = disputeRepository.findByActiveKey(orderId)
                    .map(DisputeResponse::fromEntity)
                    .orElse(null);
            return EscrowStatusResponse.builder()
                    .orderId(orderId)
                    .hold(hold.map(EscrowHoldResponse::fromEntity).orElse(null))
                    .activeDispute(activeDispute)
                    .decision(hold.map(h -> releasePolicy.evaluateRelease(h, clock.instant())).orElse(null))
                    .build();
        });
    }

    /**
     * Creates the hold for a delivered order whose hold is missing. Failures are logged;
     * the next read or sweep tries again.
     */
    public Optional<HoldResult> repairMissingHold(Long orderId, Instant deliveredAt) {
        Boolean exists = readOnlyTemplate.execute(status -> escrowHoldRepository.existsByOrderOrderId(orderId));
        if (Boolean.TRUE.equals(exists)) {
            return Optional.empty();
        }
        try {
            HoldResult result = startHold(orderId, deliveredAt);
            log.info("Repaired missing escrow hold for delivered order {}", orderId);
            return Optional.of(result);
        } catch (Exception e) {
            log.warn("Escrow hold repair for order {} failed, will retry: {}", orderId, e.getMessage());
            return Optional.empty();
        }
    }

    @Transactional(readOnly = true)
    public EscrowSummaryResponse getSellerEscrowSummary(Long sellerId) {
        EscrowSummaryResponse summary = EscrowSummaryResponse.builder().sellerId(sellerId).build();
        for (EscrowHold hold : escrowHoldRepository.findBySellerUserId(sellerId)) {
            switch (hold.getStatus()) {
                case PENDING:
                    summary.setHoldingAmount(summary.getHoldingAmount() + hold.getNetSellerAmount());
                    summary.setHoldingCount(summary.getHoldingCount() + 1);
                    break;
                case DISPUTED:
                    summary.setDisputedAmount(summary.getDisputedAmount() + hold.getNetSellerAmount());
                    summary.setDisputedCount(summary.getDisputedCount() + 1);
                    break;
                case RELEASED:
                    Long paid = hold.getReleaseConditions().getSellerAmount();
                    summary.setReleasedAmount(summary.getReleasedAmount() + (paid != null ? paid : 0L));
                    summary.setReleasedCount(summary.getReleasedCount() + 1);
                    break;
                default:
                    break;
            }
        }
        return summary;
    }

    @Transactional(readOnly = true)
    public List<Long> findOrderIdsDueForRelease() {
        return escrowHoldRepository.findDueForRelease(clock.instant()).stream()
                .map(hold -> hold.getOrder().getOrderId())
                .collect(Collectors.toList());
    }

    /**
     * Delivered orders with no hold, keyed by order id, with their delivery time.
     */
    @Transactional(readOnly = true)
    public Map<Long, Instant> findDeliveredOrdersWithoutHold() {
        Map<Long, Instant> missing = new LinkedHashMap<>();
        for (Order order : orderRepository.findDeliveredWithoutHold()) {
            missing.put(order.getOrderId(), order.getDeliveredAt() != null ? order.getDeliveredAt() : order.getUpdatedAt());
        }
        return missing;
    }

    private HoldResult createHold(Long orderId, Instant deliveryConfirmedAt) {
        Optional<EscrowHold> existing = escrowHoldRepository.findByOrderOrderId(orderId);
        if (existing.isPresent()) {
            return new HoldResult(EscrowHoldResponse.fromEntity(existing.get()), true);
        }

        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        if (order.getStatus() != OrderStatus.DELIVERED) {
            throw new InvalidStateTransitionException(order.getStatus().name(), "start escrow hold");
        }

        boolean disputed = disputeRepository.existsByActiveKey(orderId);
        Optional<Dispute> settledEarlier = disputed
                ? Optional.empty()
                : disputeRepository.findFirstByOrderOrderIdAndStatusInOrderByResolvedAtDesc(orderId, SETTLING_STATUSES);
        FeeBreakdown fee = commissionSchedule.computeFee(order.getAmount());
        Instant now = clock.instant();

        EscrowHold hold = escrowHoldRepository.saveAndFlush(EscrowHold.builder()
                .order(order)
                .buyer(order.getBuyer())
                .seller(order.getSeller())
                .amount(order.getAmount())
                .commissionAmount(fee.getFee())
                .netSellerAmount(fee.getNet())
                .status(disputed ? EscrowStatus.DISPUTED : EscrowStatus.PENDING)
                .deliveryConfirmedAt(deliveryConfirmedAt)
                .releaseAt(deliveryConfirmedAt.plus(holdWindow))
                .releaseConditions(ReleaseConditions.builder()
                        .deliveryConfirmed(true)
                        .noActiveDispute(!disputed)
                        .build())
                .createdAt(now)
                .updatedAt(now)
                .build());
        changePublisher.holdChanged(hold, ChangeType.INSERT);

        log.info("Escrow hold {} started for order {}: {} held, releases at {}{}", hold.getHoldId(), orderId,
                hold.getAmount(), hold.getReleaseAt(), disputed ? " (disputed)" : "");

        if (settledEarlier.isPresent()) {
            Dispute dispute = settledEarlier.get();
            DisputeOutcome outcome = DisputeOutcome.forStatus(dispute.getStatus());
            log.info("Order {} had dispute {} resolved as {} before delivery, settling the new hold",
                    orderId, dispute.getDisputeId(), outcome);
            if (escrowHoldRepository.release(orderId, EscrowStatus.PENDING, now) == 0) {
                throw new InvalidStateTransitionException(loadHold(orderId).getStatus().name(), "settle dispute on hold");
            }
            return new HoldResult(recordSettlement(orderId, outcome, dispute.getResolutionAmount()), false);
        }
        return new HoldResult(EscrowHoldResponse.fromEntity(hold), false);
    }

    private EscrowHoldResponse recordSettlement(Long orderId, DisputeOutcome outcome, Long refundAmount) {
        EscrowHold settled = loadHold(orderId);
        long amount = settled.getAmount();
        ReleaseConditions conditions = settled.getReleaseConditions();
        conditions.setNoActiveDispute(true);
        switch (outcome) {
            case RELEASE_TO_SELLER:
                conditions.setAdminReleased(true);
                conditions.setRefundAmount(0L);
                conditions.setSellerAmount(settled.getNetSellerAmount());
                break;
            case REFUND_TO_BUYER:
                conditions.setAdminRefunded(true);
                conditions.setRefundAmount(amount);
                conditions.setSellerAmount(0L);
                settled.setCommissionAmount(0L);
                settled.setNetSellerAmount(0L);
                break;
            case SPLIT:
                FeeBreakdown sellerShare = commissionSchedule.computeFee(amount - refundAmount);
                conditions.setAdminSplit(true);
                conditions.setRefundAmount(refundAmount);
                conditions.setSellerAmount(sellerShare.getNet());
                settled.setCommissionAmount(sellerShare.getFee());
                settled.setNetSellerAmount(sellerShare.getNet());
                break;
            default:
                break;
        }
        settled = escrowHoldRepository.save(settled);
        changePublisher.holdChanged(settled, ChangeType.UPDATE);

        log.info("Escrow for order {} settled by dispute outcome {}: refund {}, seller {}",
                orderId, outcome, conditions.getRefundAmount(), conditions.getSellerAmount());
        return EscrowHoldResponse.fromEntity(settled);
    }

    private EscrowHold loadHold(Long orderId) {
        return escrowHoldRepository.findByOrderOrderId(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Escrow hold for order " + orderId + " not found"));
    }
}
