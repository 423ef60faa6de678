package se.snapup_be.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.snapup_be.dto.response.DisputeResponse;
import se.snapup_be.exception.BusinessLogicException;
import se.snapup_be.exception.ErrorCode;
import se.snapup_be.exception.InvalidStateTransitionException;
import se.snapup_be.exception.ResourceNotFoundException;
import se.snapup_be.exception.UnauthorizedException;
import se.snapup_be.pojo.Dispute;
import se.snapup_be.pojo.EscrowHold;
import se.snapup_be.pojo.Order;
import se.snapup_be.pojo.User;
import se.snapup_be.pojo.enums.DisputeOutcome;
import se.snapup_be.pojo.enums.DisputeReason;
import se.snapup_be.pojo.enums.DisputeStatus;
import se.snapup_be.pojo.enums.EscrowStatus;
import se.snapup_be.pojo.enums.OrderStatus;
import se.snapup_be.pojo.enums.TrackingStatus;
import se.snapup_be.repository.DisputeRepository;
import se.snapup_be.repository.EscrowHoldRepository;
import se.snapup_be.repository.OrderRepository;
import se.snapup_be.repository.UserRepository;
import se.snapup_be.sync.ChangePublisher;
import se.snapup_be.sync.ChangeType;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Buyer disputes on shipped or delivered orders. An active dispute keeps the order's
 * hold DISPUTED; its resolution either resumes the hold or settles it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class DisputeService {

    private static final List<DisputeStatus> ACTIVE_STATUSES = List.of(DisputeStatus.OPEN, DisputeStatus.UNDER_REVIEW);

    private final DisputeRepository disputeRepository;
    private final OrderRepository orderRepository;
    private final EscrowHoldRepository escrowHoldRepository;
    private final UserRepository userRepository;
    private final EscrowService escrowService;
    private final TrackingService trackingService;
    private final ChangePublisher changePublisher;
    private final Clock clock;

    @Transactional
    public DisputeResponse openDispute(Long orderId, Long buyerId, DisputeReason reason,
                                       String description, List<String> evidenceUrls) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        if (!order.isBuyer(buyerId)) {
            throw new UnauthorizedException("Only the buyer can open a dispute on this order");
        }
        if (order.getStatus() != OrderStatus.SHIPPED && order.getStatus() != OrderStatus.DELIVERED) {
            throw new InvalidStateTransitionException(order.getStatus().name(), "open dispute");
        }
        Optional<EscrowHold> hold = escrowHoldRepository.findByOrderOrderId(orderId);
        if (hold.isPresent() && hold.get().getStatus() == EscrowStatus.RELEASED) {
            throw new BusinessLogicException(ErrorCode.INVALID_STATE_TRANSITION,
                    "Escrow for order " + orderId + " has already been released");
        }
        if (disputeRepository.existsByActiveKey(orderId)) {
            throw new BusinessLogicException(ErrorCode.INVALID_STATE_TRANSITION,
                    "Order " + orderId + " already has an open dispute");
        }
        if (disputeRepository.existsByOrderOrderIdAndStatusIn(orderId, EscrowService.SETTLING_STATUSES)) {
            throw new BusinessLogicException(ErrorCode.INVALID_STATE_TRANSITION,
                    "Escrow for order " + orderId + " has already been settled by an earlier dispute");
        }

        Instant now = clock.instant();
        Dispute dispute = disputeRepository.saveAndFlush(Dispute.builder()
                .order(order)
                .raisedBy(order.getBuyer())
                .reason(reason)
                .description(description)
                .evidenceUrls(evidenceUrls != null ? new ArrayList<>(evidenceUrls) : new ArrayList<>())
                .status(DisputeStatus.OPEN)
                .activeKey(orderId)
                .createdAt(now)
                .updatedAt(now)
                .build());
        Long disputeId = dispute.getDisputeId();

        escrowService.pauseForDispute(orderId);

        dispute = loadDispute(disputeId);
        changePublisher.disputeChanged(dispute, ChangeType.INSERT);
        log.info("Dispute {} opened on order {} by buyer {}: {}", disputeId, orderId, buyerId, reason);
        return DisputeResponse.fromEntity(dispute);
    }

    /**
     * Seller's answer. Accepting a refund resolves the dispute at once; otherwise it goes
     * to an administrator for review.
     */
    @Transactional
    public DisputeResponse respondToDispute(Long disputeId, Long sellerId, String response, boolean acceptRefund) {
        Dispute dispute = loadDispute(disputeId);
        if (!dispute.getOrder().isSeller(sellerId)) {
            throw new UnauthorizedException("Only the seller can respond to this dispute");
        }
        if (dispute.getStatus() != DisputeStatus.OPEN) {
            throw new InvalidStateTransitionException(dispute.getStatus().name(), "respond to dispute");
        }
        dispute.setSellerResponse(response);
        dispute.setUpdatedAt(clock.instant());
        disputeRepository.saveAndFlush(dispute);

        if (acceptRefund) {
            log.info("Seller {} accepted refund on dispute {}", sellerId, disputeId);
            return resolve(disputeId, dispute.getOrder().getSeller(), DisputeOutcome.REFUND_TO_BUYER, null,
                    "Seller accepted a full refund");
        }

        if (disputeRepository.compareAndSetStatus(disputeId, DisputeStatus.OPEN, DisputeStatus.UNDER_REVIEW, clock.instant()) == 0) {
            throw new InvalidStateTransitionException(loadDispute(disputeId).getStatus().name(), "respond to dispute");
        }
        Dispute updated = loadDispute(disputeId);
        changePublisher.disputeChanged(updated, ChangeType.UPDATE);
        log.info("Seller {} contested dispute {}, now under review", sellerId, disputeId);
        return DisputeResponse.fromEntity(updated);
    }

    @Transactional
    public DisputeResponse markUnderReview(Long disputeId, Long adminId) {
        if (disputeRepository.compareAndSetStatus(disputeId, DisputeStatus.OPEN, DisputeStatus.UNDER_REVIEW, clock.instant()) == 0) {
            throw new InvalidStateTransitionException(loadDispute(disputeId).getStatus().name(), "review dispute");
        }
        Dispute updated = loadDispute(disputeId);
        changePublisher.disputeChanged(updated, ChangeType.UPDATE);
        log.info("Dispute {} taken under review by admin {}", disputeId, adminId);
        return DisputeResponse.fromEntity(updated);
    }

    @Transactional
    public DisputeResponse resolveDispute(Long disputeId, Long adminId, DisputeOutcome outcome,
                                          Long resolutionAmount, String notes) {
        User admin = userRepository.findById(adminId)
                .orElseThrow(() -> new ResourceNotFoundException("User", adminId));
        return resolve(disputeId, admin, outcome, resolutionAmount, notes);
    }

    public DisputeResponse getOrderDispute(Long orderId, Long userId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
        if (!order.isParticipant(userId)) {
            throw new UnauthorizedException("You are not a party to this order");
        }
        return disputeRepository.findByOrderOrderIdOrderByCreatedAtDesc(orderId).stream()
                .findFirst()
                .map(DisputeResponse::fromEntity)
                .orElseThrow(() -> new ResourceNotFoundException("No dispute found for order " + orderId));
    }

    /**
     * Administrators see every active dispute, oldest first; users see their own.
     */
    public List<DisputeResponse> getDisputes(Long userId, boolean admin) {
        List<Dispute> disputes = admin
                ? disputeRepository.findByStatusInOrderByCreatedAtAsc(ACTIVE_STATUSES)
                : disputeRepository.findByParticipant(userId);
        return disputes.stream().map(DisputeResponse::fromEntity).collect(Collectors.toList());
    }

    private DisputeResponse resolve(Long disputeId, User resolvedBy, DisputeOutcome outcome,
                                    Long resolutionAmount, String notes) {
        Dispute dispute = loadDispute(disputeId);
        DisputeStatus current = dispute.getStatus();
        if (!current.isActive()) {
            throw new InvalidStateTransitionException(current.name(), "resolve dispute");
        }
        Order order = dispute.getOrder();
        Long orderId = order.getOrderId();
        OrderStatus orderStatus = order.getStatus();
        Optional<EscrowHold> hold = escrowHoldRepository.findByOrderOrderId(orderId);

        if (outcome == DisputeOutcome.SPLIT) {
            long ceiling = hold.map(EscrowHold::getAmount).orElse(order.getAmount());
            if (resolutionAmount == null || resolutionAmount <= 0 || resolutionAmount >= ceiling) {
                throw new BusinessLogicException(ErrorCode.INVALID_AMOUNT,
                        "Split refund must be greater than 0 and less than " + ceiling);
            }
        }

        Instant now = clock.instant();
        if (disputeRepository.close(disputeId, current, outcome.getResultingStatus(), now) == 0) {
            throw new InvalidStateTransitionException(loadDispute(disputeId).getStatus().name(), "resolve dispute");
        }

        if (hold.isPresent()) {
            if (outcome == DisputeOutcome.CLOSE) {
                escrowService.resumeAfterDispute(orderId);
            } else {
                escrowService.settleDispute(orderId, outcome, resolutionAmount);
            }
        } else if (outcome == DisputeOutcome.SPLIT || outcome == DisputeOutcome.RELEASE_TO_SELLER) {
            log.info("Dispute {} resolved as {} before order {} had an escrow hold, settling when delivery is confirmed",
                    disputeId, outcome, orderId);
        } else {
            log.info("Dispute {} resolved before order {} had an escrow hold", disputeId, orderId);
        }

        if (outcome == DisputeOutcome.REFUND_TO_BUYER
                && orderRepository.compareAndSetStatus(orderId, orderStatus, OrderStatus.REFUNDED, now) == 1) {
            Order refunded = orderRepository.findById(orderId)
                    .orElseThrow(() -> new ResourceNotFoundException("Order", orderId));
            trackingService.record(refunded, TrackingStatus.RETURNED, "system", "Refunded after dispute " + disputeId);
            changePublisher.orderChanged(refunded, ChangeType.UPDATE);
        }

        Dispute resolved = loadDispute(disputeId);
        resolved.setResolvedBy(userRepository.getReferenceById(resolvedBy.getUserId()));
        resolved.setResolution(outcome.name());
        resolved.setResolutionAmount(resolutionAmountFor(outcome, resolutionAmount, hold, order));
        resolved.setNotes(notes);
        resolved = disputeRepository.save(resolved);
        changePublisher.disputeChanged(resolved, ChangeType.UPDATE);

        log.info("Dispute {} on order {} resolved as {} by {}", disputeId, orderId, outcome, resolvedBy.getUserId());
        return DisputeResponse.fromEntity(resolved);
    }

    private Long resolutionAmountFor(DisputeOutcome outcome, Long requested, Optional<EscrowHold> hold, Order order) {
        switch (outcome) {
            case REFUND_TO_BUYER:
                return hold.map(EscrowHold::getAmount).orElse(order.getAmount());
            case SPLIT:
                return requested;
            default:
                return 0L;
        }
    }

    private Dispute loadDispute(Long disputeId) {
        return disputeRepository.findById(disputeId)
                .orElseThrow(() -> new ResourceNotFoundException("Dispute", disputeId));
    }
}
