package se.snapup_be.service;

import org.springframework.stereotype.Component;
import se.snapup_be.exception.InvalidStateTransitionException;
import se.snapup_be.exception.StaleOfferStateException;
import se.snapup_be.exception.UnauthorizedException;
import se.snapup_be.pojo.enums.OfferAction;
import se.snapup_be.pojo.enums.OfferParty;
import se.snapup_be.pojo.enums.OfferStatus;

/**
 * Offer transition table. Pure: no persistence, no clock.
 *
 * <pre>
 * PENDING   --counter(seller)-->  COUNTERED
 * PENDING   --accept(seller)--->  ACCEPTED
 * PENDING   --decline(seller)-->  DECLINED
 * PENDING   --withdraw(buyer)-->  WITHDRAWN
 * COUNTERED --accept(buyer)---->  ACCEPTED
 * COUNTERED --decline(buyer)--->  DECLINED
 * </pre>
 */
@Component
public class OfferStateMachine {

    /**
     * @return the status the offer moves to
     * @throws UnauthorizedException           actor is not a party, or not the party whose turn it is
     * @throws StaleOfferStateException        the offer is already terminal (no snapshot attached)
     * @throws InvalidStateTransitionException the action never applies from the current status
     */
    public OfferStatus next(OfferStatus current, OfferAction action, OfferParty actor) {
        if (actor == OfferParty.NONE) {
            throw new UnauthorizedException("You are not a party to this offer");
        }
        if (current.isTerminal()) {
            throw new StaleOfferStateException("Offer is already " + current, null);
        }

        OfferParty expectedActor = expectedActor(current, action);
        if (actor != expectedActor) {
            throw new UnauthorizedException(String.format("Only the %s can %s an offer that is %s",
                    expectedActor.name().toLowerCase(), action.name().toLowerCase(), current));
        }
        return target(action);
    }

    /**
     * Whose turn it is to act on an offer in the given non-terminal status, or NONE if
     * the thread is closed.
     */
    public OfferParty partyToAct(OfferStatus current) {
        switch (current) {
            case PENDING:
                return OfferParty.SELLER;
            case COUNTERED:
                return OfferParty.BUYER;
            default:
                return OfferParty.NONE;
        }
    }

    private OfferParty expectedActor(OfferStatus current, OfferAction action) {
        switch (action) {
            case COUNTER:
                requireStatus(current, OfferStatus.PENDING, action);
                return OfferParty.SELLER;
            case WITHDRAW:
                requireStatus(current, OfferStatus.PENDING, action);
                return OfferParty.BUYER;
            case ACCEPT:
            case DECLINE:
                return partyToAct(current);
            default:
                throw new InvalidStateTransitionException(current.name(), action.name());
        }
    }

    private void requireStatus(OfferStatus current, OfferStatus required, OfferAction action) {
        if (current != required) {
            throw new InvalidStateTransitionException(current.name(), action.name());
        }
    }

    private OfferStatus target(OfferAction action) {
        switch (action) {
            case COUNTER:
                return OfferStatus.COUNTERED;
            case ACCEPT:
                return OfferStatus.ACCEPTED;
            case DECLINE:
                return OfferStatus.DECLINED;
            case WITHDRAW:
                return OfferStatus.WITHDRAWN;
            default:
                throw new IllegalArgumentException("Unknown action " + action);
        }
    }
}
