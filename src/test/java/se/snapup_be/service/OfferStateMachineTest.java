package se.snapup_be.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import se.snapup_be.exception.InvalidStateTransitionException;
import se.snapup_be.exception.StaleOfferStateException;
import se.snapup_be.exception.UnauthorizedException;
import se.snapup_be.pojo.enums.OfferAction;
import se.snapup_be.pojo.enums.OfferParty;
import se.snapup_be.pojo.enums.OfferStatus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OfferStateMachine Unit Tests")
class OfferStateMachineTest {

    private final OfferStateMachine stateMachine = new OfferStateMachine();

    @Test
    @DisplayName("Seller can counter, accept or decline a pending offer")
    void sellerActionsOnPending() {
        assertThat(stateMachine.next(OfferStatus.PENDING, OfferAction.COUNTER, OfferParty.SELLER))
                .isEqualTo(OfferStatus.COUNTERED);
        assertThat(stateMachine.next(OfferStatus.PENDING, OfferAction.ACCEPT, OfferParty.SELLER))
                .isEqualTo(OfferStatus.ACCEPTED);
        assertThat(stateMachine.next(OfferStatus.PENDING, OfferAction.DECLINE, OfferParty.SELLER))
                .isEqualTo(OfferStatus.DECLINED);
    }

    @Test
    @DisplayName("Buyer can withdraw a pending offer and answer a counter")
    void buyerActions() {
        assertThat(stateMachine.next(OfferStatus.PENDING, OfferAction.WITHDRAW, OfferParty.BUYER))
                .isEqualTo(OfferStatus.WITHDRAWN);
        assertThat(stateMachine.next(OfferStatus.COUNTERED, OfferAction.ACCEPT, OfferParty.BUYER))
                .isEqualTo(OfferStatus.ACCEPTED);
        assertThat(stateMachine.next(OfferStatus.COUNTERED, OfferAction.DECLINE, OfferParty.BUYER))
                .isEqualTo(OfferStatus.DECLINED);
    }

    @Test
    @DisplayName("Buyer cannot accept their own pending offer")
    void buyerCannotAcceptPending() {
        assertThatThrownBy(() -> stateMachine.next(OfferStatus.PENDING, OfferAction.ACCEPT, OfferParty.BUYER))
                .isInstanceOf(UnauthorizedException.class)
                .hasMessageContaining("seller");
    }

    @Test
    @DisplayName("Seller cannot accept their own counter")
    void sellerCannotAcceptCounter() {
        assertThatThrownBy(() -> stateMachine.next(OfferStatus.COUNTERED, OfferAction.ACCEPT, OfferParty.SELLER))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    @DisplayName("A countered offer cannot be countered again or withdrawn")
    void counteredIsNotCounterable() {
        assertThatThrownBy(() -> stateMachine.next(OfferStatus.COUNTERED, OfferAction.COUNTER, OfferParty.SELLER))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> stateMachine.next(OfferStatus.COUNTERED, OfferAction.WITHDRAW, OfferParty.BUYER))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("Non-parties are rejected before anything else")
    void nonPartyRejected() {
        assertThatThrownBy(() -> stateMachine.next(OfferStatus.ACCEPTED, OfferAction.ACCEPT, OfferParty.NONE))
                .isInstanceOf(UnauthorizedException.class);
    }

    @ParameterizedTest
    @EnumSource(value = OfferStatus.class, names = {"ACCEPTED", "DECLINED", "WITHDRAWN"})
    @DisplayName("Terminal offers reject every action as stale")
    void terminalStatesAreImmutable(OfferStatus terminal) {
        for (OfferAction action : OfferAction.values()) {
            assertThatThrownBy(() -> stateMachine.next(terminal, action, OfferParty.SELLER))
                    .isInstanceOf(StaleOfferStateException.class);
        }
    }

    @Test
    @DisplayName("Turn order follows the status")
    void partyToAct() {
        assertThat(stateMachine.partyToAct(OfferStatus.PENDING)).isEqualTo(OfferParty.SELLER);
        assertThat(stateMachine.partyToAct(OfferStatus.COUNTERED)).isEqualTo(OfferParty.BUYER);
        assertThat(stateMachine.partyToAct(OfferStatus.DECLINED)).isEqualTo(OfferParty.NONE);
    }
}
