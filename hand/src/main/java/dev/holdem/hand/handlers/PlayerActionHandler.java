package dev.holdem.hand.handlers;

import dev.holdem.common.Errors;
import dev.holdem.hand.betting.Action;
import dev.holdem.hand.betting.ActionKind;
import dev.holdem.hand.betting.ActionValidator;
import dev.holdem.hand.betting.ValidatedAction;
import dev.holdem.hand.events.ActionTaken;
import dev.holdem.hand.state.HandState;
import dev.holdem.table.state.SeatState;
import dev.holdem.table.state.SeatStatus;
import dev.holdem.table.state.TableState;

/**
 * Functional handler for a seat's betting action.
 *
 * <p>Validation is delegated to {@link ActionValidator}; on acceptance the
 * chips leave the stack, the pot accountant is credited, then the betting
 * round records the action. Turn advancement is left to the caller.
 */
public final class PlayerActionHandler {

    private PlayerActionHandler() {}

    /**
     * Handle a player action.
     *
     * @param hand current hand
     * @param table current seats
     * @param action the request
     * @param automatic true when the engine acts for a timed-out seat
     * @return the resulting event
     * @throws Errors.NotYourTurnError if another seat is to act
     * @throws Errors.InvalidActionError if the action is illegal
     */
    public static ActionTaken handle(HandState hand, TableState table, Action action, boolean automatic) {
        // Guard and validate
        SeatState seat = table.getSeat(action.seatNumber());
        ValidatedAction accepted = ActionValidator.validate(
            hand.getRound(), seat, action, hand.isAcceptingActions(), table.getSettings().bigBlind());

        // Compute
        int seatNumber = accepted.seatNumber();
        if (accepted.kind() == ActionKind.FOLD) {
            seat.setStatus(SeatStatus.FOLDED);
            hand.getPots().markFolded(seatNumber);
            hand.getPlayer(seatNumber).forfeitCards();
        } else if (accepted.chips() > 0) {
            seat.takeChips(accepted.chips());
            hand.getPots().contribute(seatNumber, accepted.chips());
            if (accepted.allIn()) {
                seat.setStatus(SeatStatus.ALL_IN);
                hand.getPots().markAllIn(seatNumber);
            }
        }
        hand.getRound().apply(accepted);

        return new ActionTaken(
            hand.getHandNumber(),
            seatNumber,
            accepted.kind(),
            accepted.chips(),
            accepted.streetTotal(),
            seat.getChipCount(),
            accepted.allIn(),
            hand.getPots().total(),
            automatic);
    }
}
