package dev.holdem.hand.betting;

import dev.holdem.common.Errors;
import dev.holdem.table.state.SeatState;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether an action is legal for the seat to act and fixes its chip amount.
 *
 * <p>Pure: the round and seat are only read.
 */
public final class ActionValidator {

    private ActionValidator() {}

    /**
     * Validate a proposed action.
     *
     * @param round current betting round
     * @param seat the acting seat
     * @param action proposed action
     * @param acceptingActions false once the hand is complete or at showdown
     * @param bigBlind minimum opening bet
     * @return the accepted action with its chip movement
     * @throws Errors.InvalidActionError if the hand is not accepting actions, the seat cannot act,
     *         or the kind or amount is illegal
     * @throws Errors.NotYourTurnError if another seat is to act
     */
    public static ValidatedAction validate(
            BettingRound round, SeatState seat, Action action, boolean acceptingActions, long bigBlind) {
        // Guard
        if (!acceptingActions || round.getStatus() != RoundStatus.AWAITING_ACTION) {
            throw new Errors.InvalidActionError("Hand is not accepting actions");
        }
        if (action.seatNumber() != round.getSeatToAct()) {
            throw new Errors.NotYourTurnError(action.seatNumber(), round.getSeatToAct());
        }
        if (seat == null || !seat.isPlaying()) {
            throw new Errors.InvalidActionError("Seat " + action.seatNumber() + " cannot act");
        }
        if (action.kind() == null) {
            throw new Errors.InvalidActionError("Action kind is required");
        }

        // Validate amount presence
        if (action.kind().takesAmount()) {
            if (action.amount() == null || action.amount() <= 0) {
                throw new Errors.InvalidActionError(action.kind().name().toLowerCase() + " requires a positive amount");
            }
        } else if (action.amount() != null) {
            throw new Errors.InvalidActionError("amount is only allowed for bet and raise");
        }

        // Compute
        int seatNumber = action.seatNumber();
        long stack = seat.getChipCount();
        long committed = round.committedBy(seatNumber);
        long toCall = round.getCurrentBet() - committed;

        switch (action.kind()) {
            case FOLD:
                return new ValidatedAction(seatNumber, ActionKind.FOLD, 0, committed, false);

            case CHECK:
                if (toCall > 0) {
                    throw new Errors.InvalidActionError("Cannot check, must call or fold");
                }
                return new ValidatedAction(seatNumber, ActionKind.CHECK, 0, committed, false);

            case CALL: {
                if (toCall <= 0) {
                    throw new Errors.InvalidActionError("Nothing to call");
                }
                long chips = Math.min(toCall, stack);
                return new ValidatedAction(seatNumber, ActionKind.CALL, chips, committed + chips, chips == stack);
            }

            case BET: {
                if (round.getCurrentBet() > 0) {
                    throw new Errors.InvalidActionError("Cannot bet when there is already a bet, raise instead");
                }
                long amount = action.amount();
                if (amount > stack) {
                    throw new Errors.InvalidActionError("Bet of " + amount + " exceeds chip count " + stack);
                }
                if (amount < bigBlind && amount < stack) {
                    throw new Errors.InvalidActionError("Bet must be at least the big blind (" + bigBlind + ")");
                }
                return new ValidatedAction(seatNumber, ActionKind.BET, amount, committed + amount, amount == stack);
            }

            case RAISE: {
                if (round.getCurrentBet() == 0) {
                    throw new Errors.InvalidActionError("Cannot raise when there is no bet, bet instead");
                }
                if (!round.mayRaise(seatNumber)) {
                    throw new Errors.InvalidActionError("Betting was not reopened, only call or fold");
                }
                long maxTotal = committed + stack;
                if (maxTotal <= round.getCurrentBet()) {
                    throw new Errors.InvalidActionError("Not enough chips to raise, call instead");
                }
                long target = Math.min(action.amount(), maxTotal);
                if (target <= round.getCurrentBet()) {
                    throw new Errors.InvalidActionError("Raise must exceed the current bet of " + round.getCurrentBet());
                }
                long increment = target - round.getCurrentBet();
                if (increment < round.getMinRaise() && target < maxTotal) {
                    throw new Errors.InvalidActionError(
                        "Raise must be to at least " + (round.getCurrentBet() + round.getMinRaise()));
                }
                long chips = target - committed;
                return new ValidatedAction(seatNumber, ActionKind.RAISE, chips, target, chips == stack);
            }

            default:
                throw new Errors.InvalidActionError("Invalid action");
        }
    }

    /**
     * Legal actions for the seat currently to act.
     */
    public static LegalActions legalActions(BettingRound round, SeatState seat, long bigBlind) {
        if (round.getStatus() != RoundStatus.AWAITING_ACTION || seat == null
                || seat.getSeatNumber() != round.getSeatToAct() || !seat.isPlaying()) {
            return LegalActions.none(seat != null ? seat.getSeatNumber() : -1);
        }

        int seatNumber = seat.getSeatNumber();
        long stack = seat.getChipCount();
        long committed = round.committedBy(seatNumber);
        long toCall = Math.max(0, round.getCurrentBet() - committed);
        long maxTotal = committed + stack;

        List<ActionKind> actions = new ArrayList<>();
        actions.add(ActionKind.FOLD);
        long minTotal = 0;
        long max = 0;

        if (toCall == 0) {
            actions.add(ActionKind.CHECK);
        } else {
            actions.add(ActionKind.CALL);
        }

        if (round.getCurrentBet() == 0) {
            actions.add(ActionKind.BET);
            minTotal = Math.min(bigBlind, stack);
            max = stack;
        } else if (round.mayRaise(seatNumber) && maxTotal > round.getCurrentBet()) {
            actions.add(ActionKind.RAISE);
            minTotal = Math.min(round.getCurrentBet() + round.getMinRaise(), maxTotal);
            max = maxTotal;
        }

        return new LegalActions(seatNumber, actions, Math.min(toCall, stack), minTotal, max);
    }
}
