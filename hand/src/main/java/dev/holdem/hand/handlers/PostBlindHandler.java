package dev.holdem.hand.handlers;

import dev.holdem.common.Errors;
import dev.holdem.common.Validation;
import dev.holdem.hand.events.BlindPosted;
import dev.holdem.hand.events.BlindType;
import dev.holdem.hand.state.HandState;
import dev.holdem.hand.state.Street;
import dev.holdem.table.state.SeatState;
import dev.holdem.table.state.SeatStatus;
import dev.holdem.table.state.TableState;

/**
 * Functional handler for posting a blind.
 *
 * <p>Guard/validate/compute. A stack shorter than the blind posts all of it and goes all-in.
 */
public final class PostBlindHandler {

    private PostBlindHandler() {}

    /**
     * Post a blind.
     *
     * @param hand current hand
     * @param table current seats
     * @param seatNumber posting seat
     * @param blindType small or big
     * @param amount blind size from the table settings
     * @return the resulting event
     * @throws Errors.CommandRejectedError if the blind cannot be posted
     */
    public static BlindPosted handle(HandState hand, TableState table, int seatNumber, BlindType blindType, long amount) {
        // Guard
        if (hand.isComplete()) {
            throw Errors.CommandRejectedError.preconditionFailed("Hand is complete");
        }
        if (hand.getStreet() != Street.PREFLOP || hand.getRound() == null) {
            throw Errors.CommandRejectedError.preconditionFailed("Blinds are only posted before the flop");
        }

        // Validate
        SeatState seat = table.getSeat(seatNumber);
        if (seat == null || hand.getPlayer(seatNumber) == null) {
            throw Errors.CommandRejectedError.preconditionFailed("Seat " + seatNumber + " is not in the hand");
        }
        Validation.requirePositive(amount, "blind");

        // Compute
        long posted = seat.takeChips(amount);
        hand.getRound().postBlind(seatNumber, posted);
        hand.getPots().contribute(seatNumber, posted);
        boolean allIn = seat.getChipCount() == 0;
        if (allIn) {
            seat.setStatus(SeatStatus.ALL_IN);
            hand.getPots().markAllIn(seatNumber);
        }

        return new BlindPosted(hand.getHandNumber(), seatNumber, blindType, posted, seat.getChipCount(), allIn);
    }
}
