package dev.holdem.table;

import dev.holdem.common.Errors;
import dev.holdem.table.state.SeatState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Computes button, blind and first-to-act seats.
 *
 * <p>Seats are ordered by ascending seat number and wrap around; "clockwise"
 * means towards the next higher seat number. Only seats that can be dealt in
 * ({@link SeatState#isEligibleForHand()}) take part.
 *
 * <p>The first hand of a table puts the button on the lowest eligible seat.
 * Afterwards the button moves to the next eligible seat after the previous
 * button, whether or not the previous button seat is still eligible.
 */
public final class PositionResolver {

    private PositionResolver() {}

    /**
     * Resolve positions for the next hand.
     *
     * @param seats all seats of the table in any order
     * @param previousButton button of the previous hand, or null for the first hand
     * @throws Errors.InsufficientPlayersError if fewer than two seats are eligible
     */
    public static Positions resolve(Collection<SeatState> seats, Integer previousButton) {
        List<Integer> eligible = new ArrayList<>();
        for (SeatState seat : seats) {
            if (seat.isEligibleForHand()) {
                eligible.add(seat.getSeatNumber());
            }
        }
        eligible.sort(Integer::compare);

        if (eligible.size() < 2) {
            throw new Errors.InsufficientPlayersError(eligible.size());
        }

        int button = previousButton == null
            ? eligible.get(0)
            : nextClockwise(eligible, previousButton);

        if (eligible.size() == 2) {
            int bigBlind = nextClockwise(eligible, button);
            return new Positions(button, button, bigBlind, button);
        }

        int smallBlind = nextClockwise(eligible, button);
        int bigBlind = nextClockwise(eligible, smallBlind);
        int underTheGun = nextClockwise(eligible, bigBlind);
        return new Positions(button, smallBlind, bigBlind, underTheGun);
    }

    /**
     * First seat after {@code from} among {@code candidates}, wrapping around.
     *
     * <p>{@code from} need not be a candidate itself.
     *
     * @param candidates seat numbers in ascending order
     * @return the next seat, or -1 if there are no candidates
     */
    public static int nextClockwise(List<Integer> candidates, int from) {
        if (candidates.isEmpty()) {
            return -1;
        }
        for (int seat : candidates) {
            if (seat > from) {
                return seat;
            }
        }
        return candidates.get(0);
    }

    /**
     * First seat after {@code from} in {@code seatOrder} that satisfies {@code accept}.
     *
     * @param seatOrder seat numbers in ascending order
     * @return the next accepted seat, or -1 if none is accepted
     */
    public static int nextClockwise(List<Integer> seatOrder, int from, IntPredicate accept) {
        List<Integer> accepted = new ArrayList<>();
        for (int seat : seatOrder) {
            if (accept.test(seat)) {
                accepted.add(seat);
            }
        }
        return nextClockwise(accepted, from);
    }
}
