package dev.holdem.hand.betting;

import java.util.List;

/**
 * What the seat to act may do.
 *
 * @param seatNumber seat to act
 * @param actions legal action kinds
 * @param callAmount chips a call would move, 0 when there is nothing to call
 * @param minTotal smallest legal bet or raise-to total, 0 when neither is legal
 * @param maxTotal largest legal bet or raise-to total (the seat's whole stack)
 */
public record LegalActions(int seatNumber, List<ActionKind> actions, long callAmount, long minTotal, long maxTotal) {

    public LegalActions {
        actions = List.copyOf(actions);
    }

    public static LegalActions none(int seatNumber) {
        return new LegalActions(seatNumber, List.of(), 0, 0, 0);
    }

    public boolean allows(ActionKind kind) {
        return actions.contains(kind);
    }
}
