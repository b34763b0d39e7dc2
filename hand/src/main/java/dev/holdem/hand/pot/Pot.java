package dev.holdem.hand.pot;

import java.util.List;

/**
 * One layer of the pot: the main pot is index 0, side pots follow in creation order.
 *
 * @param amount chips in this layer
 * @param eligibleSeats non-folded seats that contributed to this layer, ascending
 */
public record Pot(long amount, List<Integer> eligibleSeats) {

    public Pot {
        eligibleSeats = List.copyOf(eligibleSeats);
    }
}
