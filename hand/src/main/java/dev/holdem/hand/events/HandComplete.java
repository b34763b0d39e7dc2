package dev.holdem.hand.events;

import java.util.Map;

/**
 * @param chipCounts stacks of the dealt-in seats after payout
 */
public record HandComplete(long handNumber, Map<Integer, Long> chipCounts) implements HandEvent {

    public HandComplete {
        chipCounts = Map.copyOf(chipCounts);
    }
}
