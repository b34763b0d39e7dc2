package dev.holdem.hand.events;

import dev.holdem.hand.betting.ActionKind;

/**
 * An action was applied.
 *
 * @param chips chips moved into the pot by this action
 * @param streetTotal the seat's committed amount on this street afterwards
 * @param chipCount the seat's remaining stack
 * @param potTotal chips in all pots afterwards
 */
public record ActionTaken(
    long handNumber,
    int seatNumber,
    ActionKind kind,
    long chips,
    long streetTotal,
    long chipCount,
    boolean allIn,
    long potTotal,
    boolean automatic
) implements HandEvent {
}
