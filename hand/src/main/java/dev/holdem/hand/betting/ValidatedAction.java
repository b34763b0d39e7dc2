package dev.holdem.hand.betting;

/**
 * An accepted action with its chip movement worked out.
 *
 * @param seatNumber acting seat
 * @param kind action kind
 * @param chips chips moving from the seat's stack into the pot
 * @param streetTotal the seat's committed amount for the street afterwards
 * @param allIn whether the seat commits its last chip
 */
public record ValidatedAction(int seatNumber, ActionKind kind, long chips, long streetTotal, boolean allIn) {
}
