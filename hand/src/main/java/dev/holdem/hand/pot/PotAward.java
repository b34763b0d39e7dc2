package dev.holdem.hand.pot;

/**
 * Chips from one pot paid to one seat.
 *
 * @param potIndex 0 for the main pot, 1.. for side pots
 * @param seatNumber receiving seat
 * @param amount chips paid
 */
public record PotAward(int potIndex, int seatNumber, long amount) {
}
