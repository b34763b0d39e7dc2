package dev.holdem.table.state;

/**
 * Participation status of a seat.
 *
 * <p>{@link #FOLDED} and {@link #ALL_IN} only occur while a hand is running;
 * between hands a seat is either {@link #PLAYING} or {@link #SITTING_OUT}.
 */
public enum SeatStatus {
    PLAYING,
    FOLDED,
    ALL_IN,
    SITTING_OUT;

    /**
     * Seats that still hold a claim on the pot.
     */
    public boolean isInHand() {
        return this == PLAYING || this == ALL_IN;
    }
}
