package dev.holdem.hand.events;

public record BlindPosted(
    long handNumber,
    int seatNumber,
    BlindType blindType,
    long amount,
    long chipCount,
    boolean allIn
) implements HandEvent {
}
