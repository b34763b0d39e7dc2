package dev.holdem.hand.events;

import dev.holdem.hand.state.Street;

public record BettingRoundComplete(long handNumber, Street street, long potTotal) implements HandEvent {
}
