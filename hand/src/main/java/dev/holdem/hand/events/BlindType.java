package dev.holdem.hand.events;

public enum BlindType {
    SMALL,
    BIG
}
