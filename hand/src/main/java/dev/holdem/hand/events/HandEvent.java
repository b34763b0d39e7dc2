package dev.holdem.hand.events;

/**
 * Something that happened in a hand. A transition's events travel with the state it commits.
 */
public interface HandEvent {

    long handNumber();
}
