package dev.holdem.hand.cards;

import dev.holdem.common.Errors;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * An ordered pile of cards drawn from the top (index 0).
 *
 * <p>A deck belongs to exactly one hand and is never shared.
 */
public class Deck {

    private final List<Card> cards;

    private Deck(List<Card> cards) {
        this.cards = cards;
    }

    /**
     * The 52 standard cards in suit-then-rank order.
     */
    public static Deck create() {
        List<Card> cards = new ArrayList<>(52);
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                cards.add(new Card(rank, suit));
            }
        }
        return new Deck(cards);
    }

    /**
     * A deck whose top cards are exactly {@code cards}, in order.
     */
    public static Deck of(Collection<Card> cards) {
        return new Deck(new ArrayList<>(cards));
    }

    /**
     * Uniformly permute the remaining cards.
     */
    public Deck shuffle(Random random) {
        Collections.shuffle(cards, random);
        return this;
    }

    /**
     * Remove and return the top {@code n} cards.
     *
     * @throws Errors.DeckExhaustedError if fewer than {@code n} cards remain
     */
    public List<Card> draw(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("Cannot draw a negative number of cards");
        }
        if (n > cards.size()) {
            throw new Errors.DeckExhaustedError(n, cards.size());
        }
        List<Card> top = cards.subList(0, n);
        List<Card> drawn = new ArrayList<>(top);
        top.clear();
        return drawn;
    }

    public Card drawOne() {
        return draw(1).get(0);
    }

    public int remaining() {
        return cards.size();
    }

    public List<Card> getCards() {
        return Collections.unmodifiableList(cards);
    }

    public Deck copy() {
        return new Deck(new ArrayList<>(cards));
    }
}
