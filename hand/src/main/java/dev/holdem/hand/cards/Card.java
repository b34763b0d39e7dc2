package dev.holdem.hand.cards;

import java.util.ArrayList;
import java.util.List;

/**
 * A playing card; text form is rank symbol followed by suit symbol, e.g. {@code "AS"}, {@code "TD"}.
 */
public record Card(Rank rank, Suit suit) {

    public static Card parse(String text) {
        if (text == null || text.length() != 2) {
            throw new IllegalArgumentException("Card must be two characters, got: " + text);
        }
        return new Card(Rank.fromSymbol(text.charAt(0)), Suit.fromSymbol(text.charAt(1)));
    }

    /**
     * Parse a space-separated list such as {@code "AS KS QS"}.
     */
    public static List<Card> parseAll(String text) {
        List<Card> cards = new ArrayList<>();
        for (String token : text.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                cards.add(parse(token));
            }
        }
        return cards;
    }

    @Override
    public String toString() {
        return "" + rank.symbol() + suit.symbol();
    }
}
