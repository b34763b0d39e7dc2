package dev.holdem.hand.cards;

/**
 * Card ranks, deuce low. The ace's low role in a wheel straight is handled by
 * the hand evaluator.
 */
public enum Rank {
    TWO(2, '2', "Two"),
    THREE(3, '3', "Three"),
    FOUR(4, '4', "Four"),
    FIVE(5, '5', "Five"),
    SIX(6, '6', "Six"),
    SEVEN(7, '7', "Seven"),
    EIGHT(8, '8', "Eight"),
    NINE(9, '9', "Nine"),
    TEN(10, 'T', "Ten"),
    JACK(11, 'J', "Jack"),
    QUEEN(12, 'Q', "Queen"),
    KING(13, 'K', "King"),
    ACE(14, 'A', "Ace");

    private final int value;
    private final char symbol;
    private final String displayName;

    Rank(int value, char symbol, String displayName) {
        this.value = value;
        this.symbol = symbol;
        this.displayName = displayName;
    }

    public int value() {
        return value;
    }

    public char symbol() {
        return symbol;
    }

    public String displayName() {
        return displayName;
    }

    public String pluralName() {
        return this == SIX ? "Sixes" : displayName + "s";
    }

    public static Rank fromSymbol(char symbol) {
        for (Rank rank : values()) {
            if (rank.symbol == Character.toUpperCase(symbol)) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown rank: " + symbol);
    }
}
