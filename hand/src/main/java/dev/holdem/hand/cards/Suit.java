package dev.holdem.hand.cards;

public enum Suit {
    HEARTS('H'),
    DIAMONDS('D'),
    CLUBS('C'),
    SPADES('S');

    private final char symbol;

    Suit(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public static Suit fromSymbol(char symbol) {
        for (Suit suit : values()) {
            if (suit.symbol == Character.toUpperCase(symbol)) {
                return suit;
            }
        }
        throw new IllegalArgumentException("Unknown suit: " + symbol);
    }
}
