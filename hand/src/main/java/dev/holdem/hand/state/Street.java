package dev.holdem.hand.state;

/**
 * Betting phases of a hand, in order.
 */
public enum Street {
    PREFLOP(0),
    FLOP(3),
    TURN(1),
    RIVER(1),
    SHOWDOWN(0);

    private final int cardsDealt;

    Street(int cardsDealt) {
        this.cardsDealt = cardsDealt;
    }

    /**
     * Community cards dealt when this street begins.
     */
    public int cardsDealt() {
        return cardsDealt;
    }

    public Street next() {
        switch (this) {
            case PREFLOP: return FLOP;
            case FLOP: return TURN;
            case TURN: return RIVER;
            default: return SHOWDOWN;
        }
    }

    public boolean isBettingStreet() {
        return this != SHOWDOWN;
    }
}
