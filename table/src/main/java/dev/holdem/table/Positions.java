package dev.holdem.table;

/**
 * Seat numbers holding the button and blinds for one hand.
 *
 * @param button dealer button
 * @param smallBlind small blind; equals the button heads-up
 * @param bigBlind big blind
 * @param firstToAct first seat to act preflop
 */
public record Positions(int button, int smallBlind, int bigBlind, int firstToAct) {

    public boolean isHeadsUp() {
        return button == smallBlind;
    }
}
