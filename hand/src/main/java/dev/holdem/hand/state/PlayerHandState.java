package dev.holdem.hand.state;

import dev.holdem.hand.cards.Card;
import dev.holdem.hand.eval.HandStrength;

import java.util.ArrayList;
import java.util.List;

/**
 * A seat's private part of a hand.
 */
public class PlayerHandState {

    private final int seatNumber;
    private final String occupantId;
    private final List<Card> holeCards = new ArrayList<>();
    private HandStrength shownHand;

    public PlayerHandState(int seatNumber, String occupantId) {
        this.seatNumber = seatNumber;
        this.occupantId = occupantId;
    }

    public int getSeatNumber() { return seatNumber; }
    public String getOccupantId() { return occupantId; }
    public List<Card> getHoleCards() { return holeCards; }

    /**
     * Hand revealed at showdown, or null while the cards are private.
     */
    public HandStrength getShownHand() { return shownHand; }
    public void setShownHand(HandStrength shownHand) { this.shownHand = shownHand; }

    public boolean isShown() {
        return shownHand != null;
    }

    public void forfeitCards() {
        holeCards.clear();
    }

    public PlayerHandState copy() {
        PlayerHandState copy = new PlayerHandState(seatNumber, occupantId);
        copy.holeCards.addAll(holeCards);
        copy.shownHand = shownHand;
        return copy;
    }
}
