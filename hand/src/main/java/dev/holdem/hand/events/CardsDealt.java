package dev.holdem.hand.events;

import dev.holdem.hand.cards.Card;
import dev.holdem.table.Positions;

import java.util.List;
import java.util.Map;

/**
 * Hole cards were dealt. Carries private cards; never published as is.
 */
public record CardsDealt(long handNumber, Positions positions, Map<Integer, List<Card>> holeCards) implements HandEvent {

    public CardsDealt {
        holeCards = Map.copyOf(holeCards);
    }
}
