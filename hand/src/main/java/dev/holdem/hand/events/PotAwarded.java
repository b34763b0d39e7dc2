package dev.holdem.hand.events;

import dev.holdem.hand.eval.HandStrength;
import dev.holdem.hand.pot.PotAward;

import java.util.List;
import java.util.Map;

/**
 * Pots were paid out.
 *
 * @param awards payouts, pot by pot
 * @param shownHands hands revealed at showdown; empty when the pot was uncontested
 */
public record PotAwarded(long handNumber, List<PotAward> awards, Map<Integer, HandStrength> shownHands)
        implements HandEvent {

    public PotAwarded {
        awards = List.copyOf(awards);
        shownHands = Map.copyOf(shownHands);
    }

    public boolean wentToShowdown() {
        return !shownHands.isEmpty();
    }
}
