package dev.holdem.hand.eval;

import dev.holdem.hand.cards.Card;
import dev.holdem.hand.cards.Rank;
import dev.holdem.hand.cards.Suit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks the best five-card hand out of five to seven cards.
 */
public final class HandEvaluator {

    private static final int HAND_SIZE = 5;

    private HandEvaluator() {}

    /**
     * Strength of the best five-card hand from hole cards plus community cards.
     */
    public static HandStrength evaluate(List<Card> holeCards, List<Card> communityCards) {
        List<Card> all = new ArrayList<>(holeCards);
        all.addAll(communityCards);
        return evaluate(all);
    }

    /**
     * Strength of the best five-card hand among {@code cards}.
     *
     * @throws IllegalArgumentException unless 5 to 7 cards are given
     */
    public static HandStrength evaluate(List<Card> cards) {
        if (cards.size() < HAND_SIZE || cards.size() > 7) {
            throw new IllegalArgumentException("Need 5 to 7 cards, got " + cards.size());
        }

        HandStrength best = null;
        int n = cards.size();
        // every 5-card subset; at most C(7,5) = 21
        for (int a = 0; a < n; a++) {
            for (int b = a + 1; b < n; b++) {
                for (int c = b + 1; c < n; c++) {
                    for (int d = c + 1; d < n; d++) {
                        for (int e = d + 1; e < n; e++) {
                            HandStrength candidate = evaluateFive(List.of(
                                cards.get(a), cards.get(b), cards.get(c), cards.get(d), cards.get(e)));
                            if (best == null || candidate.beats(best)) {
                                best = candidate;
                            }
                        }
                    }
                }
            }
        }
        return best;
    }

    static HandStrength evaluateFive(List<Card> five) {
        List<Card> sorted = new ArrayList<>(five);
        sorted.sort(Comparator.comparing(Card::rank).reversed());

        Map<Rank, Integer> counts = new EnumMap<>(Rank.class);
        for (Card card : sorted) {
            counts.merge(card.rank(), 1, Integer::sum);
        }

        // ranks grouped by multiplicity, larger groups first, then higher rank
        List<Rank> grouped = new ArrayList<>(counts.keySet());
        grouped.sort(Comparator.<Rank>comparingInt(counts::get).thenComparing(r -> r).reversed());

        boolean flush = isFlush(sorted);
        Rank straightHigh = straightHigh(sorted, counts);

        if (straightHigh != null && flush) {
            return new HandStrength(HandCategory.STRAIGHT_FLUSH, List.of(straightHigh), sorted);
        }
        int largest = counts.get(grouped.get(0));
        if (largest == 4) {
            return new HandStrength(HandCategory.FOUR_OF_A_KIND, grouped, sorted);
        }
        if (largest == 3 && grouped.size() == 2) {
            return new HandStrength(HandCategory.FULL_HOUSE, grouped, sorted);
        }
        if (flush) {
            return new HandStrength(HandCategory.FLUSH, ranksOf(sorted), sorted);
        }
        if (straightHigh != null) {
            return new HandStrength(HandCategory.STRAIGHT, List.of(straightHigh), sorted);
        }
        if (largest == 3) {
            return new HandStrength(HandCategory.THREE_OF_A_KIND, grouped, sorted);
        }
        if (largest == 2 && grouped.size() == 3) {
            return new HandStrength(HandCategory.TWO_PAIR, grouped, sorted);
        }
        if (largest == 2) {
            return new HandStrength(HandCategory.PAIR, grouped, sorted);
        }
        return new HandStrength(HandCategory.HIGH_CARD, ranksOf(sorted), sorted);
    }

    private static boolean isFlush(List<Card> five) {
        Suit suit = five.get(0).suit();
        for (Card card : five) {
            if (card.suit() != suit) {
                return false;
            }
        }
        return true;
    }

    /**
     * Top rank of a straight, or null. A-2-3-4-5 is a five-high straight.
     */
    private static Rank straightHigh(List<Card> sortedDesc, Map<Rank, Integer> counts) {
        if (counts.size() != HAND_SIZE) {
            return null;
        }
        int high = sortedDesc.get(0).rank().value();
        int low = sortedDesc.get(HAND_SIZE - 1).rank().value();
        if (high - low == 4) {
            return sortedDesc.get(0).rank();
        }
        if (high == Rank.ACE.value() && sortedDesc.get(1).rank() == Rank.FIVE) {
            return Rank.FIVE;
        }
        return null;
    }

    private static List<Rank> ranksOf(List<Card> cards) {
        List<Rank> ranks = new ArrayList<>(cards.size());
        for (Card card : cards) {
            ranks.add(card.rank());
        }
        return ranks;
    }
}
