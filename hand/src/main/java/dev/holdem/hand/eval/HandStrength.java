package dev.holdem.hand.eval;

import dev.holdem.hand.cards.Card;
import dev.holdem.hand.cards.Rank;

import java.util.List;

/**
 * Comparable strength of a five-card hand.
 *
 * <p>Ordered by category, then by {@code tiebreakers} compared pairwise. The
 * tiebreakers list the ranks that decide within a category, most significant
 * first: for a full house the trips rank then the pair rank, for a straight
 * only its top card (a five for the wheel). Equal strengths split a pot.
 *
 * <p>Note: the natural ordering is inconsistent with {@code equals}. Two
 * hands made of different suits compare as 0 but are not equal, since
 * {@code equals} also compares {@code cards}. Use {@link #ties} to test for
 * a split, and do not put strengths in sorted sets or as sorted map keys.
 *
 * @param category hand category
 * @param tiebreakers deciding ranks, most significant first
 * @param cards the five cards that make the hand
 */
public record HandStrength(HandCategory category, List<Rank> tiebreakers, List<Card> cards)
        implements Comparable<HandStrength> {

    public HandStrength {
        tiebreakers = List.copyOf(tiebreakers);
        cards = List.copyOf(cards);
    }

    @Override
    public int compareTo(HandStrength other) {
        int byCategory = category.compareTo(other.category);
        if (byCategory != 0) {
            return byCategory;
        }
        for (int i = 0; i < Math.min(tiebreakers.size(), other.tiebreakers.size()); i++) {
            int byRank = Integer.compare(tiebreakers.get(i).value(), other.tiebreakers.get(i).value());
            if (byRank != 0) {
                return byRank;
            }
        }
        return 0;
    }

    public boolean beats(HandStrength other) {
        return compareTo(other) > 0;
    }

    public boolean ties(HandStrength other) {
        return compareTo(other) == 0;
    }

    /**
     * Human-readable description, e.g. "Full House, Kings over Fours".
     */
    public String describe() {
        Rank top = tiebreakers.get(0);
        switch (category) {
            case STRAIGHT_FLUSH:
                return top == Rank.ACE ? "Royal Flush" : "Straight Flush, " + top.displayName() + " high";
            case FOUR_OF_A_KIND:
                return "Four of a Kind, " + top.pluralName();
            case FULL_HOUSE:
                return "Full House, " + top.pluralName() + " over " + tiebreakers.get(1).pluralName();
            case FLUSH:
                return "Flush, " + top.displayName() + " high";
            case STRAIGHT:
                return "Straight, " + top.displayName() + " high";
            case THREE_OF_A_KIND:
                return "Three of a Kind, " + top.pluralName();
            case TWO_PAIR:
                return "Two Pair, " + top.pluralName() + " and " + tiebreakers.get(1).pluralName();
            case PAIR:
                return "Pair of " + top.pluralName();
            default:
                return "High Card, " + top.displayName();
        }
    }

    @Override
    public String toString() {
        return describe() + " " + cards;
    }
}
