package dev.holdem.hand.events;

import dev.holdem.hand.cards.Card;
import dev.holdem.hand.state.Street;

import java.util.List;

/**
 * @param cards cards dealt for this street
 * @param board the whole board afterwards
 */
public record CommunityCardsDealt(long handNumber, Street street, List<Card> cards, List<Card> board)
        implements HandEvent {

    public CommunityCardsDealt {
        cards = List.copyOf(cards);
        board = List.copyOf(board);
    }
}
