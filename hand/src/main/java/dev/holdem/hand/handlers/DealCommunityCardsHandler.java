package dev.holdem.hand.handlers;

import dev.holdem.common.Errors;
import dev.holdem.hand.cards.Card;
import dev.holdem.hand.events.CommunityCardsDealt;
import dev.holdem.hand.state.HandState;
import dev.holdem.hand.state.Street;

import java.util.List;

/**
 * Functional handler for dealing the flop, turn or river.
 */
public final class DealCommunityCardsHandler {

    private DealCommunityCardsHandler() {}

    /**
     * Deal the cards of the street after the current one.
     *
     * @param hand current hand
     * @return the resulting event
     * @throws Errors.CommandRejectedError if the hand is complete or the river is already out
     */
    public static CommunityCardsDealt handle(HandState hand) {
        // Guard
        if (hand.isComplete()) {
            throw Errors.CommandRejectedError.preconditionFailed("Hand is complete");
        }
        Street next = hand.getStreet().next();
        if (!next.isBettingStreet()) {
            throw Errors.CommandRejectedError.preconditionFailed("All community cards are already dealt");
        }

        // Compute
        List<Card> cards = hand.getDeck().draw(next.cardsDealt());
        hand.addCommunityCards(cards);
        hand.setStreet(next);

        return new CommunityCardsDealt(hand.getHandNumber(), next, cards, hand.getCommunityCards());
    }
}
