package dev.holdem.hand.state;

import dev.holdem.hand.betting.BettingRound;
import dev.holdem.hand.cards.Card;
import dev.holdem.hand.cards.Deck;
import dev.holdem.hand.pot.PotAccountant;
import dev.holdem.hand.pot.PotAward;
import dev.holdem.table.Positions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * State of one dealt hand.
 *
 * <p>Owns its deck, betting round and pots exclusively. Community cards only
 * grow within a hand.
 */
public class HandState {

    private final String tableId;
    private final long handNumber;
    private final Positions positions;
    private final Deck deck;
    private final List<Card> communityCards = new ArrayList<>();
    private final Map<Integer, PlayerHandState> players = new TreeMap<>();
    private final List<PotAward> awards = new ArrayList<>();
    private PotAccountant pots = new PotAccountant();
    private Street street = Street.PREFLOP;
    private BettingRound round;
    private boolean complete;

    public HandState(String tableId, long handNumber, Positions positions, Deck deck) {
        this.tableId = tableId;
        this.handNumber = handNumber;
        this.positions = positions;
        this.deck = deck;
    }

    // Getters and setters
    public String getTableId() { return tableId; }
    public long getHandNumber() { return handNumber; }
    public Positions getPositions() { return positions; }
    public Deck getDeck() { return deck; }
    public List<Card> getCommunityCards() { return Collections.unmodifiableList(communityCards); }
    public Map<Integer, PlayerHandState> getPlayers() { return players; }
    public PotAccountant getPots() { return pots; }
    public Street getStreet() { return street; }
    public void setStreet(Street street) { this.street = street; }
    public BettingRound getRound() { return round; }
    public void setRound(BettingRound round) { this.round = round; }
    public boolean isComplete() { return complete; }
    public void setComplete(boolean complete) { this.complete = complete; }
    public List<PotAward> getAwards() { return awards; }

    public PlayerHandState getPlayer(int seatNumber) {
        return players.get(seatNumber);
    }

    public void addPlayer(PlayerHandState player) {
        players.put(player.getSeatNumber(), player);
    }

    /**
     * Seats dealt into this hand, ascending.
     */
    public List<Integer> getSeatOrder() {
        return new ArrayList<>(players.keySet());
    }

    public void addCommunityCards(List<Card> cards) {
        if (communityCards.size() + cards.size() > 5) {
            throw new IllegalStateException("A board holds at most 5 cards");
        }
        communityCards.addAll(cards);
    }

    /**
     * Whether a submitted action can be applied right now.
     */
    public boolean isAcceptingActions() {
        return !complete && street.isBettingStreet() && round != null;
    }

    public HandState copy() {
        HandState copy = new HandState(tableId, handNumber, positions, deck.copy());
        copy.communityCards.addAll(communityCards);
        for (PlayerHandState player : players.values()) {
            copy.players.put(player.getSeatNumber(), player.copy());
        }
        copy.awards.addAll(awards);
        copy.pots = pots.copy();
        copy.street = street;
        copy.round = round != null ? round.copy() : null;
        copy.complete = complete;
        return copy;
    }
}
