package dev.holdem.hand.handlers;

import dev.holdem.common.Errors;
import dev.holdem.hand.cards.Card;
import dev.holdem.hand.events.CardsDealt;
import dev.holdem.hand.state.HandState;
import dev.holdem.hand.state.PlayerHandState;
import dev.holdem.table.PositionResolver;
import dev.holdem.table.state.SeatState;
import dev.holdem.table.state.TableState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Functional handler for dealing hole cards.
 *
 * <p>Guard/validate/compute, mutating the given working copies.
 */
public final class DealCardsHandler {

    private static final int HOLE_CARDS = 2;

    private DealCardsHandler() {}

    /**
     * Seat every eligible seat in the hand and deal two cards each, one at a
     * time, starting with the seat left of the button.
     *
     * @param hand the new hand
     * @param table seats to deal in
     * @return the resulting event
     * @throws Errors.CommandRejectedError if cards were already dealt
     */
    public static CardsDealt handle(HandState hand, TableState table) {
        // Guard
        if (!hand.getPlayers().isEmpty()) {
            throw Errors.CommandRejectedError.preconditionFailed("Cards already dealt");
        }

        // Validate
        List<Integer> eligible = table.eligibleSeatNumbers();
        if (eligible.size() < 2) {
            throw new Errors.InsufficientPlayersError(eligible.size());
        }

        // Compute
        for (int seatNumber : eligible) {
            SeatState seat = table.getSeat(seatNumber);
            hand.addPlayer(new PlayerHandState(seatNumber, seat.getOccupantId()));
        }

        List<Integer> dealOrder = new ArrayList<>();
        int next = PositionResolver.nextClockwise(eligible, hand.getPositions().button());
        for (int i = 0; i < eligible.size(); i++) {
            dealOrder.add(next);
            next = PositionResolver.nextClockwise(eligible, next);
        }

        for (int round = 0; round < HOLE_CARDS; round++) {
            for (int seatNumber : dealOrder) {
                hand.getPlayer(seatNumber).getHoleCards().add(hand.getDeck().drawOne());
            }
        }

        Map<Integer, List<Card>> dealt = new HashMap<>();
        for (PlayerHandState player : hand.getPlayers().values()) {
            dealt.put(player.getSeatNumber(), List.copyOf(player.getHoleCards()));
        }
        return new CardsDealt(hand.getHandNumber(), hand.getPositions(), dealt);
    }
}
