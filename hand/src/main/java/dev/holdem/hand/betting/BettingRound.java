package dev.holdem.hand.betting;

import dev.holdem.hand.state.Street;
import dev.holdem.table.PositionResolver;
import dev.holdem.table.state.SeatState;
import dev.holdem.table.state.SeatStatus;
import dev.holdem.table.state.TableState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Betting state of one street.
 *
 * <p>The round is complete once every {@link SeatStatus#PLAYING} seat has
 * matched the current bet and has acted since the last full raise. A lone
 * playing seat with no opponent able to respond only has to match the bet.
 * Turn order runs clockwise over playing seats, skipping folded and all-in ones.
 */
public class BettingRound {

    private final Street street;
    private final List<Integer> seatOrder;
    private final Map<Integer, Long> committed = new TreeMap<>();
    private final Set<Integer> acted = new HashSet<>();
    private final Map<Integer, Long> betLevelWhenActed = new HashMap<>();
    private long currentBet;
    private long minRaise;
    private int seatToAct = -1;
    private RoundStatus status = RoundStatus.AWAITING_ACTION;

    /**
     * @param street street being bet
     * @param seatOrder seats dealt into the hand, ascending
     * @param bigBlind initial minimum raise
     */
    public BettingRound(Street street, List<Integer> seatOrder, long bigBlind) {
        this.street = street;
        this.seatOrder = List.copyOf(seatOrder);
        this.minRaise = bigBlind;
        for (int seat : seatOrder) {
            committed.put(seat, 0L);
        }
    }

    private BettingRound(BettingRound other) {
        this.street = other.street;
        this.seatOrder = other.seatOrder;
        this.committed.putAll(other.committed);
        this.acted.addAll(other.acted);
        this.betLevelWhenActed.putAll(other.betLevelWhenActed);
        this.currentBet = other.currentBet;
        this.minRaise = other.minRaise;
        this.seatToAct = other.seatToAct;
        this.status = other.status;
    }

    // --- Accessors ---

    public Street getStreet() { return street; }
    public List<Integer> getSeatOrder() { return seatOrder; }
    public long getCurrentBet() { return currentBet; }
    public long getMinRaise() { return minRaise; }
    public int getSeatToAct() { return seatToAct; }
    public RoundStatus getStatus() { return status; }

    public long committedBy(int seatNumber) {
        return committed.getOrDefault(seatNumber, 0L);
    }

    public long totalCommitted() {
        return committed.values().stream().mapToLong(Long::longValue).sum();
    }

    public boolean hasActed(int seatNumber) {
        return acted.contains(seatNumber);
    }

    /**
     * Whether the seat may still raise.
     *
     * <p>A seat that already acted this street may raise again only if the bet
     * has grown by at least a full raise since its last action. A short all-in
     * alone does not reopen the betting for it.
     */
    public boolean mayRaise(int seatNumber) {
        if (!acted.contains(seatNumber)) {
            return true;
        }
        long level = betLevelWhenActed.getOrDefault(seatNumber, 0L);
        return currentBet - level >= minRaise;
    }

    // --- Transitions ---

    /**
     * Record a forced blind. Blinds do not count as having acted.
     */
    public void postBlind(int seatNumber, long amount) {
        committed.merge(seatNumber, amount, Long::sum);
        currentBet = Math.max(currentBet, committed.get(seatNumber));
    }

    /**
     * Apply an action the {@link ActionValidator} accepted.
     */
    public void apply(ValidatedAction action) {
        int seat = action.seatNumber();
        acted.add(seat);
        committed.merge(seat, action.chips(), Long::sum);

        long total = committed.get(seat);
        if (total > currentBet) {
            long increment = total - currentBet;
            if (increment >= minRaise) {
                minRaise = increment;
                acted.retainAll(Set.of(seat));
            }
            currentBet = total;
        }
        betLevelWhenActed.put(seat, currentBet);
    }

    /**
     * Find the next seat to act, clockwise after {@code fromSeat}, or close the round.
     *
     * @param table current seat statuses
     * @param fromSeat the seat that just acted, or the seat before the first to act
     * @return the new round status
     */
    public RoundStatus advance(TableState table, int fromSeat) {
        List<Integer> inHand = new ArrayList<>();
        List<Integer> playing = new ArrayList<>();
        for (int seatNumber : seatOrder) {
            SeatState seat = table.getSeat(seatNumber);
            if (seat != null && seat.getStatus().isInHand()) {
                inHand.add(seatNumber);
                if (seat.isPlaying()) {
                    playing.add(seatNumber);
                }
            }
        }

        if (inHand.size() <= 1) {
            seatToAct = -1;
            status = RoundStatus.HAND_COMPLETE;
            return status;
        }

        boolean opponentsCanRespond = playing.size() >= 2;
        int next = PositionResolver.nextClockwise(playing, fromSeat,
            seat -> committedBy(seat) < currentBet || (opponentsCanRespond && !acted.contains(seat)));

        seatToAct = next;
        status = next == -1 ? RoundStatus.ROUND_COMPLETE : RoundStatus.AWAITING_ACTION;
        return status;
    }

    /**
     * Close the round early because the hand ended.
     */
    public void close() {
        seatToAct = -1;
        status = RoundStatus.HAND_COMPLETE;
    }

    public BettingRound copy() {
        return new BettingRound(this);
    }
}
