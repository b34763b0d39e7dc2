package dev.holdem.handflow.view;

import com.google.protobuf.Timestamp;
import dev.holdem.hand.betting.BettingRound;
import dev.holdem.hand.betting.RoundStatus;
import dev.holdem.hand.cards.Card;
import dev.holdem.hand.eval.HandStrength;
import dev.holdem.hand.pot.Pot;
import dev.holdem.hand.pot.PotAward;
import dev.holdem.hand.state.HandState;
import dev.holdem.hand.state.PlayerHandState;
import dev.holdem.handflow.proto.PotView;
import dev.holdem.handflow.proto.PublicTableView;
import dev.holdem.handflow.proto.SeatView;
import dev.holdem.handflow.proto.WinnerView;
import dev.holdem.table.state.SeatState;
import dev.holdem.table.state.TableState;

import java.time.Instant;
import java.util.List;

/**
 * Projects table and hand state into the view one audience may see.
 *
 * <p>Hole cards appear only on the viewer's own seat, and on every seat whose
 * hand was shown at showdown.
 */
public final class PublicViewProjector {

    /** Viewer seat of spectators. */
    public static final int SPECTATOR = 0;

    private PublicViewProjector() {}

    public static PublicTableView project(TableState table, HandState hand, int viewerSeat) {
        return project(table, hand, viewerSeat, Instant.now());
    }

    /**
     * @param hand current or last hand, may be null
     * @param viewerSeat seat whose private cards to include, or {@link #SPECTATOR}
     */
    public static PublicTableView project(TableState table, HandState hand, int viewerSeat, Instant now) {
        PublicTableView.Builder view = PublicTableView.newBuilder()
            .setTableId(table.getTableId())
            .setStatus(table.getStatus().name().toLowerCase())
            .setHandNumber(table.getHandCount())
            .setButtonSeat(table.getButtonSeat() != null ? table.getButtonSeat() : 0)
            .setViewerSeat(viewerSeat)
            .setUpdatedAt(toTimestamp(now));

        BettingRound round = hand != null ? hand.getRound() : null;
        int seatToAct = round != null && round.getStatus() == RoundStatus.AWAITING_ACTION ? round.getSeatToAct() : 0;

        for (SeatState seat : table.seatsInOrder()) {
            SeatView.Builder seatView = SeatView.newBuilder()
                .setSeatNumber(seat.getSeatNumber())
                .setOccupantId(seat.getOccupantId() != null ? seat.getOccupantId() : "")
                .setChipCount(seat.getChipCount())
                .setStatus(seat.getStatus().name().toLowerCase())
                .setIsTurn(seat.getSeatNumber() == seatToAct)
                .setCommittedThisStreet(round != null ? round.committedBy(seat.getSeatNumber()) : 0);

            PlayerHandState player = hand != null ? hand.getPlayer(seat.getSeatNumber()) : null;
            if (player != null && (player.isShown() || seat.getSeatNumber() == viewerSeat)) {
                seatView.addAllHoleCards(cardText(player.getHoleCards()));
                if (player.isShown()) {
                    seatView.setShownHand(player.getShownHand().describe());
                }
            }
            view.addSeats(seatView);
        }

        if (hand == null) {
            return view.build();
        }

        view.setStreet(hand.getStreet().name().toLowerCase())
            .addAllCommunityCards(cardText(hand.getCommunityCards()))
            .setPotTotal(hand.isComplete() ? 0 : hand.getPots().total())
            .setSeatToAct(seatToAct)
            .setHandComplete(hand.isComplete());
        if (round != null) {
            view.setCurrentBet(round.getCurrentBet()).setMinRaise(round.getMinRaise());
        }
        if (!hand.isComplete()) {
            for (Pot pot : hand.getPots().pots()) {
                view.addPots(PotView.newBuilder()
                    .setAmount(pot.amount())
                    .addAllEligibleSeats(pot.eligibleSeats()));
            }
        }
        for (PotAward award : hand.getAwards()) {
            HandStrength strength = hand.getPlayer(award.seatNumber()).getShownHand();
            view.addWinners(WinnerView.newBuilder()
                .setPotIndex(award.potIndex())
                .setSeatNumber(award.seatNumber())
                .setAmount(award.amount())
                .setHandDescription(strength != null ? strength.describe() : ""));
        }
        return view.build();
    }

    private static List<String> cardText(List<Card> cards) {
        return cards.stream().map(Card::toString).toList();
    }

    private static Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
            .setSeconds(instant.getEpochSecond())
            .setNanos(instant.getNano())
            .build();
    }
}
