package dev.holdem.hand.handlers;

import dev.holdem.common.Errors;
import dev.holdem.hand.eval.HandEvaluator;
import dev.holdem.hand.eval.HandStrength;
import dev.holdem.hand.events.PotAwarded;
import dev.holdem.hand.pot.PotAward;
import dev.holdem.hand.state.HandState;
import dev.holdem.hand.state.PlayerHandState;
import dev.holdem.hand.state.Street;
import dev.holdem.table.state.SeatState;
import dev.holdem.table.state.TableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Functional handler that pays out the pots.
 *
 * <p>With a single seat left the pots go to it unseen. Otherwise the remaining
 * hands are shown and every pot is split among its best eligible hands.
 */
public final class AwardPotHandler {
    private static final Logger logger = LoggerFactory.getLogger(AwardPotHandler.class);

    private AwardPotHandler() {}

    /**
     * Award all pots.
     *
     * @param hand current hand
     * @param table seats to credit
     * @return the resulting event
     * @throws Errors.CommandRejectedError if the pots were already awarded
     */
    public static PotAwarded handle(HandState hand, TableState table) {
        // Guard
        if (hand.isComplete() || !hand.getAwards().isEmpty()) {
            throw Errors.CommandRejectedError.preconditionFailed("Pots already awarded");
        }

        // Validate
        List<Integer> contenders = hand.getSeatOrder().stream()
            .filter(seat -> table.getSeat(seat).getStatus().isInHand())
            .toList();
        if (contenders.isEmpty()) {
            throw new IllegalStateException("No seat left to award hand " + hand.getHandNumber());
        }

        // Compute
        Map<Integer, HandStrength> hands = new HashMap<>();
        Map<Integer, HandStrength> shown = new TreeMap<>();
        if (contenders.size() == 1) {
            hands.put(contenders.get(0), null);
        } else {
            if (hand.getCommunityCards().size() != 5) {
                throw new IllegalStateException("Showdown needs a full board, have " + hand.getCommunityCards().size());
            }
            hand.setStreet(Street.SHOWDOWN);
            for (int seatNumber : contenders) {
                PlayerHandState player = hand.getPlayer(seatNumber);
                HandStrength strength = HandEvaluator.evaluate(player.getHoleCards(), hand.getCommunityCards());
                player.setShownHand(strength);
                hands.put(seatNumber, strength);
                shown.put(seatNumber, strength);
            }
        }

        List<PotAward> awards = hand.getPots().settle(hands, hand.getPositions().button());
        for (PotAward award : awards) {
            SeatState seat = table.getSeat(award.seatNumber());
            seat.addChips(award.amount());
            HandStrength strength = hands.get(award.seatNumber());
            logger.info("pot_awarded",
                kv("table", hand.getTableId()),
                kv("hand", hand.getHandNumber()),
                kv("pot", award.potIndex()),
                kv("seat", award.seatNumber()),
                kv("amount", award.amount()),
                kv("with", strength != null ? strength.describe() : "uncontested"));
        }
        hand.getAwards().addAll(awards);

        return new PotAwarded(hand.getHandNumber(), awards, shown);
    }
}
