package dev.holdem.handflow;

import dev.holdem.hand.betting.Action;
import dev.holdem.hand.betting.BettingRound;
import dev.holdem.hand.betting.RoundStatus;
import dev.holdem.hand.cards.Deck;
import dev.holdem.hand.events.ActionTaken;
import dev.holdem.hand.events.BettingRoundComplete;
import dev.holdem.hand.events.BlindType;
import dev.holdem.hand.events.CommunityCardsDealt;
import dev.holdem.hand.events.HandComplete;
import dev.holdem.hand.events.HandEvent;
import dev.holdem.hand.handlers.AwardPotHandler;
import dev.holdem.hand.handlers.DealCardsHandler;
import dev.holdem.hand.handlers.DealCommunityCardsHandler;
import dev.holdem.hand.handlers.PlayerActionHandler;
import dev.holdem.hand.handlers.PostBlindHandler;
import dev.holdem.hand.state.HandState;
import dev.holdem.hand.state.Street;
import dev.holdem.table.Positions;
import dev.holdem.table.handlers.TableHandlers;
import dev.holdem.table.state.TableSettings;
import dev.holdem.table.state.TableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Supplier;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Drives a hand from the deal to the payout.
 *
 * <p>Sequence: hole cards, blinds, preflop betting, then flop, turn and river
 * each followed by a betting round, then showdown. The hand ends early when
 * only one seat is left; when fewer than two seats can still bet the remaining
 * board is dealt without betting.
 *
 * <p>Every method mutates the table and hand it is given and appends the
 * resulting events. Callers pass working copies and commit or discard them.
 */
public class HandOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(HandOrchestrator.class);

    private final Supplier<Deck> deckSource;

    /**
     * Orchestrator dealing from freshly shuffled decks.
     */
    public HandOrchestrator() {
        this(shuffledDecks(new SecureRandom()));
    }

    /**
     * @param deckSource supplies one deck per hand
     */
    public HandOrchestrator(Supplier<Deck> deckSource) {
        this.deckSource = deckSource;
    }

    public static Supplier<Deck> shuffledDecks(Random random) {
        return () -> Deck.create().shuffle(random);
    }

    /**
     * Begin a hand: rotate the button, deal, post blinds and open preflop betting.
     *
     * @return the new hand
     */
    public HandState startHand(TableState table, List<HandEvent> events) {
        Positions positions = TableHandlers.handleBeginHand(table);
        HandState hand = new HandState(table.getTableId(), table.getHandCount(), positions, deckSource.get());
        TableSettings settings = table.getSettings();

        events.add(DealCardsHandler.handle(hand, table));
        hand.setRound(new BettingRound(Street.PREFLOP, hand.getSeatOrder(), settings.bigBlind()));
        events.add(PostBlindHandler.handle(hand, table, positions.smallBlind(), BlindType.SMALL, settings.smallBlind()));
        events.add(PostBlindHandler.handle(hand, table, positions.bigBlind(), BlindType.BIG, settings.bigBlind()));

        logger.info("hand_started",
            kv("table", table.getTableId()),
            kv("hand", hand.getHandNumber()),
            kv("button", positions.button()),
            kv("small_blind", positions.smallBlind()),
            kv("big_blind", positions.bigBlind()),
            kv("seats", hand.getSeatOrder()));

        RoundStatus status = hand.getRound().advance(table, positions.bigBlind());
        progress(table, hand, status, events);
        return hand;
    }

    /**
     * Apply one action and move the hand forward as far as it goes without input.
     */
    public void applyAction(TableState table, HandState hand, Action action, boolean automatic, List<HandEvent> events) {
        ActionTaken taken = PlayerActionHandler.handle(hand, table, action, automatic);
        events.add(taken);

        logger.info("action_applied",
            kv("table", table.getTableId()),
            kv("hand", hand.getHandNumber()),
            kv("seat", taken.seatNumber()),
            kv("action", taken.kind()),
            kv("chips", taken.chips()),
            kv("all_in", taken.allIn()),
            kv("automatic", automatic));

        RoundStatus status = hand.getRound().advance(table, action.seatNumber());
        progress(table, hand, status, events);
    }

    private void progress(TableState table, HandState hand, RoundStatus status, List<HandEvent> events) {
        while (status == RoundStatus.ROUND_COMPLETE) {
            events.add(new BettingRoundComplete(hand.getHandNumber(), hand.getStreet(), hand.getPots().total()));
            if (hand.getStreet() == Street.RIVER) {
                finish(table, hand, events);
                return;
            }

            CommunityCardsDealt dealt = DealCommunityCardsHandler.handle(hand);
            events.add(dealt);
            logger.info("street_dealt",
                kv("table", table.getTableId()),
                kv("hand", hand.getHandNumber()),
                kv("street", dealt.street()),
                kv("board", dealt.board().toString()));

            hand.setRound(new BettingRound(hand.getStreet(), hand.getSeatOrder(), table.getSettings().bigBlind()));
            status = hand.getRound().advance(table, hand.getPositions().button());
        }
        if (status == RoundStatus.HAND_COMPLETE) {
            finish(table, hand, events);
        }
    }

    private void finish(TableState table, HandState hand, List<HandEvent> events) {
        hand.getRound().close();
        events.add(AwardPotHandler.handle(hand, table));
        hand.setComplete(true);

        Map<Integer, Long> chipCounts = new LinkedHashMap<>();
        for (int seatNumber : hand.getSeatOrder()) {
            chipCounts.put(seatNumber, table.getSeat(seatNumber).getChipCount());
        }
        TableHandlers.handleEndHand(table);
        events.add(new HandComplete(hand.getHandNumber(), chipCounts));

        logger.info("hand_complete",
            kv("table", table.getTableId()),
            kv("hand", hand.getHandNumber()),
            kv("chip_counts", chipCounts),
            kv("table_status", table.getStatus()));
    }
}
