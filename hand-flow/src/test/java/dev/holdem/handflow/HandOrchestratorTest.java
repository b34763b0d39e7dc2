package dev.holdem.handflow;

import dev.holdem.hand.betting.Action;
import dev.holdem.hand.betting.ActionKind;
import dev.holdem.hand.betting.ActionValidator;
import dev.holdem.hand.betting.LegalActions;
import dev.holdem.hand.events.CommunityCardsDealt;
import dev.holdem.hand.events.HandComplete;
import dev.holdem.hand.events.HandEvent;
import dev.holdem.hand.events.PotAwarded;
import dev.holdem.hand.pot.PotAward;
import dev.holdem.hand.state.HandState;
import dev.holdem.hand.state.Street;
import dev.holdem.table.handlers.TableHandlers;
import dev.holdem.table.state.SeatState;
import dev.holdem.table.state.SeatStatus;
import dev.holdem.table.state.TableSettings;
import dev.holdem.table.state.TableState;
import dev.holdem.table.state.TableStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class HandOrchestratorTest {

    private static TableState table(long... stacks) {
        TableState table = new TableState("t-1", new TableSettings(5, 10, 1000, 6));
        for (int i = 0; i < stacks.length; i++) {
            table.addSeat(new SeatState(i + 1, "player-" + (i + 1), stacks[i]));
        }
        TableHandlers.handleStartTable(table);
        return table;
    }

    private static <T extends HandEvent> List<T> eventsOf(List<HandEvent> events, Class<T> type) {
        List<T> result = new ArrayList<>();
        for (HandEvent event : events) {
            if (type.isInstance(event)) {
                result.add(type.cast(event));
            }
        }
        return result;
    }

    @Test
    void three_seats_one_folds_two_check_it_down() {
        // deal order 2, 3, 1: seat 1 AA, seat 2 KK, seat 3 72
        HandOrchestrator orchestrator = new HandOrchestrator(
            new StackedDecks().add("KS 7C AS KD 2H AD 3C 8D 9H JS 4S"));
        TableState table = table(1000, 1000, 1000);
        List<HandEvent> events = new ArrayList<>();

        HandState hand = orchestrator.startHand(table, events);
        assertThat(hand.getPositions().button()).isEqualTo(1);
        assertThat(hand.getRound().getSeatToAct()).isEqualTo(1);

        orchestrator.applyAction(table, hand, Action.fold(1), false, events);
        orchestrator.applyAction(table, hand, Action.call(2), false, events);
        orchestrator.applyAction(table, hand, Action.check(3), false, events);
        for (Street street : List.of(Street.FLOP, Street.TURN, Street.RIVER)) {
            assertThat(hand.getStreet()).isEqualTo(street);
            assertThat(hand.getRound().getSeatToAct()).isEqualTo(2);
            orchestrator.applyAction(table, hand, Action.check(2), false, events);
            orchestrator.applyAction(table, hand, Action.check(3), false, events);
        }

        assertThat(hand.isComplete()).isTrue();
        assertThat(eventsOf(events, CommunityCardsDealt.class)).hasSize(3);
        PotAwarded awarded = eventsOf(events, PotAwarded.class).get(0);
        assertThat(awarded.wentToShowdown()).isTrue();
        assertThat(awarded.awards()).containsExactly(new PotAward(0, 2, 20));
        assertThat(table.getSeat(1).getChipCount()).isEqualTo(1000);
        assertThat(table.getSeat(2).getChipCount()).isEqualTo(1010);
        assertThat(table.getSeat(3).getChipCount()).isEqualTo(990);
        assertThat(events.get(events.size() - 1)).isInstanceOf(HandComplete.class);
        assertThat(table.getSeat(1).getStatus()).isEqualTo(SeatStatus.PLAYING);
    }

    @Test
    void heads_up_fold_preflop_moves_exactly_the_small_blind() {
        HandOrchestrator orchestrator = new HandOrchestrator(new StackedDecks());
        TableState table = table(1000, 1000);
        List<HandEvent> events = new ArrayList<>();

        HandState hand = orchestrator.startHand(table, events);
        assertThat(hand.getPositions().smallBlind()).isEqualTo(hand.getPositions().button());
        assertThat(hand.getRound().getSeatToAct()).isEqualTo(1);

        orchestrator.applyAction(table, hand, Action.fold(1), false, events);

        assertThat(hand.isComplete()).isTrue();
        assertThat(hand.getCommunityCards()).isEmpty();
        assertThat(eventsOf(events, CommunityCardsDealt.class)).isEmpty();
        assertThat(table.getSeat(1).getChipCount()).isEqualTo(995);
        assertThat(table.getSeat(2).getChipCount()).isEqualTo(1005);
    }

    @Test
    void heads_up_big_blind_acts_first_after_the_flop() {
        HandOrchestrator orchestrator = new HandOrchestrator(new StackedDecks());
        TableState table = table(1000, 1000);
        List<HandEvent> events = new ArrayList<>();

        HandState hand = orchestrator.startHand(table, events);
        orchestrator.applyAction(table, hand, Action.call(1), false, events);
        orchestrator.applyAction(table, hand, Action.check(2), false, events);

        assertThat(hand.getStreet()).isEqualTo(Street.FLOP);
        assertThat(hand.getRound().getSeatToAct()).isEqualTo(2);
    }

    @Test
    void all_in_preflop_runs_out_the_board_and_finishes_the_table() {
        // deal order 2, 1: seat 1 AA, seat 2 KK
        HandOrchestrator orchestrator = new HandOrchestrator(
            new StackedDecks().add("KS AS KD AD 3C 8D 9H JS 4S"));
        TableState table = table(1000, 1000);
        List<HandEvent> events = new ArrayList<>();

        HandState hand = orchestrator.startHand(table, events);
        orchestrator.applyAction(table, hand, Action.raiseTo(1, 1000), false, events);
        orchestrator.applyAction(table, hand, Action.call(2), false, events);

        assertThat(hand.isComplete()).isTrue();
        assertThat(hand.getCommunityCards()).hasSize(5);
        assertThat(table.getSeat(1).getChipCount()).isEqualTo(2000);
        assertThat(table.getSeat(2).getStatus()).isEqualTo(SeatStatus.SITTING_OUT);
        assertThat(table.getStatus()).isEqualTo(TableStatus.FINISHED);
    }

    @Test
    void short_stack_all_in_wins_only_the_main_pot() {
        // deal order 2, 3, 1: seat 1 AA, seat 2 KK, seat 3 QQ
        HandOrchestrator orchestrator = new HandOrchestrator(
            new StackedDecks().add("KS QS AS KD QD AD 3C 8D 9H JC 4H"));
        TableState table = table(100, 300, 300);
        List<HandEvent> events = new ArrayList<>();

        HandState hand = orchestrator.startHand(table, events);
        orchestrator.applyAction(table, hand, Action.raiseTo(1, 100), false, events);
        orchestrator.applyAction(table, hand, Action.raiseTo(2, 300), false, events);
        orchestrator.applyAction(table, hand, Action.call(3), false, events);

        assertThat(hand.isComplete()).isTrue();
        PotAwarded awarded = eventsOf(events, PotAwarded.class).get(0);
        assertThat(awarded.awards()).extracting(PotAward::potIndex, PotAward::seatNumber, PotAward::amount)
            .containsExactly(tuple(0, 1, 300L), tuple(1, 2, 400L));
        assertThat(table.getSeat(1).getChipCount()).isEqualTo(300);
        assertThat(table.getSeat(2).getChipCount()).isEqualTo(400);
        assertThat(table.getSeat(3).getStatus()).isEqualTo(SeatStatus.SITTING_OUT);
        assertThat(table.getStatus()).isEqualTo(TableStatus.IN_PROGRESS);
    }

    @Test
    void button_moves_each_hand() {
        HandOrchestrator orchestrator = new HandOrchestrator(new StackedDecks());
        TableState table = table(1000, 1000, 1000);

        HandState first = orchestrator.startHand(table, new ArrayList<>());
        orchestrator.applyAction(table, first, Action.fold(1), false, new ArrayList<>());
        orchestrator.applyAction(table, first, Action.fold(2), false, new ArrayList<>());
        HandState second = orchestrator.startHand(table, new ArrayList<>());

        assertThat(first.getPositions().button()).isEqualTo(1);
        assertThat(second.getPositions().button()).isEqualTo(2);
        assertThat(second.getPositions().bigBlind()).isEqualTo(1);
        assertThat(second.getHandNumber()).isEqualTo(2);
    }

    @Test
    void chips_are_conserved_through_random_play() {
        Random random = new Random(7);
        HandOrchestrator orchestrator = new HandOrchestrator(HandOrchestrator.shuffledDecks(random));
        TableState table = table(400, 250, 600, 150);
        long total = table.totalChips();

        for (int handCount = 0; handCount < 40 && table.getStatus() == TableStatus.IN_PROGRESS; handCount++) {
            HandState hand = orchestrator.startHand(table, new ArrayList<>());
            while (!hand.isComplete()) {
                assertThat(table.totalChips() + hand.getPots().total()).isEqualTo(total);
                int seat = hand.getRound().getSeatToAct();
                LegalActions legal = ActionValidator.legalActions(hand.getRound(), table.getSeat(seat), 10);
                orchestrator.applyAction(table, hand, pick(legal, random), false, new ArrayList<>());
                for (int s : hand.getSeatOrder()) {
                    assertThat(hand.getRound().committedBy(s)).isLessThanOrEqualTo(hand.getRound().getCurrentBet());
                }
            }
            assertThat(table.totalChips()).isEqualTo(total);
        }
    }

    private static Action pick(LegalActions legal, Random random) {
        int seat = legal.seatNumber();
        int roll = random.nextInt(10);
        if (roll < 2 && legal.allows(ActionKind.RAISE)) {
            return Action.raiseTo(seat, legal.minTotal());
        }
        if (roll < 2 && legal.allows(ActionKind.BET)) {
            return Action.bet(seat, legal.minTotal());
        }
        if (legal.allows(ActionKind.CHECK)) {
            return Action.check(seat);
        }
        if (roll == 9) {
            return Action.fold(seat);
        }
        return Action.call(seat);
    }
}
