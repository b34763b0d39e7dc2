package dev.holdem.handflow.steps;

import dev.holdem.common.Errors;
import dev.holdem.hand.betting.Action;
import dev.holdem.hand.betting.ActionKind;
import dev.holdem.handflow.EngineConfig;
import dev.holdem.handflow.HandOrchestrator;
import dev.holdem.handflow.InMemoryTableStateStore;
import dev.holdem.handflow.StackedDecks;
import dev.holdem.handflow.TableEngine;
import dev.holdem.handflow.proto.PublicTableView;
import dev.holdem.handflow.proto.SeatView;
import dev.holdem.handflow.proto.WinnerView;
import dev.holdem.table.state.SeatState;
import dev.holdem.table.state.TableSettings;
import dev.holdem.table.state.TableState;
import io.cucumber.datatable.DataTable;
import io.cucumber.java.After;
import io.cucumber.java.Before;
import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Step definitions driving a table through the engine.
 */
public class HandFlowSteps {

    private InMemoryTableStateStore store;
    private StackedDecks decks;
    private TableEngine engine;
    private String tableId;
    private long totalChips;
    private Errors.EngineError rejectedError;

    @Before
    public void setup() {
        store = new InMemoryTableStateStore();
        decks = new StackedDecks();
        engine = null;
        rejectedError = null;
    }

    @After
    public void teardown() {
        if (engine != null) {
            engine.close();
        }
    }

    // --- Given steps ---

    @Given("a table {string} with blinds {long}\\/{long} and seats:")
    public void tableWithSeats(String id, long smallBlind, long bigBlind, DataTable seats) {
        tableId = id;
        TableState table = new TableState(id, new TableSettings(smallBlind, bigBlind, 1000, 8));
        for (Map<String, String> row : seats.asMaps()) {
            table.addSeat(new SeatState(
                Integer.parseInt(row.get("seat")),
                row.get("player"),
                Long.parseLong(row.get("chips"))));
        }
        totalChips = table.totalChips();
        store.put(table);
    }

    @And("the next deck is stacked with {string}")
    public void deckStacked(String cards) {
        decks.add(cards);
    }

    @And("the table has started")
    public void tableStarted() {
        engine = new TableEngine(store, new EngineConfig(Duration.ZERO, 1), new HandOrchestrator(decks));
        engine.startTable(tableId);
    }

    // --- When steps ---

    @When("a hand is started")
    public void handStarted() {
        engine.startHand(tableId);
    }

    @When("seat {int} folds")
    public void seatFolds(int seat) {
        engine.submitAction(tableId, Action.fold(seat));
    }

    @When("seat {int} checks")
    public void seatChecks(int seat) {
        engine.submitAction(tableId, Action.check(seat));
    }

    @When("seat {int} calls")
    public void seatCalls(int seat) {
        engine.submitAction(tableId, Action.call(seat));
    }

    @When("seat {int} bets {long}")
    public void seatBets(int seat, long amount) {
        engine.submitAction(tableId, Action.bet(seat, amount));
    }

    @When("seat {int} raises to {long}")
    public void seatRaises(int seat, long amount) {
        engine.submitAction(tableId, Action.raiseTo(seat, amount));
    }

    @When("seat {int} tries to {word}")
    public void seatTries(int seat, String kind) {
        try {
            engine.submitAction(tableId, new Action(seat, ActionKind.valueOf(kind.toUpperCase()), null));
        } catch (Errors.EngineError e) {
            rejectedError = e;
        }
    }

    @When("everyone checks to the showdown")
    public void everyoneChecksDown() {
        while (!view().getHandComplete()) {
            engine.submitAction(tableId, Action.check(view().getSeatToAct()));
        }
    }

    // --- Then steps ---

    @Then("seat {int} is to act")
    public void seatToAct(int seat) {
        assertThat(view().getSeatToAct()).isEqualTo(seat);
    }

    @Then("seat {int} has {long} chips")
    public void seatHasChips(int seat, long chips) {
        assertThat(seat(seat).getChipCount()).isEqualTo(chips);
    }

    @Then("seat {int} is {word}")
    public void seatStatus(int seat, String status) {
        assertThat(seat(seat).getStatus()).isEqualTo(status);
    }

    @Then("the hand is complete")
    public void handComplete() {
        assertThat(view().getHandComplete()).isTrue();
    }

    @Then("the street is {word}")
    public void street(String street) {
        assertThat(view().getStreet()).isEqualTo(street);
    }

    @Then("the board has {int} cards")
    public void boardSize(int count) {
        assertThat(view().getCommunityCardsCount()).isEqualTo(count);
    }

    @Then("seat {int} wins {long} from pot {int}")
    public void seatWins(int seat, long amount, int pot) {
        assertThat(view().getWinnersList())
            .anySatisfy(w -> {
                assertThat(w.getSeatNumber()).isEqualTo(seat);
                assertThat(w.getAmount()).isEqualTo(amount);
                assertThat(w.getPotIndex()).isEqualTo(pot);
            });
    }

    @Then("seat {int} showed {string}")
    public void seatShowed(int seat, String description) {
        assertThat(seat(seat).getShownHand()).isEqualTo(description);
    }

    @Then("the winnings total {long}")
    public void winningsTotal(long total) {
        assertThat(view().getWinnersList().stream().mapToLong(WinnerView::getAmount).sum()).isEqualTo(total);
    }

    @Then("no chips were created or lost")
    public void chipsConserved() {
        long chips = view().getSeatsList().stream().mapToLong(SeatView::getChipCount).sum();
        assertThat(chips + view().getPotTotal()).isEqualTo(totalChips);
    }

    @Then("the action is rejected with {string}")
    public void actionRejected(String errorType) {
        assertThat(rejectedError).isNotNull();
        assertThat(rejectedError.getClass().getSimpleName()).isEqualTo(errorType);
    }

    @Then("the table is {word}")
    public void tableStatus(String status) {
        assertThat(view().getStatus()).isEqualTo(status);
    }

    // --- Helpers ---

    private PublicTableView view() {
        return engine.publicView(tableId, 0);
    }

    private SeatView seat(int seatNumber) {
        return view().getSeatsList().stream()
            .filter(s -> s.getSeatNumber() == seatNumber)
            .findFirst()
            .orElseThrow();
    }
}
