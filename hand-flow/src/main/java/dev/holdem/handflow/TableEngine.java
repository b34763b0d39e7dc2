package dev.holdem.handflow;

import dev.holdem.common.Errors;
import dev.holdem.common.Validation;
import dev.holdem.hand.betting.Action;
import dev.holdem.hand.betting.ActionKind;
import dev.holdem.hand.betting.ActionValidator;
import dev.holdem.hand.betting.LegalActions;
import dev.holdem.hand.betting.RoundStatus;
import dev.holdem.hand.events.HandEvent;
import dev.holdem.hand.state.HandState;
import dev.holdem.handflow.proto.PublicTableView;
import dev.holdem.handflow.view.PublicViewProjector;
import dev.holdem.table.handlers.TableHandlers;
import dev.holdem.table.state.SeatState;
import dev.holdem.table.state.TableState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Authoritative entry point for table commands.
 *
 * <p>Commands for one table run one at a time, in arrival order; different
 * tables proceed in parallel. Each command runs against copies of the table
 * and hand. The copies become live only after the store accepted the
 * transition, so a rejected command or a failed commit leaves no trace.
 *
 * <p>While a seat is to act an action timer runs. On expiry the engine checks
 * for the seat if it may, otherwise folds it.
 */
public class TableEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TableEngine.class);

    private final TableStateStore store;
    private final EngineConfig config;
    private final HandOrchestrator orchestrator;
    private final ScheduledExecutorService timers;
    private final Map<String, TableSession> sessions = new ConcurrentHashMap<>();
    private final List<StateChangeListener> listeners = new CopyOnWriteArrayList<>();

    public TableEngine(TableStateStore store, EngineConfig config) {
        this(store, config, new HandOrchestrator());
    }

    public TableEngine(TableStateStore store, EngineConfig config, HandOrchestrator orchestrator) {
        this.store = store;
        this.config = config;
        this.orchestrator = orchestrator;
        this.timers = Executors.newScheduledThreadPool(config.timerThreads(), timerThreadFactory());
    }

    public void addListener(StateChangeListener listener) {
        listeners.add(listener);
    }

    // --- Commands ---

    /**
     * Move a waiting table into play.
     */
    public List<HandEvent> startTable(String tableId) {
        return execute(session(tableId), "start_table", (table, hand, events) -> {
            TableHandlers.handleStartTable(table);
            return hand;
        });
    }

    /**
     * Stop new hands from starting. A hand in progress plays out.
     */
    public List<HandEvent> pauseTable(String tableId) {
        return execute(session(tableId), "pause_table", (table, hand, events) -> {
            TableHandlers.handlePause(table);
            return hand;
        });
    }

    public List<HandEvent> resumeTable(String tableId) {
        return execute(session(tableId), "resume_table", (table, hand, events) -> {
            TableHandlers.handleResume(table);
            return hand;
        });
    }

    /**
     * Deal the next hand.
     *
     * @throws Errors.CommandRejectedError if a hand is in progress or the table is not running
     * @throws Errors.InsufficientPlayersError if fewer than two seats can play
     */
    public List<HandEvent> startHand(String tableId) {
        TableSession session = session(tableId);
        return execute(session, "start_hand", (table, hand, events) -> {
            if (hand != null && !hand.isComplete()) {
                throw Errors.CommandRejectedError.preconditionFailed("Hand already in progress");
            }
            return orchestrator.startHand(table, events);
        });
    }

    /**
     * Apply an action for the seat to act.
     *
     * @throws Errors.NotYourTurnError if another seat is to act
     * @throws Errors.InvalidActionError if no hand accepts actions or the action is illegal
     */
    public List<HandEvent> submitAction(String tableId, Action action) {
        return execute(session(tableId), "submit_action", (table, hand, events) -> {
            if (hand == null || hand.isComplete()) {
                throw new Errors.InvalidActionError("No hand in progress");
            }
            orchestrator.applyAction(table, hand, action, false, events);
            return hand;
        });
    }

    // --- Queries ---

    /**
     * Legal actions for a seat; empty unless the seat is to act.
     */
    public LegalActions legalActions(String tableId, int seatNumber) {
        TableSession session = session(tableId);
        session.lock.lock();
        try {
            if (!session.isHandInProgress()) {
                return LegalActions.none(seatNumber);
            }
            return ActionValidator.legalActions(
                session.hand.getRound(), session.table.getSeat(seatNumber), session.table.getSettings().bigBlind());
        } finally {
            session.lock.unlock();
        }
    }

    /**
     * The table as {@code viewerSeat} sees it; pass 0 for a spectator.
     */
    public PublicTableView publicView(String tableId, int viewerSeat) {
        TableSession session = session(tableId);
        session.lock.lock();
        try {
            return PublicViewProjector.project(session.table, session.hand, viewerSeat);
        } finally {
            session.lock.unlock();
        }
    }

    @Override
    public void close() {
        for (TableSession session : sessions.values()) {
            session.lock.lock();
            try {
                session.cancelTimer();
            } finally {
                session.lock.unlock();
            }
        }
        timers.shutdownNow();
        logger.info("engine_closed", kv("tables", sessions.size()));
    }

    // --- Transitions ---

    @FunctionalInterface
    private interface Transition {
        HandState apply(TableState table, HandState hand, List<HandEvent> events);
    }

    private TableSession session(String tableId) {
        Validation.requireNotEmpty(tableId, "table_id");
        return sessions.computeIfAbsent(tableId, id -> {
            TableState table = store.loadTableState(id);
            if (table == null) {
                throw new Errors.TableNotFoundError(id);
            }
            return new TableSession(id, table);
        });
    }

    private List<HandEvent> execute(TableSession session, String command, Transition transition) {
        session.lock.lock();
        try {
            TableState table = session.table.copy();
            HandState hand = session.hand != null ? session.hand.copy() : null;
            List<HandEvent> events = new ArrayList<>();

            HandState next;
            try {
                next = transition.apply(table, hand, events);
            } catch (Errors.EngineError e) {
                logger.debug("command_rejected",
                    kv("table", session.tableId),
                    kv("command", command),
                    kv("code", e.getStatusCode()),
                    kv("reason", e.getMessage()));
                throw e;
            }

            commit(session.tableId, new TableTransition(table, next, events));
            session.table = table;
            session.hand = next;
            session.version++;

            armActionTimer(session);
            publish(session);
            return events;
        } finally {
            session.lock.unlock();
        }
    }

    private void commit(String tableId, TableTransition transition) {
        try {
            store.commitTableState(tableId, transition);
        } catch (Errors.StatePersistenceError first) {
            logger.warn("commit_retry", kv("table", tableId), kv("reason", first.getMessage()));
            try {
                store.commitTableState(tableId, transition);
            } catch (Errors.StatePersistenceError second) {
                logger.warn("commit_failed", kv("table", tableId), kv("reason", second.getMessage()));
                throw second;
            }
        }
    }

    private void publish(TableSession session) {
        if (listeners.isEmpty()) {
            return;
        }
        Instant now = Instant.now();
        List<PublicTableView> views = new ArrayList<>();
        views.add(PublicViewProjector.project(session.table, session.hand, PublicViewProjector.SPECTATOR, now));
        for (SeatState seat : session.table.seatsInOrder()) {
            views.add(PublicViewProjector.project(session.table, session.hand, seat.getSeatNumber(), now));
        }
        for (StateChangeListener listener : listeners) {
            for (PublicTableView view : views) {
                try {
                    listener.notifyStateChanged(session.tableId, view);
                } catch (RuntimeException e) {
                    logger.warn("listener_failed",
                        kv("table", session.tableId),
                        kv("viewer", view.getViewerSeat()),
                        e);
                }
            }
        }
    }

    // --- Action timer ---

    private Duration actionTimeout(TableState table) {
        if (table.getSettings().hasActionTimeout()) {
            return table.getSettings().actionTimeout();
        }
        return config.timersEnabled() ? config.actionTimeout() : Duration.ZERO;
    }

    private void armActionTimer(TableSession session) {
        session.cancelTimer();
        if (!session.isHandInProgress() || session.hand.getRound().getStatus() != RoundStatus.AWAITING_ACTION) {
            return;
        }
        Duration timeout = actionTimeout(session.table);
        if (timeout.isZero()) {
            return;
        }
        long version = session.version;
        long handNumber = session.hand.getHandNumber();
        int seat = session.hand.getRound().getSeatToAct();
        session.actionTimer = timers.schedule(
            () -> onActionTimeout(session, version, handNumber, seat),
            timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onActionTimeout(TableSession session, long version, long handNumber, int seat) {
        session.lock.lock();
        try {
            if (session.version != version || !session.isHandInProgress()
                    || session.hand.getHandNumber() != handNumber
                    || session.hand.getRound().getSeatToAct() != seat) {
                return;
            }
            LegalActions legal = ActionValidator.legalActions(
                session.hand.getRound(), session.table.getSeat(seat), session.table.getSettings().bigBlind());
            Action action = legal.allows(ActionKind.CHECK) ? Action.check(seat) : Action.fold(seat);
            logger.warn("action_timeout",
                kv("table", session.tableId),
                kv("hand", handNumber),
                kv("seat", seat),
                kv("action", action.kind()));

            execute(session, "action_timeout", (table, hand, events) -> {
                orchestrator.applyAction(table, hand, action, true, events);
                return hand;
            });
        } catch (RuntimeException e) {
            logger.error("automatic_action_failed",
                kv("table", session.tableId),
                kv("hand", handNumber),
                kv("seat", seat),
                e);
            armActionTimer(session);
        } finally {
            session.lock.unlock();
        }
    }

    private static ThreadFactory timerThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "holdem-action-timer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
