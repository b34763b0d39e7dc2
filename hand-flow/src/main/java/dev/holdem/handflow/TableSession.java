package dev.holdem.handflow;

import dev.holdem.hand.state.HandState;
import dev.holdem.table.state.TableState;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live state of one table inside the engine.
 *
 * <p>All fields are guarded by {@link #lock}. The lock is fair so commands
 * are applied in arrival order.
 */
final class TableSession {

    final String tableId;
    final ReentrantLock lock = new ReentrantLock(true);

    TableState table;
    HandState hand;
    /** Bumped on every commit; a timer armed under an older value is stale. */
    long version;
    ScheduledFuture<?> actionTimer;

    TableSession(String tableId, TableState table) {
        this.tableId = tableId;
        this.table = table;
    }

    boolean isHandInProgress() {
        return hand != null && !hand.isComplete();
    }

    void cancelTimer() {
        if (actionTimer != null) {
            actionTimer.cancel(false);
            actionTimer = null;
        }
    }
}
