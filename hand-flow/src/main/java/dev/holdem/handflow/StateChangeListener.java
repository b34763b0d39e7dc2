package dev.holdem.handflow;

import dev.holdem.handflow.proto.PublicTableView;

/**
 * Receives the table as one audience may see it after every committed change.
 *
 * <p>Called once per audience: each seated occupant gets a view with their own
 * hole cards, spectators get {@link PublicTableView#getViewerSeat()} 0.
 */
@FunctionalInterface
public interface StateChangeListener {

    void notifyStateChanged(String tableId, PublicTableView view);
}
