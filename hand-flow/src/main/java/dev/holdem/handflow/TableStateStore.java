package dev.holdem.handflow;

import dev.holdem.common.Errors;
import dev.holdem.table.state.TableState;

/**
 * Durable storage for tables, provided by the host application.
 */
public interface TableStateStore {

    /**
     * Load a table with its seats.
     *
     * @return the table, or null if it does not exist
     */
    TableState loadTableState(String tableId);

    /**
     * Persist a transition atomically: either all of it is stored or none.
     *
     * @throws Errors.StatePersistenceError if the write failed
     */
    void commitTableState(String tableId, TableTransition transition);
}
