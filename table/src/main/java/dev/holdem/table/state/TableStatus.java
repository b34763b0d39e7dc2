package dev.holdem.table.state;

/**
 * Lifecycle status of a table.
 */
public enum TableStatus {
    WAITING,
    IN_PROGRESS,
    PAUSED,
    FINISHED
}
