package dev.holdem.handflow;

import dev.holdem.hand.events.HandEvent;
import dev.holdem.hand.state.HandState;
import dev.holdem.table.state.TableState;

import java.util.List;

/**
 * Everything one command changed, committed as a unit.
 *
 * @param table table state after the command
 * @param hand current or just-finished hand, null before the first hand
 * @param events what happened, in order
 */
public record TableTransition(TableState table, HandState hand, List<HandEvent> events) {

    public TableTransition {
        events = List.copyOf(events);
    }
}
