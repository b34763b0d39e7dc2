package dev.holdem.table.handlers;

import dev.holdem.common.Errors;
import dev.holdem.common.Validation;
import dev.holdem.table.PositionResolver;
import dev.holdem.table.Positions;
import dev.holdem.table.state.SeatState;
import dev.holdem.table.state.SeatStatus;
import dev.holdem.table.state.TableState;
import dev.holdem.table.state.TableStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Functional handlers for table lifecycle commands.
 *
 * <p>Each handler validates against the given state, then mutates it. Callers
 * pass a working copy so a rejected command leaves the live state untouched.
 */
public final class TableHandlers {
    private static final Logger logger = LoggerFactory.getLogger(TableHandlers.class);

    private TableHandlers() {}

    /**
     * Move a waiting table into play.
     */
    public static void handleStartTable(TableState state) {
        Validation.requireStatus(state.getStatus(), TableStatus.WAITING, "Table has already started or is finished");
        state.getSettings().validate();
        int eligible = state.getEligibleSeatCount();
        if (eligible < 2) {
            throw new Errors.InsufficientPlayersError(eligible);
        }
        state.setStatus(TableStatus.IN_PROGRESS);
        logger.info("table_started", kv("table", state.getTableId()), kv("seats", eligible));
    }

    public static void handlePause(TableState state) {
        Validation.requireStatus(state.getStatus(), TableStatus.IN_PROGRESS, "Only a running table can be paused");
        state.setStatus(TableStatus.PAUSED);
    }

    public static void handleResume(TableState state) {
        Validation.requireStatus(state.getStatus(), TableStatus.PAUSED, "Only a paused table can be resumed");
        state.setStatus(TableStatus.IN_PROGRESS);
    }

    /**
     * Rotate the button and count the hand.
     *
     * @return positions for the new hand
     */
    public static Positions handleBeginHand(TableState state) {
        Validation.requireStatus(state.getStatus(), TableStatus.IN_PROGRESS, "Cannot start a hand");
        Positions positions = PositionResolver.resolve(state.seatsInOrder(), state.getLastButtonSeat());
        state.setButtonSeat(positions.button());
        state.setLastButtonSeat(positions.button());
        state.setHandCount(state.getHandCount() + 1);
        return positions;
    }

    /**
     * Return seats to their between-hands status.
     *
     * <p>Busted seats sit out. A button left on a sitting-out seat is cleared;
     * the next hand still rotates from its position. The table finishes when
     * fewer than two seats can play.
     */
    public static void handleEndHand(TableState state) {
        for (SeatState seat : state.seatsInOrder()) {
            if (seat.getStatus() == SeatStatus.SITTING_OUT) {
                continue;
            }
            seat.setStatus(seat.getChipCount() > 0 ? SeatStatus.PLAYING : SeatStatus.SITTING_OUT);
        }
        Integer button = state.getButtonSeat();
        if (button != null && !state.getSeat(button).isEligibleForHand()) {
            state.setButtonSeat(null);
        }
        if (state.getEligibleSeatCount() < 2) {
            state.setStatus(TableStatus.FINISHED);
            logger.info("table_finished", kv("table", state.getTableId()), kv("hands", state.getHandCount()));
        }
    }
}
