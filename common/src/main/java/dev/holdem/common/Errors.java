package dev.holdem.common;

import io.grpc.Status;

/**
 * Exception types raised by the table engine.
 *
 * <p>Every error carries a {@link Status.Code} so a transport layer can map it
 * without inspecting the concrete type.
 */
public class Errors {

    /**
     * Base exception for all engine errors.
     */
    public static class EngineError extends RuntimeException {
        private final Status.Code statusCode;

        public EngineError(String message, Status.Code statusCode) {
            super(message);
            this.statusCode = statusCode;
        }

        public EngineError(String message, Status.Code statusCode, Throwable cause) {
            super(message, cause);
            this.statusCode = statusCode;
        }

        public Status.Code getStatusCode() {
            return statusCode;
        }

        /**
         * Convert to gRPC Status for RPC responses.
         */
        public Status toGrpcStatus() {
            return Status.fromCode(statusCode).withDescription(getMessage());
        }

        /**
         * Returns true if this is a "not found" error.
         */
        public boolean isNotFound() {
            return statusCode == Status.Code.NOT_FOUND;
        }

        /**
         * Returns true if this is a "precondition failed" error.
         */
        public boolean isPreconditionFailed() {
            return statusCode == Status.Code.FAILED_PRECONDITION;
        }

        /**
         * Returns true if this is an "invalid argument" error.
         */
        public boolean isInvalidArgument() {
            return statusCode == Status.Code.INVALID_ARGUMENT;
        }

        /**
         * Returns true if the caller may retry the same request unchanged.
         */
        public boolean isRetryable() {
            return statusCode == Status.Code.UNAVAILABLE;
        }
    }

    /**
     * Thrown when a command is rejected due to a game rule or state violation.
     *
     * <p>Rejections never mutate table state; the caller may retry with a
     * corrected command.
     *
     * <pre>{@code
     * if (table.getStatus() != TableStatus.WAITING) {
     *     throw Errors.CommandRejectedError.preconditionFailed("Table already started");
     * }
     * if (amount <= 0) {
     *     throw Errors.CommandRejectedError.invalidArgument("amount must be positive");
     * }
     * }</pre>
     */
    public static class CommandRejectedError extends EngineError {

        public CommandRejectedError(String message) {
            this(message, Status.Code.FAILED_PRECONDITION);
        }

        public CommandRejectedError(String message, Status.Code statusCode) {
            super(message, statusCode);
        }

        /**
         * Create a FAILED_PRECONDITION error for state precondition violations.
         */
        public static CommandRejectedError preconditionFailed(String message) {
            return new CommandRejectedError(message, Status.Code.FAILED_PRECONDITION);
        }

        /**
         * Create an INVALID_ARGUMENT error for invalid command inputs.
         */
        public static CommandRejectedError invalidArgument(String message) {
            return new CommandRejectedError(message, Status.Code.INVALID_ARGUMENT);
        }
    }

    /**
     * Thrown when a seat submits an action while another seat is to act.
     */
    public static class NotYourTurnError extends CommandRejectedError {
        private final int seatNumber;
        private final int seatToAct;

        public NotYourTurnError(int seatNumber, int seatToAct) {
            super("Seat " + seatNumber + " is not to act (seat " + seatToAct + " is)",
                Status.Code.FAILED_PRECONDITION);
            this.seatNumber = seatNumber;
            this.seatToAct = seatToAct;
        }

        public int getSeatNumber() {
            return seatNumber;
        }

        public int getSeatToAct() {
            return seatToAct;
        }
    }

    /**
     * Thrown when an action kind or amount is illegal for the current betting state.
     */
    public static class InvalidActionError extends CommandRejectedError {
        public InvalidActionError(String message) {
            super(message, Status.Code.INVALID_ARGUMENT);
        }
    }

    /**
     * Thrown when fewer than two seats are able to play.
     */
    public static class InsufficientPlayersError extends CommandRejectedError {
        private final int eligibleSeats;

        public InsufficientPlayersError(int eligibleSeats) {
            super("At least 2 seats must be able to play, found " + eligibleSeats,
                Status.Code.FAILED_PRECONDITION);
            this.eligibleSeats = eligibleSeats;
        }

        public int getEligibleSeats() {
            return eligibleSeats;
        }
    }

    /**
     * Thrown when more cards are drawn than remain in a deck.
     *
     * <p>Unreachable with at most eight seats; signals a programming error.
     */
    public static class DeckExhaustedError extends EngineError {
        public DeckExhaustedError(int requested, int remaining) {
            super("Cannot draw " + requested + " cards, only " + remaining + " remain",
                Status.Code.INTERNAL);
        }
    }

    /**
     * Thrown when the state store cannot apply a transition.
     */
    public static class StatePersistenceError extends EngineError {
        public StatePersistenceError(String message) {
            super(message, Status.Code.UNAVAILABLE);
        }

        public StatePersistenceError(String message, Throwable cause) {
            super(message, Status.Code.UNAVAILABLE, cause);
        }
    }

    /**
     * Thrown when the state store has no table with the requested id.
     */
    public static class TableNotFoundError extends EngineError {
        public TableNotFoundError(String tableId) {
            super("Table not found: " + tableId, Status.Code.NOT_FOUND);
        }
    }
}
