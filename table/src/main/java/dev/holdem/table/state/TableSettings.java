package dev.holdem.table.state;

import dev.holdem.common.Errors;
import dev.holdem.common.Validation;

import java.time.Duration;

/**
 * Stakes and limits of a table.
 *
 * @param smallBlind forced bet of the seat left of the button
 * @param bigBlind forced bet of the next seat, also the minimum bet and initial minimum raise
 * @param buyIn starting chip count of a seat
 * @param maxPlayers seat capacity, 2 to 8
 * @param actionTimeout time a seat has to act before the engine acts for it; zero disables the timer
 */
public record TableSettings(
    long smallBlind,
    long bigBlind,
    long buyIn,
    int maxPlayers,
    Duration actionTimeout
) {
    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 8;

    public TableSettings {
        if (actionTimeout == null) {
            actionTimeout = Duration.ZERO;
        }
    }

    public TableSettings(long smallBlind, long bigBlind, long buyIn, int maxPlayers) {
        this(smallBlind, bigBlind, buyIn, maxPlayers, Duration.ZERO);
    }

    /**
     * Reject settings a hand cannot be played with.
     *
     * @throws Errors.CommandRejectedError if any limit is violated
     */
    public void validate() {
        Validation.requirePositive(smallBlind, "small_blind");
        Validation.requirePositive(bigBlind, "big_blind");
        Validation.requirePositive(buyIn, "buy_in");
        Validation.requireInRange(maxPlayers, MIN_PLAYERS, MAX_PLAYERS, "max_players");
        if (bigBlind < smallBlind) {
            throw Errors.CommandRejectedError.invalidArgument(
                "Big blind must be greater than or equal to small blind");
        }
        Validation.requireNonNegative(actionTimeout.toMillis(), "action_timeout");
    }

    public boolean hasActionTimeout() {
        return !actionTimeout.isZero();
    }
}
