package dev.holdem.hand.betting;

/**
 * A seat's request to act. Not an entity: it is validated, applied and dropped.
 *
 * <p>For {@link ActionKind#BET} and {@link ActionKind#RAISE} the amount is the
 * seat's new total for the street ("bet 40", "raise to 120"). Other kinds carry
 * no amount.
 *
 * @param seatNumber acting seat
 * @param kind what the seat does
 * @param amount street total for bet/raise, null otherwise
 */
public record Action(int seatNumber, ActionKind kind, Long amount) {

    public static Action fold(int seatNumber) {
        return new Action(seatNumber, ActionKind.FOLD, null);
    }

    public static Action check(int seatNumber) {
        return new Action(seatNumber, ActionKind.CHECK, null);
    }

    public static Action call(int seatNumber) {
        return new Action(seatNumber, ActionKind.CALL, null);
    }

    public static Action bet(int seatNumber, long amount) {
        return new Action(seatNumber, ActionKind.BET, amount);
    }

    public static Action raiseTo(int seatNumber, long amount) {
        return new Action(seatNumber, ActionKind.RAISE, amount);
    }

    @Override
    public String toString() {
        return "seat " + seatNumber + " " + kind.name().toLowerCase() + (amount != null ? " " + amount : "");
    }
}
