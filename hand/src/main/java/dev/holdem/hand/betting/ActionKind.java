package dev.holdem.hand.betting;

public enum ActionKind {
    FOLD,
    CHECK,
    CALL,
    BET,
    RAISE;

    public boolean takesAmount() {
        return this == BET || this == RAISE;
    }
}
