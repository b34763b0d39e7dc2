package dev.holdem.hand.betting;

/**
 * Where a betting round stands after its last transition.
 */
public enum RoundStatus {
    /** A seat must act; see {@link BettingRound#getSeatToAct()}. */
    AWAITING_ACTION,
    /** Every seat that can act has matched the bet. */
    ROUND_COMPLETE,
    /** At most one seat still holds a claim on the pot. */
    HAND_COMPLETE
}
