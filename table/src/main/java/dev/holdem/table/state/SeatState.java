package dev.holdem.table.state;

/**
 * A seat at the table and its occupant's chips.
 */
public class SeatState {

    private final int seatNumber;
    private final String occupantId;
    private long chipCount;
    private SeatStatus status = SeatStatus.PLAYING;

    public SeatState(int seatNumber, String occupantId, long chipCount) {
        this.seatNumber = seatNumber;
        this.occupantId = occupantId;
        this.chipCount = chipCount;
    }

    public SeatState(int seatNumber, String occupantId, long chipCount, SeatStatus status) {
        this(seatNumber, occupantId, chipCount);
        this.status = status;
    }

    public int getSeatNumber() {
        return seatNumber;
    }

    public String getOccupantId() {
        return occupantId;
    }

    public long getChipCount() {
        return chipCount;
    }

    public void setChipCount(long chipCount) {
        if (chipCount < 0) {
            throw new IllegalArgumentException("chip_count must be non-negative, got " + chipCount);
        }
        this.chipCount = chipCount;
    }

    public SeatStatus getStatus() {
        return status;
    }

    public void setStatus(SeatStatus status) {
        this.status = status;
    }

    /**
     * Remove chips from the stack and return how many were actually taken.
     */
    public long takeChips(long amount) {
        long taken = Math.min(amount, chipCount);
        chipCount -= taken;
        return taken;
    }

    public void addChips(long amount) {
        chipCount += amount;
    }

    /**
     * Whether this seat can be dealt into the next hand.
     */
    public boolean isEligibleForHand() {
        return status == SeatStatus.PLAYING && chipCount > 0;
    }

    public boolean isPlaying() {
        return status == SeatStatus.PLAYING;
    }

    public SeatState copy() {
        return new SeatState(seatNumber, occupantId, chipCount, status);
    }

    @Override
    public String toString() {
        return "Seat{" + seatNumber + ", " + occupantId + ", chips=" + chipCount + ", " + status + "}";
    }
}
