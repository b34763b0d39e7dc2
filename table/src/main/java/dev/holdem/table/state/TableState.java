package dev.holdem.table.state;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Durable state of a table: settings, seats and button.
 *
 * <p>Seats are kept in ascending seat-number order, which is also clockwise
 * order around the table.
 */
public class TableState {

    private final String tableId;
    private final TableSettings settings;
    private final NavigableMap<Integer, SeatState> seats = new TreeMap<>();
    private Integer buttonSeat;
    /** Seat the last button was on; rotation continues from here even after it is cleared. */
    private Integer lastButtonSeat;
    private TableStatus status = TableStatus.WAITING;
    private long handCount = 0;

    public TableState(String tableId, TableSettings settings) {
        this.tableId = tableId;
        this.settings = settings;
    }

    // Getters and setters

    public String getTableId() {
        return tableId;
    }

    public TableSettings getSettings() {
        return settings;
    }

    public Integer getButtonSeat() {
        return buttonSeat;
    }

    public void setButtonSeat(Integer buttonSeat) {
        this.buttonSeat = buttonSeat;
    }

    public Integer getLastButtonSeat() {
        return lastButtonSeat;
    }

    public void setLastButtonSeat(Integer lastButtonSeat) {
        this.lastButtonSeat = lastButtonSeat;
    }

    public TableStatus getStatus() {
        return status;
    }

    public void setStatus(TableStatus status) {
        this.status = status;
    }

    public long getHandCount() {
        return handCount;
    }

    public void setHandCount(long handCount) {
        this.handCount = handCount;
    }

    public Map<Integer, SeatState> getSeats() {
        return seats;
    }

    // Helper methods

    public void addSeat(SeatState seat) {
        if (seat.getSeatNumber() < 1 || seat.getSeatNumber() > settings.maxPlayers()) {
            throw new IllegalArgumentException("seat_number must be between 1 and " + settings.maxPlayers());
        }
        seats.put(seat.getSeatNumber(), seat);
    }

    public SeatState getSeat(int seatNumber) {
        return seats.get(seatNumber);
    }

    public Collection<SeatState> seatsInOrder() {
        return seats.values();
    }

    public List<Integer> eligibleSeatNumbers() {
        List<Integer> result = new ArrayList<>();
        for (SeatState seat : seats.values()) {
            if (seat.isEligibleForHand()) {
                result.add(seat.getSeatNumber());
            }
        }
        return result;
    }

    public int getEligibleSeatCount() {
        return eligibleSeatNumbers().size();
    }

    public long totalChips() {
        return seats.values().stream().mapToLong(SeatState::getChipCount).sum();
    }

    /**
     * Deep copy; mutations of the copy are invisible to this instance.
     */
    public TableState copy() {
        TableState copy = new TableState(tableId, settings);
        for (SeatState seat : seats.values()) {
            copy.seats.put(seat.getSeatNumber(), seat.copy());
        }
        copy.buttonSeat = buttonSeat;
        copy.lastButtonSeat = lastButtonSeat;
        copy.status = status;
        copy.handCount = handCount;
        return copy;
    }
}
