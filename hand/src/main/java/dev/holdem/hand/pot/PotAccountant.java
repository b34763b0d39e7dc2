package dev.holdem.hand.pot;

import dev.holdem.hand.eval.HandStrength;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Tracks every seat's chips committed this hand and layers them into pots.
 *
 * <p>A new layer starts at each distinct contribution of a non-folded all-in
 * seat. A layer holds, from every seat, the part of its contribution that lies
 * inside the layer, and is contested by the non-folded seats that reached into
 * it. Folded chips stay in the pots they were committed to.
 */
public class PotAccountant {

    private final Map<Integer, Long> contributions = new TreeMap<>();
    private final Set<Integer> folded = new HashSet<>();
    private final Set<Integer> allIn = new HashSet<>();

    /**
     * Record chips a seat moved into the pot.
     */
    public void contribute(int seatNumber, long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Contribution must be non-negative, got " + amount);
        }
        contributions.merge(seatNumber, amount, Long::sum);
    }

    public void markFolded(int seatNumber) {
        folded.add(seatNumber);
    }

    public void markAllIn(int seatNumber) {
        allIn.add(seatNumber);
    }

    public long total() {
        return contributions.values().stream().mapToLong(Long::longValue).sum();
    }

    /**
     * Current pots, main pot first.
     */
    public List<Pot> pots() {
        TreeSet<Long> levels = new TreeSet<>();
        long highest = 0;
        for (Map.Entry<Integer, Long> entry : contributions.entrySet()) {
            highest = Math.max(highest, entry.getValue());
            if (allIn.contains(entry.getKey()) && !folded.contains(entry.getKey()) && entry.getValue() > 0) {
                levels.add(entry.getValue());
            }
        }
        if (highest == 0) {
            return List.of();
        }
        levels.add(highest);

        List<Pot> pots = new ArrayList<>();
        long previous = 0;
        long carried = 0;
        for (long level : levels) {
            long amount = carried;
            List<Integer> eligible = new ArrayList<>();
            for (Map.Entry<Integer, Long> entry : contributions.entrySet()) {
                long contribution = entry.getValue();
                amount += Math.min(contribution, level) - Math.min(contribution, previous);
                if (contribution > previous && !folded.contains(entry.getKey())) {
                    eligible.add(entry.getKey());
                }
            }
            previous = level;
            if (eligible.isEmpty()) {
                carried = amount;
                continue;
            }
            carried = 0;
            if (amount > 0) {
                pots.add(new Pot(amount, eligible));
            }
        }
        if (carried > 0 && !pots.isEmpty()) {
            Pot last = pots.remove(pots.size() - 1);
            pots.add(new Pot(last.amount() + carried, last.eligibleSeats()));
        }
        return pots;
    }

    /**
     * Split every pot among its best eligible hands.
     *
     * <p>Ties split evenly; the whole remainder goes to the first tied winner
     * clockwise from the button.
     *
     * @param hands strength of each contending seat; a lone contender may map to null
     * @param buttonSeat button of the hand, used for odd-chip order
     * @return awards, pot by pot
     */
    public List<PotAward> settle(Map<Integer, HandStrength> hands, int buttonSeat) {
        List<PotAward> awards = new ArrayList<>();
        List<Pot> pots = pots();
        for (int index = 0; index < pots.size(); index++) {
            Pot pot = pots.get(index);
            List<Integer> winners = winnersOf(pot, hands);
            winners.sort((a, b) -> Integer.compare(clockwiseDistance(buttonSeat, a), clockwiseDistance(buttonSeat, b)));

            long share = pot.amount() / winners.size();
            long oddChips = pot.amount() % winners.size();
            for (int i = 0; i < winners.size(); i++) {
                long amount = share + (i == 0 ? oddChips : 0);
                if (amount > 0) {
                    awards.add(new PotAward(index, winners.get(i), amount));
                }
            }
        }
        return awards;
    }

    private static List<Integer> winnersOf(Pot pot, Map<Integer, HandStrength> hands) {
        List<Integer> contenders = new ArrayList<>();
        for (int seat : pot.eligibleSeats()) {
            if (hands.containsKey(seat)) {
                contenders.add(seat);
            }
        }
        if (contenders.isEmpty()) {
            throw new IllegalStateException("No contender for pot " + pot);
        }
        if (contenders.size() == 1) {
            return contenders;
        }

        HandStrength best = null;
        List<Integer> winners = new ArrayList<>();
        for (int seat : contenders) {
            HandStrength strength = hands.get(seat);
            if (best == null || strength.beats(best)) {
                best = strength;
                winners.clear();
                winners.add(seat);
            } else if (strength.ties(best)) {
                winners.add(seat);
            }
        }
        return winners;
    }

    /**
     * Steps from the button to {@code seat} going clockwise; the button itself is last.
     */
    private static int clockwiseDistance(int buttonSeat, int seat) {
        return seat > buttonSeat ? seat - buttonSeat : seat - buttonSeat + 1000;
    }

    public PotAccountant copy() {
        PotAccountant copy = new PotAccountant();
        copy.contributions.putAll(contributions);
        copy.folded.addAll(folded);
        copy.allIn.addAll(allIn);
        return copy;
    }
}
