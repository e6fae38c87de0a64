package com.statespace.core.hanoi;

import com.statespace.core.State;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of a Tower of Hanoi puzzle.
 *
 * <p>Discs are numbered {@code 1..discCount} from smallest to largest and pegs {@code 0..pegCount-1}.
 * Because discs on a peg are always ordered, the peg of every disc fully determines the state. The
 * identifier reads those pegs as a base-{@code pegCount} number with the largest disc as most
 * significant digit.
 */
public final class HanoiState implements State {

    private final int pegCount;
    private final int[] pegOfDisc;
    private final HanoiState predecessor;

    private HanoiState(int pegCount, int[] pegOfDisc, HanoiState predecessor) {
        this.pegCount = pegCount;
        this.pegOfDisc = pegOfDisc;
        this.predecessor = predecessor;
    }

    /**
     * Creates the starting configuration with every disc stacked on the first peg.
     */
    public static HanoiState initial(int pegCount, int discCount) {
        if (pegCount < 1 || discCount < 1) {
            throw new IllegalArgumentException("Peg and disc counts must be positive");
        }
        return new HanoiState(pegCount, new int[discCount], null);
    }

    /**
     * Creates a state from explicit peg contents, each peg listed bottom to top.
     */
    public static HanoiState of(List<List<Integer>> pegs) {
        Objects.requireNonNull(pegs, "pegs");
        int discCount = pegs.stream().mapToInt(List::size).sum();
        int[] pegOfDisc = new int[discCount];
        boolean[] seen = new boolean[discCount + 1];
        for (int peg = 0; peg < pegs.size(); peg++) {
            int previous = Integer.MAX_VALUE;
            for (int disc : pegs.get(peg)) {
                if (disc < 1 || disc > discCount || seen[disc]) {
                    throw new IllegalArgumentException("Discs must be the distinct numbers 1.." + discCount);
                }
                if (disc > previous) {
                    throw new IllegalArgumentException("Disc " + disc + " rests on the smaller disc " + previous);
                }
                seen[disc] = true;
                previous = disc;
                pegOfDisc[disc - 1] = peg;
            }
        }
        return new HanoiState(pegs.size(), pegOfDisc, null);
    }

    /**
     * Enumerates moves by ascending source peg, then ascending target peg.
     */
    @Override
    public List<State> children() {
        int[] topDisc = topDiscs();
        List<State> children = new ArrayList<>();
        for (int from = 0; from < pegCount; from++) {
            int disc = topDisc[from];
            if (disc == 0) {
                continue;
            }
            for (int to = 0; to < pegCount; to++) {
                if (from == to || (topDisc[to] != 0 && topDisc[to] < disc)) {
                    continue;
                }
                int[] moved = pegOfDisc.clone();
                moved[disc - 1] = to;
                children.add(new HanoiState(pegCount, moved, this));
            }
        }
        return children;
    }

    @Override
    public boolean isGoal() {
        int lastPeg = pegCount - 1;
        for (int peg : pegOfDisc) {
            if (peg != lastPeg) {
                return false;
            }
        }
        return true;
    }

    @Override
    public long identifier() {
        long identifier = 0L;
        for (int disc = pegOfDisc.length; disc >= 1; disc--) {
            identifier = identifier * pegCount + pegOfDisc[disc - 1];
        }
        return identifier;
    }

    @Override
    public Optional<State> predecessor() {
        return Optional.ofNullable(predecessor);
    }

    public int pegCount() {
        return pegCount;
    }

    public int discCount() {
        return pegOfDisc.length;
    }

    /**
     * Returns the discs of every peg, listed bottom to top.
     */
    public List<List<Integer>> pegs() {
        List<List<Integer>> pegs = new ArrayList<>(pegCount);
        for (int peg = 0; peg < pegCount; peg++) {
            pegs.add(new ArrayList<>());
        }
        for (int disc = pegOfDisc.length; disc >= 1; disc--) {
            pegs.get(pegOfDisc[disc - 1]).add(disc);
        }
        List<List<Integer>> view = new ArrayList<>(pegCount);
        for (List<Integer> peg : pegs) {
            view.add(Collections.unmodifiableList(peg));
        }
        return Collections.unmodifiableList(view);
    }

    /**
     * Renders one line per peg, e.g. {@code Peg 1: 3 2 1}.
     */
    public String render() {
        StringBuilder builder = new StringBuilder();
        List<List<Integer>> pegs = pegs();
        for (int peg = 0; peg < pegs.size(); peg++) {
            builder.append("Peg ").append(peg + 1).append(':');
            for (int disc : pegs.get(peg)) {
                builder.append(' ').append(disc);
            }
            builder.append(System.lineSeparator());
        }
        return builder.toString();
    }

    private int[] topDiscs() {
        int[] top = new int[pegCount];
        for (int disc = pegOfDisc.length; disc >= 1; disc--) {
            top[pegOfDisc[disc - 1]] = disc;
        }
        return top;
    }

    @Override
    public String toString() {
        return "HanoiState" + pegs();
    }
}
