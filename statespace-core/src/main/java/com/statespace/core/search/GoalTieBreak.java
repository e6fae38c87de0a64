package com.statespace.core.search;

import com.statespace.core.State;

/**
 * Ordering used whenever several goals compete: the numerically lowest identifier wins, comparing
 * identifiers as unsigned 64-bit values.
 */
public final class GoalTieBreak {

    private GoalTieBreak() {
    }

    /**
     * Returns {@code true} if {@code candidate} strictly improves on {@code incumbent}. Any goal
     * improves on a missing incumbent.
     */
    public static boolean improves(State candidate, State incumbent) {
        if (incumbent == null) {
            return true;
        }
        return Long.compareUnsigned(candidate.identifier(), incumbent.identifier()) < 0;
    }
}
