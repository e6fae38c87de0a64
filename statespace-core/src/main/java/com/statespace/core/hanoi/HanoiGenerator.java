package com.statespace.core.hanoi;

import com.statespace.core.InvalidConfigurationException;
import com.statespace.core.ProblemGenerator;

/**
 * Produces the classic starting tower: every disc on the first peg, largest at the bottom.
 */
public final class HanoiGenerator implements ProblemGenerator {

    private final int pegCount;
    private final int discCount;

    public HanoiGenerator(int pegCount, int discCount) {
        if (pegCount < 3) {
            throw new InvalidConfigurationException("Number of pegs must be at least 3.");
        }
        if (discCount < 1) {
            throw new InvalidConfigurationException("Number of discs must be at least 1.");
        }
        if (!identifierFits(pegCount, discCount)) {
            throw new InvalidConfigurationException(
                    pegCount + " pegs and " + discCount + " discs do not fit a 64-bit state identifier.");
        }
        this.pegCount = pegCount;
        this.discCount = discCount;
    }

    @Override
    public HanoiState generate() {
        return HanoiState.initial(pegCount, discCount);
    }

    private static boolean identifierFits(int pegCount, int discCount) {
        long states = 1L;
        for (int i = 0; i < discCount; i++) {
            if (states > Long.MAX_VALUE / pegCount) {
                return false;
            }
            states *= pegCount;
        }
        return true;
    }
}
