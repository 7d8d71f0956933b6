package org.calista.primes.math.twin;

import java.util.Objects;

/**
 * Two primes exactly 2 apart.
 */
public final class TwinPair {
    public final int lower;
    public final int upper;

    public TwinPair(int lower) {
        this.lower = lower;
        this.upper = lower + 2;
    }

    public static TwinPair of(int lower) {
        return new TwinPair(lower);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof TwinPair p)) return false;
        return lower == p.lower;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper);
    }

    /** "(lower, upper)" */
    @Override
    public String toString() {
        return "(" + lower + ", " + upper + ")";
    }
}
