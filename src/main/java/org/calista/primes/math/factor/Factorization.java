package org.calista.primes.math.factor;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Immutable result of a factorization: the input and its prime factors, ascending, with multiplicity.
 */
public final class Factorization {

    public static final String TIMES = " × ";

    public final long n;
    public final List<Long> factors;

    public Factorization(long n, List<Long> factors) {
        this.n = n;
        this.factors = List.copyOf(Objects.requireNonNull(factors, "factors"));
    }

    public boolean isEmpty() {
        return factors.isEmpty();
    }

    /**
     * Product of all factors (1 for the empty factorization).
     *
     * @throws ArithmeticException if the product does not fit in a long
     */
    public long product() {
        long p = 1L;
        for (long f : factors) p = Math.multiplyExact(p, f);
        return p;
    }

    /** "2 × 2 × 3"; empty string when there are no factors. */
    public String render() {
        StringJoiner sj = new StringJoiner(TIMES);
        for (long f : factors) sj.add(Long.toString(f));
        return sj.toString();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Factorization f)) return false;
        return n == f.n && factors.equals(f.factors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(n, factors);
    }

    @Override
    public String toString() {
        return "Factorization{n=" + n + ", factors=" + factors + '}';
    }
}
