package org.calista.primes.math.sieve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SieveOfEratosthenes — all primes up to a bound.
 *
 * <p>O(n log log n) time, O(n) space. The marking array is allocated per call and
 * never leaves it, so one instance can be shared freely.</p>
 *
 * No upper bound is enforced: the caller decides how much memory a bound is worth.
 */
public final class SieveOfEratosthenes {

    /**
     * @param n inclusive upper bound
     * @return ascending primes {@code <= n}; empty when {@code n < 2}
     */
    public List<Integer> primesUpTo(int n) {
        if (n < 2) return Collections.emptyList();

        boolean[] composite = mark(n);

        // pi(n) ~ n / ln n, a slightly larger guess avoids regrowth
        int expected = (int) Math.min(Integer.MAX_VALUE - 8L, (long) (1.26 * n / Math.log(n)) + 1);
        ArrayList<Integer> primes = new ArrayList<>(expected);
        for (int i = 2; i <= n; i++) {
            if (!composite[i]) primes.add(i);
        }
        return primes;
    }

    /**
     * Strikes multiples of every surviving p starting at p*p.
     * Index 0 and 1 are composite by definition; {@code false} means "still prime".
     */
    private static boolean[] mark(int n) {
        boolean[] composite = new boolean[Math.addExact(n, 1)];
        composite[0] = true;
        composite[1] = true;

        for (int p = 2; (long) p * p <= n; p++) {
            if (composite[p]) continue;
            // long index: p*p + k*p may pass Integer.MAX_VALUE before the loop test fails
            for (long i = (long) p * p; i <= n; i += p) {
                composite[(int) i] = true;
            }
        }
        return composite;
    }
}
