package org.calista.primes.math.factor;

import java.util.ArrayList;
import java.util.Collections;

/**
 * PrimeFactorizer — factorization by trial division.
 *
 * <p>The odd-divisor bound is checked against the remaining cofactor, not the original input:
 * once the small factors are divided out, the loop stops at sqrt(remainder).
 * Whatever is left above 2 afterwards is itself prime.</p>
 */
public final class PrimeFactorizer {

    /**
     * @param n value to factor; {@code n <= 1} has no prime factors
     */
    public Factorization factorize(long n) {
        if (n <= 1) return new Factorization(n, Collections.emptyList());

        ArrayList<Long> factors = new ArrayList<>(8);
        long rest = n;

        while (rest % 2 == 0) {
            factors.add(2L);
            rest /= 2;
        }

        for (long i = 3; i <= rest / i; i += 2) {
            while (rest % i == 0) {
                factors.add(i);
                rest /= i;
            }
        }

        if (rest > 2) factors.add(rest);

        return new Factorization(n, factors);
    }
}
