package org.calista.primes.math.primality.impl;

import org.calista.primes.math.primality.PrimalityTest;

/**
 * SixKTrialDivision — trial division over divisors of the form 6k±1.
 *
 * <p>Every prime above 3 is 6k-1 or 6k+1, so after rejecting multiples of 2 and 3
 * only the pairs (5, 7), (11, 13), (17, 19)... need to be tried.</p>
 *
 * The loop bound is {@code i <= n / i} rather than {@code i * i <= n}: the square of
 * the divisor never gets computed, so inputs close to {@link Long#MAX_VALUE} do not wrap.
 */
public final class SixKTrialDivision implements PrimalityTest {

    public static final String NAME = "six-k";

    @Override
    public boolean isPrime(long n) {
        if (n <= 1) return false;
        if (n <= 3) return true;
        if (n % 2 == 0 || n % 3 == 0) return false;

        for (long i = 5; i <= n / i; i += 6) {
            if (n % i == 0 || n % (i + 2) == 0) return false;
        }
        return true;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String toString() {
        return "SixKTrialDivision";
    }
}
