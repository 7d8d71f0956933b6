package org.calista.primes.math.primality.impl;

import org.calista.primes.math.primality.PrimalityTest;

/**
 * Odd-divisor trial division up to floor(sqrt(n)).
 */
public final class OddTrialDivision implements PrimalityTest {

    public static final String NAME = "odd";

    @Override
    public boolean isPrime(long n) {
        if (n <= 1) return false;
        if (n == 2) return true;
        if (n % 2 == 0) return false;

        long limit = isqrt(n);
        for (long i = 3; i <= limit; i += 2) {
            if (n % i == 0) return false;
        }
        return true;
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Exact integer square root for n >= 0.
     * Math.sqrt is off by one for some longs above 2^52, the two loops correct it.
     */
    static long isqrt(long n) {
        long r = (long) Math.sqrt((double) n);
        while (r > 0 && r > n / r) r--;
        while (r + 1 <= n / (r + 1)) r++;
        return r;
    }

    @Override
    public String toString() {
        return "OddTrialDivision";
    }
}
