package org.calista.primes.math.twin;

import org.calista.primes.math.primality.PrimalityTest;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Enumerates twin primes (i, i + 2) with 2 <= i <= limit - 2.
 * Pure: formatting belongs to the caller.
 */
public final class TwinPrimeFinder {

    private final PrimalityTest test;

    public TwinPrimeFinder(PrimalityTest test) {
        this.test = Objects.requireNonNull(test, "test");
    }

    public List<TwinPair> upTo(int limit) {
        ArrayList<TwinPair> pairs = new ArrayList<>();
        // long bound: limit - 2 wraps around for limits near Integer.MIN_VALUE
        long last = (long) limit - 2;
        for (long i = 2; i <= last; i++) {
            if (test.isPrime(i) && test.isPrime(i + 2)) {
                pairs.add(TwinPair.of((int) i));
            }
        }
        return pairs;
    }
}
