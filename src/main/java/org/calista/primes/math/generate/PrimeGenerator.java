package org.calista.primes.math.generate;

import org.calista.primes.math.primality.PrimalityTest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Generates the first N primes by testing 2, 3, 4... one by one.
 *
 * There is no cap on N; a huge count simply runs for a long time.
 */
public final class PrimeGenerator {

    private final PrimalityTest test;

    public PrimeGenerator(PrimalityTest test) {
        this.test = Objects.requireNonNull(test, "test");
    }

    public List<Integer> firstN(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Prime count must not be negative: " + count);
        }
        if (count == 0) return Collections.emptyList();

        ArrayList<Integer> primes = new ArrayList<>(Math.min(count, 1 << 16));
        int candidate = 2;
        while (primes.size() < count) {
            if (test.isPrime(candidate)) primes.add(candidate);
            candidate++;
        }
        return primes;
    }

    public PrimalityTest test() {
        return test;
    }
}
