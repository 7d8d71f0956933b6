package org.calista.primes.math.generate;

import org.calista.primes.math.primality.impl.OddTrialDivision;
import org.calista.primes.math.primality.impl.SixKTrialDivision;
import org.calista.primes.math.sieve.SieveOfEratosthenes;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrimeGeneratorTest {

    private final PrimeGenerator generator = new PrimeGenerator(new SixKTrialDivision());

    @Test
    void firstTwentyPrimes() {
        assertEquals(List.of(2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37, 41, 43, 47, 53, 59, 61, 67, 71),
                generator.firstN(20));
    }

    @Test
    void zeroAndOne() {
        assertTrue(generator.firstN(0).isEmpty());
        assertEquals(List.of(2), generator.firstN(1));
    }

    @Test
    void negativeCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> generator.firstN(-1));
    }

    @Test
    void matchesSievePrefixForEitherStrategy() {
        List<Integer> sieved = new SieveOfEratosthenes().primesUpTo(7_919); // 7919 is the 1000th prime
        assertEquals(1_000, sieved.size());
        assertEquals(sieved, generator.firstN(1_000));
        assertEquals(sieved, new PrimeGenerator(new OddTrialDivision()).firstN(1_000));
    }

    @Test
    void requiresTest() {
        assertThrows(NullPointerException.class, () -> new PrimeGenerator(null));
    }
}
