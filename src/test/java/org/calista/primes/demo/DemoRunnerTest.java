package org.calista.primes.demo;

import org.calista.primes.core.PrimesConfig;
import org.calista.primes.core.PrimesKernel;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DemoRunnerTest {

    /** Every read advances 7 microseconds. */
    private static LongSupplier steppingClock() {
        AtomicLong t = new AtomicLong();
        return () -> t.getAndAdd(7_000L);
    }

    private static List<String> run(PrimesConfig cfg, boolean facts) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
        DemoRunner demo = new DemoRunner(PrimesKernel.builder().build(cfg), out, steppingClock());
        demo.run();
        if (facts) demo.printFacts();
        return bytes.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private static PrimesConfig plain() {
        PrimesConfig cfg = PrimesConfig.defaults();
        cfg.output.decorations = false;
        return cfg;
    }

    @Test
    void defaultDemoPrintsEverySection() {
        List<String> lines = run(plain(), false);

        assertTrue(lines.contains("PRIME NUMBERS IN JAVA - Comprehensive Demo"));

        assertTrue(lines.contains("Prime Check Demo:"));
        assertTrue(lines.contains("2 is PRIME"));
        assertTrue(lines.contains("25 is NOT PRIME"));
        assertTrue(lines.contains("997 is PRIME"));
        assertTrue(lines.contains("100 is NOT PRIME"));

        assertTrue(lines.contains("Sieve of Eratosthenes - Primes up to 100:"));
        assertTrue(lines.contains("Primes: 2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37, 41, 43, 47, "
                + "53, 59, 61, 67, 71, 73, 79, 83, 89, 97"));
        assertTrue(lines.contains("Total: 25 primes"));
        assertTrue(lines.contains("Time: 7 microseconds"));

        assertTrue(lines.contains("First 20 Prime Numbers:"));
        assertTrue(lines.contains("Primes: 2, 3, 5, 7, 11, 13, 17, 19, 23, 29, 31, 37, 41, 43, 47, 53, 59, 61, 67, 71"));

        assertTrue(lines.contains("Prime factors of 12: 2 × 2 × 3"));
        assertTrue(lines.contains("Prime factors of 60: 2 × 2 × 3 × 5"));
        assertTrue(lines.contains("Prime factors of 1001: 7 × 11 × 13"));

        assertTrue(lines.contains("Testing primality of 982,451,653..."));
        assertTrue(lines.contains("Result: 982451653 is PRIME"));
        assertTrue(lines.contains("Time taken: 7 microseconds"));

        assertTrue(lines.contains("Twin Primes up to 50:"));
        assertTrue(lines.contains("(3, 5) (5, 7) (11, 13) (17, 19) (29, 31) (41, 43)"));
    }

    @Test
    void decorationsAddMarkers() {
        List<String> lines = run(PrimesConfig.defaults(), false);
        assertTrue(lines.contains("🔗 Twin Primes up to 50:"));
        assertTrue(lines.contains("📊 Total: 25 primes"));
    }

    @Test
    void timingsCanBeHidden() {
        PrimesConfig cfg = plain();
        cfg.output.showTimings = false;

        List<String> lines = run(cfg, false);
        assertFalse(lines.stream().anyMatch(l -> l.contains("microseconds")));
        assertTrue(lines.contains("Result: 982451653 is PRIME"));
    }

    @Test
    void sectionsFollowConfig() {
        PrimesConfig cfg = plain();
        cfg.demo.checkNumbers = List.of(91);
        cfg.demo.sieveLimit = 1;
        cfg.demo.firstPrimes = 3;
        cfg.demo.factorizeNumbers = List.of(97);
        cfg.demo.benchmarkNumber = 4_294_967_297L;
        cfg.demo.twinLimit = 7;

        List<String> lines = run(cfg, false);
        assertTrue(lines.contains("91 is NOT PRIME"));
        assertTrue(lines.contains("Primes: "));
        assertTrue(lines.contains("Total: 0 primes"));
        assertTrue(lines.contains("Primes: 2, 3, 5"));
        assertTrue(lines.contains("Prime factors of 97: 97"));
        assertTrue(lines.contains("Result: 4294967297 is NOT PRIME"));
        assertTrue(lines.contains("(3, 5) (5, 7)"));
    }

    @Test
    void disabledDemoPrintsNothing() {
        PrimesConfig cfg = plain();
        cfg.demo.enabled = false;
        assertEquals(List.of(), run(cfg, false));
    }

    @Test
    void decoratedFactsBoxKeepsEmojiOutsideTheBorders() {
        List<String> lines = run(PrimesConfig.defaults(), true);

        assertTrue(lines.contains("🎯 Prime Number Facts:"));
        List<String> box = lines.stream()
                .filter(l -> l.startsWith("┌") || l.startsWith("│") || l.startsWith("├") || l.startsWith("└"))
                .toList();
        assertTrue(box.stream().noneMatch(l -> l.contains("🎯")));
        assertTrue(box.stream().anyMatch(l -> l.startsWith("│ Prime Number Facts ")));
    }

    @Test
    void factsBoxClosesTheSession() {
        List<String> lines = run(plain(), true);
        assertTrue(lines.stream().anyMatch(l -> l.contains("All primes > 3 are of the form 6k±1")));
        assertEquals("Thank you for exploring prime numbers!", lines.get(lines.size() - 1));
    }
}
