package org.calista.primes.demo;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.primes.console.ReportFmt;
import org.calista.primes.core.PrimesConfig;
import org.calista.primes.core.PrimesKernel;
import org.calista.primes.math.factor.Factorization;
import org.calista.primes.math.primality.PrimalityTest;
import org.calista.primes.math.primality.impl.OddTrialDivision;
import org.calista.primes.math.primality.impl.SixKTrialDivision;
import org.calista.primes.math.twin.TwinPair;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * DemoRunner — the scripted part of the console session.
 *
 * Sections follow config: prime checks, sieve, first N primes, factorizations,
 * timing of the two trial-division tests, twin primes. {@link #printFacts()} is the closing box.
 */
public final class DemoRunner {

    private static final Logger log = LogManager.getLogger(DemoRunner.class);

    private final PrimesKernel kernel;
    private final PrintStream out;
    private final LongSupplier nanoClock;

    private final boolean decorations;
    private final boolean showTimings;

    public DemoRunner(PrimesKernel kernel, PrintStream out) {
        this(kernel, out, System::nanoTime);
    }

    public DemoRunner(PrimesKernel kernel, PrintStream out, LongSupplier nanoClock) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        this.out = Objects.requireNonNull(out, "out");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.decorations = kernel.config().output.decorations;
        this.showTimings = kernel.config().output.showTimings;
    }

    public void run() {
        PrimesConfig.Demo d = kernel.config().demo;
        if (!d.enabled) {
            log.debug("Demo disabled by config");
            return;
        }

        out.println(h("🔢", "PRIME NUMBERS IN JAVA - Comprehensive Demo"));
        out.println("=============================================");

        primeChecks(d.checkNumbers);
        sieve(d.sieveLimit);
        firstPrimes(d.firstPrimes);
        factorizations(d.factorizeNumbers);
        benchmark(d.benchmarkNumber);
        twinPrimes(d.twinLimit);
    }

    // ---------------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------------

    void primeChecks(List<Integer> numbers) {
        out.println();
        out.println(h("1️⃣", "Prime Check Demo:"));
        PrimalityTest test = kernel.primality();
        for (int n : numbers) {
            out.println(ReportFmt.verdict(n, test.isPrime(n)));
        }
    }

    void sieve(int limit) {
        out.println();
        out.println(h("2️⃣", "Sieve of Eratosthenes - Primes up to " + limit + ":"));

        Timed<List<Integer>> primes = Timed.measure(nanoClock, () -> kernel.sieve().primesUpTo(limit));
        log.debug("sieve({}) -> {} primes in {}us", limit, primes.value.size(), primes.micros);

        out.println(ReportFmt.primes(primes.value));
        out.println(h("📊", "Total: " + primes.value.size() + " primes"));
        if (showTimings) out.println(h("⏱️", "Time: " + primes.micros + " microseconds"));
    }

    void firstPrimes(int count) {
        out.println();
        out.println(h("3️⃣", "First " + count + " Prime Numbers:"));
        out.println(ReportFmt.primes(kernel.generator().firstN(count)));
    }

    void factorizations(List<Integer> numbers) {
        out.println();
        out.println(h("4️⃣", "Prime Factorization Demo:"));
        for (int n : numbers) {
            Factorization f = kernel.factorizer().factorize(n);
            out.println(ReportFmt.factors(f));
        }
    }

    void benchmark(long n) {
        out.println();
        out.println(h("5️⃣", "Performance Comparison:"));
        out.println(String.format(Locale.US, "Testing primality of %,d...", n));

        SixKTrialDivision sixK = new SixKTrialDivision();
        OddTrialDivision odd = new OddTrialDivision();

        Timed<Boolean> primary = Timed.measure(nanoClock, () -> sixK.isPrime(n));
        Timed<Boolean> other = Timed.measure(nanoClock, () -> odd.isPrime(n));

        out.println("Result: " + ReportFmt.verdict(n, primary.value));
        if (showTimings) {
            out.println("Time taken: " + primary.micros + " microseconds");
            out.println(ReportFmt.box("Trial division timings", b -> b
                    .kv("6k±1 divisors", primary.micros + " us")
                    .kv("odd divisors", other.micros + " us")));
        }

        if (primary.value.booleanValue() != other.value.booleanValue()) {
            // both are exact; a mismatch means a broken implementation
            log.error("Primality tests disagree for {}: six-k={}, odd={}", n, primary.value, other.value);
        }
    }

    void twinPrimes(int limit) {
        out.println();
        out.println(h("🔗", "Twin Primes up to " + limit + ":"));
        out.println("Twin primes are pairs of primes that differ by 2.");
        List<TwinPair> pairs = kernel.twins().upTo(limit);
        out.println(ReportFmt.twins(pairs));
    }

    public void printFacts() {
        out.println();
        // emoji render two columns wide, keep them out of the box
        out.println(h("🎯", "Prime Number Facts:"));
        out.println(ReportFmt.box("Prime Number Facts", b -> b
                .line("There are infinitely many prime numbers (Euclid's theorem)")
                .line("2 is the only even prime number")
                .line("All primes > 3 are of the form 6k±1")
                .line("The largest known prime has over 41 million digits")));
        out.println();
        out.println(h("", "Thank you for exploring prime numbers!") + (decorations ? " 🚀" : ""));
    }

    private String h(String marker, String text) {
        return ReportFmt.heading(marker, text, decorations);
    }
}
