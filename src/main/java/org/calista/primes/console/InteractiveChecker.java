package org.calista.primes.console;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.primes.core.PrimesKernel;
import org.calista.primes.math.factor.Factorization;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.util.Objects;
import java.util.Scanner;
import java.util.regex.Pattern;

/**
 * InteractiveChecker — console loop: read an int, report primality, factor composites.
 *
 * Stops on the sentinel {@code 0}, on end of input, or on the first token that is not an int.
 * Bad input ends the session quietly; it is never an error.
 */
public final class InteractiveChecker {

    private static final Logger log = LogManager.getLogger(InteractiveChecker.class);

    public static final int SENTINEL = 0;

    /** Plain decimal only: no grouping separators, no locale digits. */
    private static final Pattern INT_TOKEN = Pattern.compile("[+-]?\\d+");

    static final String FIRST_PROMPT = "Enter a number to check if it's prime (0 to exit): ";
    static final String NEXT_PROMPT = "Enter another number (0 to exit): ";
    static final String NEGATIVE_WARNING = "Please enter a positive number.";

    private final PrimesKernel kernel;
    private final PrintStream out;
    private final boolean decorations;

    public InteractiveChecker(PrimesKernel kernel, PrintStream out) {
        this.kernel = Objects.requireNonNull(kernel, "kernel");
        this.out = Objects.requireNonNull(out, "out");
        this.decorations = kernel.config().output.decorations;
    }

    /**
     * Runs the loop until the sentinel, EOF or a non-int token. Closes {@code in}.
     */
    public Summary run(InputStream in, Charset charset) {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(charset, "charset");

        Summary s = new Summary();

        out.println();
        out.println(ReportFmt.heading("6️⃣", "Interactive Prime Checker:", decorations));
        out.print(FIRST_PROMPT);
        out.flush();

        try (Scanner sc = new Scanner(in, charset)) {
            while (sc.hasNext(INT_TOKEN)) {
                int n;
                try {
                    n = Integer.parseInt(sc.next(INT_TOKEN));
                } catch (NumberFormatException e) {
                    log.debug("Input out of int range, ending session: {}", e.getMessage());
                    break;
                }
                if (n == SENTINEL) {
                    s.endedBySentinel = true;
                    break;
                }

                if (n < 0) {
                    s.rejected++;
                    out.println(NEGATIVE_WARNING);
                } else {
                    check(n, s);
                }

                out.println();
                out.print(NEXT_PROMPT);
                out.flush();
            }
        }

        out.println();
        if (log.isInfoEnabled()) {
            log.info("Interactive session done: checked={}, primes={}, rejected={}, sentinel={}",
                    s.checked, s.primes, s.rejected, s.endedBySentinel);
        }
        return s;
    }

    private void check(int n, Summary s) {
        boolean prime = kernel.primality().isPrime(n);
        s.checked++;
        if (prime) s.primes++;

        String mark = decorations ? (prime ? " ✅" : " ❌") : "";
        out.println(ReportFmt.verdict(n, prime) + mark);

        if (!prime && n > 1) {
            Factorization f = kernel.factorizer().factorize(n);
            out.println(ReportFmt.factors(f));
        }
    }

    /**
     * Counters for one interactive session.
     */
    public static final class Summary {
        public int checked;
        public int primes;
        public int rejected;
        public boolean endedBySentinel;

        @Override
        public String toString() {
            return "Summary{checked=" + checked + ", primes=" + primes
                    + ", rejected=" + rejected + ", endedBySentinel=" + endedBySentinel + '}';
        }
    }
}
