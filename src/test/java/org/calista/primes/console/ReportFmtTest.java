package org.calista.primes.console;

import org.calista.primes.math.factor.PrimeFactorizer;
import org.calista.primes.math.twin.TwinPair;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportFmtTest {

    @Test
    void primeList() {
        assertEquals("Primes: 2, 3, 5, 7", ReportFmt.primes(List.of(2, 3, 5, 7)));
        assertEquals("Primes: ", ReportFmt.primes(List.of()));
    }

    @Test
    void factorLine() {
        assertEquals("Prime factors of 315: 3 × 3 × 5 × 7",
                ReportFmt.factors(new PrimeFactorizer().factorize(315)));
    }

    @Test
    void twinLine() {
        assertEquals("(3, 5) (5, 7) (11, 13)", ReportFmt.twins(List.of(TwinPair.of(3), TwinPair.of(5), TwinPair.of(11))));
        assertEquals("", ReportFmt.twins(List.of()));
    }

    @Test
    void verdictAndHeading() {
        assertEquals("97 is PRIME", ReportFmt.verdict(97, true));
        assertEquals("100 is NOT PRIME", ReportFmt.verdict(100, false));
        assertEquals("🔗 Twin Primes", ReportFmt.heading("🔗", "Twin Primes", true));
        assertEquals("Twin Primes", ReportFmt.heading("🔗", "Twin Primes", false));
    }

    @Test
    void boxRowsShareOneWidth() {
        String box = ReportFmt.box("Timings", b -> b
                .kv("6k±1 divisors", "12 us")
                .sep()
                .line("a considerably longer line than the title"));

        String[] rows = box.split("\n");
        assertEquals(7, rows.length);
        assertTrue(rows[0].startsWith("┌"));
        assertTrue(rows[1].contains("Timings"));
        assertTrue(rows[3].contains("6k±1 divisors: 12 us"));
        assertTrue(rows[4].startsWith("├"));
        assertTrue(rows[6].startsWith("└"));
        int width = rows[0].codePointCount(0, rows[0].length());
        for (String row : rows) {
            assertEquals(width, row.codePointCount(0, row.length()), row);
        }
    }
}
