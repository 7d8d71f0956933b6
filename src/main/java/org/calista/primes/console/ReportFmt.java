package org.calista.primes.console;

import org.calista.primes.math.factor.Factorization;
import org.calista.primes.math.twin.TwinPair;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * ReportFmt — text rendering for console output.
 *
 * <p>Pure string building, no I/O: callers decide where the text goes.</p>
 */
public final class ReportFmt {

    private ReportFmt() {}

    public static String primes(List<Integer> primes) {
        Objects.requireNonNull(primes, "primes");
        return "Primes: " + primes.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    public static String factors(Factorization f) {
        Objects.requireNonNull(f, "f");
        return "Prime factors of " + f.n + ": " + f.render();
    }

    public static String twins(List<TwinPair> pairs) {
        Objects.requireNonNull(pairs, "pairs");
        return pairs.stream().map(TwinPair::toString).collect(Collectors.joining(" "));
    }

    public static String verdict(long n, boolean prime) {
        return n + " is " + (prime ? "PRIME" : "NOT PRIME");
    }

    /**
     * Heading with an optional emoji marker; without decorations only the text remains.
     */
    public static String heading(String marker, String text, boolean decorations) {
        Objects.requireNonNull(text, "text");
        if (!decorations || marker == null || marker.isEmpty()) return text;
        return marker + " " + text;
    }

    // ---------------------------------------------------------------------
    // Boxes
    // ---------------------------------------------------------------------

    /**
     * Renders lines inside a box with a title row.
     */
    public static String box(String title, Consumer<BoxBuilder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");

        BoxBuilder b = new BoxBuilder();
        fill.accept(b);
        return renderBox(title, b.lines);
    }

    public static final class BoxBuilder {
        private static final String SEP = "\u0000--";

        private final List<String> lines = new ArrayList<>(16);

        public BoxBuilder line(String text) {
            lines.add(text == null ? "" : text);
            return this;
        }

        public BoxBuilder kv(String key, Object value) {
            lines.add((key == null ? "" : key) + ": " + value);
            return this;
        }

        public BoxBuilder sep() {
            lines.add(SEP);
            return this;
        }
    }

    private static String renderBox(String title, List<String> lines) {
        int content = width(title);
        for (String l : lines) {
            if (BoxBuilder.SEP.equals(l)) continue;
            content = Math.max(content, width(l));
        }
        int w = Math.max(24, content + 2);

        StringBuilder out = new StringBuilder((lines.size() + 4) * (w + 4));
        out.append('┌').append("─".repeat(w)).append("┐\n");
        out.append("│ ").append(padRight(title, w - 1)).append("│\n");
        out.append('├').append("─".repeat(w)).append("┤\n");
        for (String l : lines) {
            if (BoxBuilder.SEP.equals(l)) {
                out.append('├').append("─".repeat(w)).append("┤\n");
            } else {
                out.append("│ ").append(padRight(l, w - 1)).append("│\n");
            }
        }
        out.append('└').append("─".repeat(w)).append('┘');
        return out.toString();
    }

    // code points, so "±" and "×" count as one column
    private static int width(String s) {
        return s.codePointCount(0, s.length());
    }

    private static String padRight(String s, int width) {
        int pad = width - width(s);
        return pad <= 0 ? s : s + " ".repeat(pad);
    }
}
