package org.calista.primes.demo;

import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * A computed value with the wall time it took, in microseconds.
 */
public final class Timed<T> {
    public final T value;
    public final long micros;

    private Timed(T value, long micros) {
        this.value = value;
        this.micros = micros;
    }

    /**
     * Runs {@code work} between two reads of {@code nanoClock}.
     */
    public static <T> Timed<T> measure(LongSupplier nanoClock, Supplier<T> work) {
        Objects.requireNonNull(nanoClock, "nanoClock");
        Objects.requireNonNull(work, "work");
        long start = nanoClock.getAsLong();
        T value = work.get();
        long end = nanoClock.getAsLong();
        return new Timed<>(value, Math.max(0L, (end - start) / 1_000L));
    }

    @Override
    public String toString() {
        return "Timed{micros=" + micros + ", value=" + value + '}';
    }
}
