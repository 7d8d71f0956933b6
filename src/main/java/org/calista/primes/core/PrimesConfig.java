package org.calista.primes.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.primes.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PrimesConfig — POJO конфиг:
 * - дефолты в полях
 * - load() возвращает дефолты, если файла нет или он пустой
 * - validate() нормализует значения
 *
 * Large bounds are accepted as given: validate() never caps sieve limits or prime counts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PrimesConfig {

    private static final Logger log = LoggerFactory.getLogger(PrimesConfig.class);

    public Primality primality = new Primality();
    public Demo demo = new Demo();
    public Interactive interactive = new Interactive();
    public Output output = new Output();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Primality {
        /** "six-k" or "odd". */
        public String strategy = "six-k";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Demo {
        public boolean enabled = true;

        public List<Integer> checkNumbers = List.of(2, 17, 25, 97, 100, 101, 997);
        public int sieveLimit = 100;
        public int firstPrimes = 20;
        public List<Integer> factorizeNumbers = List.of(12, 60, 100, 315, 1001);
        public long benchmarkNumber = 982_451_653L;
        public int twinLimit = 50;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Interactive {
        public boolean enabled = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Output {
        /** Emoji markers in headings. Off for terminals without UTF-8. */
        public boolean decorations = true;
        public boolean showTimings = true;
    }

    // -------------------- Load --------------------

    /**
     * Загружает конфиг. Нет файла или он пустой — дефолты (на диск ничего не пишется).
     *
     * @throws IllegalStateException if the JSON root is not an object
     * @throws IOException on read failure or malformed JSON
     */
    public static PrimesConfig load(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        Optional<String> json = io.readStringIfExists(configFile);
        if (json.isEmpty()) {
            log.info("Config file {} not found. Using defaults.", configFile);
            return defaults();
        }
        if (json.get().isBlank()) {
            log.warn("Config file {} is empty. Using defaults.", configFile);
            return defaults();
        }

        JsonNode root = mapper.readTree(json.get());
        if (root == null || root.isNull() || root.isMissingNode()) {
            log.warn("Config file {} is null. Using defaults.", configFile);
            return defaults();
        }
        if (!root.isObject()) {
            throw new IllegalStateException("Config root must be JSON object: " + configFile);
        }

        PrimesConfig cfg = mapper.treeToValue(root, PrimesConfig.class);
        if (cfg == null) cfg = new PrimesConfig();

        cfg.validate();
        log.debug("Config loaded from {}", configFile);
        return cfg;
    }

    public static PrimesConfig defaults() {
        PrimesConfig cfg = new PrimesConfig();
        cfg.validate();
        return cfg;
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (primality == null) primality = new Primality();
        if (primality.strategy == null || primality.strategy.isBlank()) primality.strategy = "six-k";

        Demo d = new Demo();
        if (demo == null) demo = d;
        demo.checkNumbers = withoutNulls(demo.checkNumbers, d.checkNumbers);
        demo.factorizeNumbers = withoutNulls(demo.factorizeNumbers, d.factorizeNumbers);
        if (demo.sieveLimit < 0) demo.sieveLimit = d.sieveLimit;
        if (demo.firstPrimes < 0) demo.firstPrimes = d.firstPrimes;
        if (demo.twinLimit < 0) demo.twinLimit = d.twinLimit;
        if (demo.benchmarkNumber < 0) demo.benchmarkNumber = d.benchmarkNumber;

        if (interactive == null) interactive = new Interactive();
        if (output == null) output = new Output();
    }

    private static List<Integer> withoutNulls(List<Integer> xs, List<Integer> fallback) {
        if (xs == null) return fallback;
        return xs.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }
}
