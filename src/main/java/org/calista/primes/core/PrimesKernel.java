package org.calista.primes.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.primes.io.FileIO;
import org.calista.primes.math.factor.PrimeFactorizer;
import org.calista.primes.math.generate.PrimeGenerator;
import org.calista.primes.math.primality.PrimalityTest;
import org.calista.primes.math.sieve.SieveOfEratosthenes;
import org.calista.primes.math.twin.TwinPrimeFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * PrimesKernel — instance-owned container for config and the numeric routines.
 *
 * Lifecycle:
 *   1) build(configFile) -> load config, pick the primality strategy, wire the algorithms
 *   2) use               -> demo / interactive loop
 *
 * All routines are stateless; the kernel only decides which {@link PrimalityTest} they share.
 */
public final class PrimesKernel {

    private static final Logger log = LoggerFactory.getLogger(PrimesKernel.class);

    private final PrimesConfig cfg;
    private final PrimalityTest primality;
    private final SieveOfEratosthenes sieve;
    private final PrimeGenerator generator;
    private final PrimeFactorizer factorizer;
    private final TwinPrimeFinder twins;

    private PrimesKernel(PrimesConfig cfg, PrimalityTest primality) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.primality = Objects.requireNonNull(primality, "primality");
        this.sieve = new SieveOfEratosthenes();
        this.generator = new PrimeGenerator(primality);
        this.factorizer = new PrimeFactorizer();
        this.twins = new TwinPrimeFinder(primality);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Root directory relative config paths resolve against. */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private PrimalityTest primality;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Overrides {@code primality.strategy} from config. */
        public Builder primality(PrimalityTest primality) {
            this.primality = Objects.requireNonNull(primality, "primality");
            return this;
        }

        /**
         * Loads config (defaults when the file is absent) and wires the routines.
         */
        public PrimesKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();
            FileIO io = new FileIO(configRoot, charset);

            Path cfgPath = io.resolveAny(configFile);
            PrimesConfig cfg = PrimesConfig.load(io, cfgPath, om);

            PrimesKernel k = build(cfg);
            log.info("PrimesKernel created: config={}, strategy={}", cfgPath, k.primality.name());
            return k;
        }

        /** Wires the routines around an already loaded config. */
        public PrimesKernel build(PrimesConfig cfg) {
            Objects.requireNonNull(cfg, "cfg");
            cfg.validate();
            PrimalityTest test = (this.primality != null) ? this.primality : PrimalityTest.byName(cfg.primality.strategy);
            return new PrimesKernel(cfg, test);
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public PrimesConfig config() { return cfg; }
    public PrimalityTest primality() { return primality; }
    public SieveOfEratosthenes sieve() { return sieve; }
    public PrimeGenerator generator() { return generator; }
    public PrimeFactorizer factorizer() { return factorizer; }
    public TwinPrimeFinder twins() { return twins; }
}
