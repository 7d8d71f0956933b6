package org.calista.primes;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.primes.console.InteractiveChecker;
import org.calista.primes.core.PrimesKernel;
import org.calista.primes.demo.DemoRunner;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.file.Path;

/**
 * PrimesApp — console runner.
 *
 * Lifecycle:
 *  1) build kernel (config + routines)
 *  2) scripted demo
 *  3) interactive loop on stdin
 *  4) closing facts
 *
 * Usage: {@code PrimesApp [configFile]}, default {@code config/primes.json}.
 * Logs go to stderr (see log4j2.xml), the report goes to stdout.
 */
public final class PrimesApp {

    private static final Logger log = LogManager.getLogger(PrimesApp.class);

    public static final String DEFAULT_CONFIG = "config/primes.json";

    private final Path cfgPath;
    private PrimesKernel kernel;

    public static void main(String[] args) throws Exception {
        Path cfg = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        new PrimesApp(cfg).run(System.out);
    }

    public PrimesApp(Path cfgPath) {
        this.cfgPath = cfgPath;
    }

    public void run(PrintStream out) throws IOException {
        kernel = PrimesKernel.builder()
                .configRoot(Path.of("."))
                .build(cfgPath);

        DemoRunner demo = new DemoRunner(kernel, out);
        demo.run();

        if (kernel.config().interactive.enabled) {
            new InteractiveChecker(kernel, out).run(System.in, Charset.defaultCharset());
        } else {
            log.debug("Interactive loop disabled by config");
        }

        demo.printFacts();
        out.flush();
    }

    public PrimesKernel getKernel() { return kernel; }
}
