package org.calista.primes.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;

/**
 * FileIO — read-only file access rooted at a base directory.
 *
 * <p>
 * Relative paths resolve inside {@code baseDir} and may not escape it through "..";
 * absolute paths go through {@link #resolveExternal(Path)}. The program never writes:
 * config is the only file it touches.
 * </p>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8);
    }

    public FileIO(Path baseDir, Charset charset) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        log.debug("FileIO init: baseDir={}, charset={}", this.baseDir, this.charset);
    }

    // ----------------------------
    // Resolve
    // ----------------------------

    /**
     * Резолвит относительный путь внутри baseDir. Обратные слеши приводятся к прямым.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public Path resolve(Path relative) {
        Objects.requireNonNull(relative, "relative");
        return resolve(relative.toString());
    }

    /** Absolute paths as-is (normalized), relative ones inside baseDir. */
    public Path resolveAny(Path path) {
        Objects.requireNonNull(path, "path");
        return path.isAbsolute() ? resolveExternal(path) : resolve(path);
    }

    public Path resolveExternal(Path anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        return anyPath.toAbsolutePath().normalize();
    }

    // ----------------------------
    // Read
    // ----------------------------

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.isRegularFile(file);
    }

    /**
     * @throws java.nio.file.NoSuchFileException if the file is missing
     */
    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        String s = Files.readString(file, charset);
        log.trace("readString: {} ({} chars)", file, s.length());
        return s;
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }
}
