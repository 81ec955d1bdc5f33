package io.surfworks.graphlower.core.codecache;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

import io.surfworks.graphlower.core.backend.GeneratedCode;

/**
 * Content-addressed store for generated code.
 *
 * <p>Modules are keyed by SHA-256 over the generated code and the hashes of the constants
 * it references, and written to {@code <dir>/<key[0:2]>/<key>.py}. Concurrent requests for
 * one key build the module once; the other callers receive the same instance.
 */
public final class CodeCache {

    private static final Logger LOG = Logger.getLogger(CodeCache.class.getName());

    private final Path directory;
    private final Map<String, CompiledModule> modules = new ConcurrentHashMap<>();

    public CodeCache(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory cannot be null");
    }

    /**
     * A cache under the system temporary directory.
     */
    public static CodeCache defaultCache() {
        return new CodeCache(Path.of(System.getProperty("java.io.tmpdir"), "graphlower", "codecache"));
    }

    public Path directory() {
        return directory;
    }

    /**
     * Stores {@code code}, or returns the module already stored under the same key.
     *
     * @throws UncheckedIOException if the code cannot be written
     */
    public CompiledModule load(GeneratedCode code, Collection<String> constantHashes) {
        String key = key(code.code(), constantHashes);
        return modules.computeIfAbsent(key, k -> write(k, code));
    }

    public boolean contains(String key) {
        return modules.containsKey(key);
    }

    public int size() {
        return modules.size();
    }

    /**
     * SHA-256 over the code followed by each constant hash.
     */
    public static String key(String code, Collection<String> constantHashes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(code.getBytes(StandardCharsets.UTF_8));
            for (String hash : constantHashes) {
                digest.update((byte) 0);
                digest.update(hash.getBytes(StandardCharsets.UTF_8));
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private CompiledModule write(String key, GeneratedCode code) {
        Path path = directory.resolve(key.substring(0, 2)).resolve(key + ".py");
        try {
            Files.createDirectories(path.getParent());
            if (!Files.exists(path)) {
                Files.writeString(path, code.code());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write generated code to " + path, e);
        }
        LOG.fine(() -> "Stored module " + key + " at " + path);
        return new CompiledModule(key, path, code.lineMap(), null);
    }

    @Override
    public String toString() {
        return String.format("CodeCache[dir=%s, modules=%d]", directory, modules.size());
    }
}
