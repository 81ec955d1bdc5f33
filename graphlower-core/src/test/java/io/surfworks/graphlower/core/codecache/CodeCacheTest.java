package io.surfworks.graphlower.core.codecache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.surfworks.graphlower.core.backend.GeneratedCode;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CodeCache")
class CodeCacheTest {

    private static final GeneratedCode CODE = new GeneratedCode("def call(args):\n    return ()\n",
            List.of(new GeneratedCode.LineOrigin(2, List.of("relu"))));

    @TempDir
    Path tempDir;

    private CodeCache cache;

    @BeforeEach
    void setUp() {
        cache = new CodeCache(tempDir);
    }

    @Nested
    @DisplayName("Keys")
    class Keys {

        @Test
        @DisplayName("keys are deterministic hex SHA-256 digests")
        void deterministic() {
            String key = CodeCache.key("code", List.of("abc"));

            assertEquals(key, CodeCache.key("code", List.of("abc")));
            assertEquals(64, key.length());
            assertTrue(key.matches("[0-9a-f]+"));
        }

        @Test
        @DisplayName("constant hashes change the key")
        void constantHashes() {
            assertNotEquals(CodeCache.key("code", List.of()), CodeCache.key("code", List.of("abc")));
            assertNotEquals(CodeCache.key("code", List.of("a", "b")), CodeCache.key("code", List.of("b", "a")));
        }

        @Test
        @DisplayName("hash boundaries are part of the key")
        void separated() {
            assertNotEquals(CodeCache.key("code", List.of("ab")), CodeCache.key("code", List.of("a", "b")));
        }
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("modules are written under a two-character prefix directory")
        void fileLayout() throws IOException {
            CompiledModule module = cache.load(CODE, List.of());

            String key = CodeCache.key(CODE.code(), List.of());
            assertEquals(key, module.key());
            assertEquals(tempDir.resolve(key.substring(0, 2)).resolve(key + ".py"), module.path());
            assertEquals(CODE.code(), Files.readString(module.path()));
            assertEquals(CODE.lineMap(), module.lineMap());
            assertNull(module.externKernelNodes());
        }

        @Test
        @DisplayName("the same code returns the same module")
        void cached() {
            CompiledModule first = cache.load(CODE, List.of("h"));
            CompiledModule second = cache.load(CODE, List.of("h"));

            assertSame(first, second);
            assertEquals(1, cache.size());
            assertTrue(cache.contains(first.key()));
            assertFalse(cache.contains("missing"));
        }

        @Test
        @DisplayName("different constants produce a separate module")
        void differentConstants() {
            CompiledModule first = cache.load(CODE, List.of("h1"));
            CompiledModule second = cache.load(CODE, List.of("h2"));

            assertNotEquals(first.path(), second.path());
            assertEquals(2, cache.size());
        }

        @Test
        @DisplayName("concurrent loads of one key share a module")
        void concurrent() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                List<Future<CompiledModule>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    futures.add(executor.submit(() -> cache.load(CODE, List.of())));
                }
                CompiledModule first = futures.get(0).get();
                for (Future<CompiledModule> future : futures) {
                    assertSame(first, future.get());
                }
            } finally {
                executor.shutdownNow();
            }
            assertEquals(1, cache.size());
        }

        @Test
        @DisplayName("extern kernel nodes attach to a copy of the module")
        void externNodes() {
            CompiledModule module = cache.load(CODE, List.of());
            CompiledModule withNodes = module.withExternKernelNodes("{}");

            assertEquals("{}", withNodes.externKernelNodes());
            assertEquals(module.key(), withNodes.key());
            assertNull(module.externKernelNodes());
        }
    }
}
