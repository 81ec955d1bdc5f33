package io.surfworks.graphlower.core.codecache;

import java.nio.file.Path;
import java.util.List;

import io.surfworks.graphlower.core.backend.GeneratedCode;

/**
 * A generated module stored in the {@link CodeCache}.
 *
 * @param key     content hash the module is stored under
 * @param path    file holding the generated code
 * @param lineMap origins of the generated lines
 * @param externKernelNodes serialized extern kernel calls, or null outside ahead-of-time mode
 */
public record CompiledModule(String key, Path path, List<GeneratedCode.LineOrigin> lineMap, String externKernelNodes) {

    public CompiledModule {
        lineMap = List.copyOf(lineMap);
    }

    public CompiledModule withExternKernelNodes(String serialized) {
        return new CompiledModule(key, path, lineMap, serialized);
    }
}
