package io.surfworks.graphlower.core.backend;

import java.util.List;

/**
 * Generated wrapper source and the graph nodes behind each line.
 *
 * @param code    the generated source
 * @param lineMap origins of the lines that compute a buffer
 */
public record GeneratedCode(String code, List<LineOrigin> lineMap) {

    public GeneratedCode {
        lineMap = List.copyOf(lineMap);
    }

    /**
     * @param line    1-based line number in {@link #code()}
     * @param origins names of the graph nodes the line was lowered from
     */
    public record LineOrigin(int line, List<String> origins) {

        public LineOrigin {
            origins = List.copyOf(origins);
        }
    }
}
