package io.surfworks.graphlower.core.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.surfworks.graphlower.core.LoweredGraph;
import io.surfworks.graphlower.graph.GraphNode;
import io.surfworks.graphlower.ir.Buffer;
import io.surfworks.graphlower.ir.IrNode;
import io.surfworks.graphlower.ir.MutationLayout;

/**
 * Emits a Python-style wrapper: unpack the inputs, compute each buffer in kernel order,
 * return the outputs.
 *
 * <p>Example output for {@code relu(add(x, y))}:
 * <pre>
 * # graph: forward
 * def call(args):
 *     x, y = args
 *     buf0 = relu(add(x, y))
 *     return (buf0,)
 * </pre>
 *
 * <p>Subclasses change the surface syntax through the protected hooks.
 */
public class TextWrapperCodeGen implements WrapperCodeGen {

    @Override
    public GeneratedCode generate(LoweredGraph graph, List<List<Buffer>> kernels) {
        List<String> lines = new ArrayList<>();
        List<GeneratedCode.LineOrigin> lineMap = new ArrayList<>();

        lines.add(comment("graph: " + graph.name()));
        for (Map.Entry<String, String> e : graph.constants().hashes().entrySet()) {
            lines.add(comment("constant " + e.getKey() + " sha256:" + e.getValue()));
        }
        lines.addAll(prologue(new ArrayList<>(graph.graphInputs().keySet())));

        for (List<Buffer> kernel : kernels) {
            for (Buffer buffer : kernel) {
                String statement = statement(buffer);
                if (buffer.layout() instanceof MutationLayout mutation) {
                    statement += " " + comment("writes " + mutation.target().name());
                }
                lines.add(indent() + statement);
                List<String> origins = new ArrayList<>();
                for (GraphNode origin : buffer.origins()) {
                    origins.add(origin.name());
                }
                lineMap.add(new GeneratedCode.LineOrigin(lines.size(), origins));
            }
        }

        List<String> outputs = new ArrayList<>();
        for (IrNode output : graph.graphOutputs()) {
            outputs.add(output.describe());
        }
        lines.addAll(epilogue(outputs));
        return new GeneratedCode(String.join("\n", lines) + "\n", lineMap);
    }

    protected String comment(String text) {
        return "# " + text;
    }

    protected String indent() {
        return "    ";
    }

    protected List<String> prologue(List<String> inputNames) {
        List<String> lines = new ArrayList<>();
        lines.add("def call(args):");
        if (!inputNames.isEmpty()) {
            lines.add(indent() + String.join(", ", inputNames) + (inputNames.size() == 1 ? "," : "") + " = args");
        }
        return lines;
    }

    protected String statement(Buffer buffer) {
        return buffer.describe();
    }

    protected List<String> epilogue(List<String> outputs) {
        return List.of(indent() + "return (" + String.join(", ", outputs) + (outputs.size() == 1 ? "," : "") + ")");
    }
}
