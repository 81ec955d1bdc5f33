package io.surfworks.graphlower.core.backend;

import java.util.ArrayList;
import java.util.List;

import io.surfworks.graphlower.ir.Buffer;

/**
 * Emits the wrapper as a C++ function over a vector of tensors.
 */
public class CppWrapperCodeGen extends TextWrapperCodeGen {

    @Override
    protected String comment(String text) {
        return "// " + text;
    }

    @Override
    protected List<String> prologue(List<String> inputNames) {
        List<String> lines = new ArrayList<>(includes());
        lines.add("std::vector<at::Tensor> call(std::vector<at::Tensor> args) {");
        for (int i = 0; i < inputNames.size(); i++) {
            lines.add(indent() + "auto " + inputNames.get(i) + " = std::move(args[" + i + "]);");
        }
        return lines;
    }

    protected List<String> includes() {
        return List.of("#include <ATen/ATen.h>", "#include <vector>");
    }

    @Override
    protected String statement(Buffer buffer) {
        return "auto " + buffer.describe() + ";";
    }

    @Override
    protected List<String> epilogue(List<String> outputs) {
        return List.of(indent() + "return {" + String.join(", ", outputs) + "};", "}");
    }
}
