package io.surfworks.graphlower.core.backend;

import java.util.ArrayList;
import java.util.List;

/**
 * C++ wrapper for graphs that run CUDA kernels.
 */
public final class CudaWrapperCodeGen extends CppWrapperCodeGen {

    @Override
    protected List<String> includes() {
        List<String> includes = new ArrayList<>(super.includes());
        includes.add("#include <c10/cuda/CUDAGuard.h>");
        return includes;
    }
}
