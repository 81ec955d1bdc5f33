package io.surfworks.graphlower.core.backend;

import java.util.List;

import io.surfworks.graphlower.ir.Buffer;

/**
 * Groups realized buffers into kernels for one device type.
 */
@FunctionalInterface
public interface Scheduling {

    /**
     * @param buffers realized buffers in creation order
     * @return kernels in execution order, each a non-empty list of buffers computed together
     */
    List<List<Buffer>> schedule(List<Buffer> buffers);
}
