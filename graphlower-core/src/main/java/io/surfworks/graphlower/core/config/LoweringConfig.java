package io.surfworks.graphlower.core.config;

import java.nio.file.Path;

import io.surfworks.graphlower.ir.RealizeThresholds;

/**
 * Tuning switches for graph lowering.
 *
 * <p>Configuration is loaded from {@code ~/.config/graphlower/lowering.json} by
 * {@link LoweringConfigLoader}; keys missing from the file keep their defaults.
 *
 * @param layoutOptimization       allow the channels-last layout decision at all
 * @param implicitFallbacks        synthesize fallback kernels for operators without a lowering
 * @param alwaysKeepTensorConstants keep small 1-D constants in the constant table instead of inlining them
 * @param disableCppCodegen        treat C++ code generation as unavailable
 * @param realizeReadsThreshold    reads above which a reused value is realized
 * @param realizeAccReadsThreshold accumulated reads above which a pointwise value is realized
 * @param realizeOpcountThreshold  inlined operations above which a value is realized
 * @param layoutOptNodeRatio       graph nodes per convolution above which layout optimization is skipped
 * @param layoutOptSmallChannels   channel count at or below which convolutions count as small
 */
public record LoweringConfig(
        boolean layoutOptimization,
        boolean implicitFallbacks,
        boolean alwaysKeepTensorConstants,
        boolean disableCppCodegen,
        int realizeReadsThreshold,
        int realizeAccReadsThreshold,
        int realizeOpcountThreshold,
        int layoutOptNodeRatio,
        int layoutOptSmallChannels
) {

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "graphlower"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "lowering.json";

    public LoweringConfig {
        if (realizeReadsThreshold < 0 || realizeAccReadsThreshold < 0 || realizeOpcountThreshold < 0) {
            throw new IllegalArgumentException("Realize thresholds must be non-negative");
        }
        if (layoutOptNodeRatio <= 0) {
            throw new IllegalArgumentException("layoutOptNodeRatio must be positive, got " + layoutOptNodeRatio);
        }
        if (layoutOptSmallChannels < 0) {
            throw new IllegalArgumentException("layoutOptSmallChannels must be non-negative");
        }
    }

    public static LoweringConfig defaults() {
        return new LoweringConfig(true, true, false, false, 4, 8, 30, 300, 64);
    }

    public static Path configFile() {
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    public RealizeThresholds thresholds() {
        return new RealizeThresholds(realizeReadsThreshold, realizeAccReadsThreshold, realizeOpcountThreshold);
    }

    public LoweringConfig withLayoutOptimization(boolean enabled) {
        return new LoweringConfig(enabled, implicitFallbacks, alwaysKeepTensorConstants, disableCppCodegen,
                realizeReadsThreshold, realizeAccReadsThreshold, realizeOpcountThreshold,
                layoutOptNodeRatio, layoutOptSmallChannels);
    }

    public LoweringConfig withImplicitFallbacks(boolean enabled) {
        return new LoweringConfig(layoutOptimization, enabled, alwaysKeepTensorConstants, disableCppCodegen,
                realizeReadsThreshold, realizeAccReadsThreshold, realizeOpcountThreshold,
                layoutOptNodeRatio, layoutOptSmallChannels);
    }

    public LoweringConfig withAlwaysKeepTensorConstants(boolean keep) {
        return new LoweringConfig(layoutOptimization, implicitFallbacks, keep, disableCppCodegen,
                realizeReadsThreshold, realizeAccReadsThreshold, realizeOpcountThreshold,
                layoutOptNodeRatio, layoutOptSmallChannels);
    }

    public LoweringConfig withDisableCppCodegen(boolean disabled) {
        return new LoweringConfig(layoutOptimization, implicitFallbacks, alwaysKeepTensorConstants, disabled,
                realizeReadsThreshold, realizeAccReadsThreshold, realizeOpcountThreshold,
                layoutOptNodeRatio, layoutOptSmallChannels);
    }

    public LoweringConfig withRealizeThresholds(int reads, int accReads, int opcount) {
        return new LoweringConfig(layoutOptimization, implicitFallbacks, alwaysKeepTensorConstants, disableCppCodegen,
                reads, accReads, opcount, layoutOptNodeRatio, layoutOptSmallChannels);
    }

    public LoweringConfig withLayoutOptThresholds(int nodeRatio, int smallChannels) {
        return new LoweringConfig(layoutOptimization, implicitFallbacks, alwaysKeepTensorConstants, disableCppCodegen,
                realizeReadsThreshold, realizeAccReadsThreshold, realizeOpcountThreshold, nodeRatio, smallChannels);
    }
}
