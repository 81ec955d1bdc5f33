package io.surfworks.graphlower.core.config;

import java.util.Locale;
import java.util.Objects;

/**
 * Facts about the host that lowering decisions depend on.
 *
 * @param osName          operating system name as reported by {@code os.name}
 * @param rocm            the GPU runtime is ROCm
 * @param gpuAvailable    a GPU is usable by generated code
 * @param mkldnnEnabled   the oneDNN backend is switched on
 * @param mkldnnAvailable the oneDNN backend is present
 * @param mklAvailable    MKL is present
 */
public record RuntimeEnvironment(
        String osName,
        boolean rocm,
        boolean gpuAvailable,
        boolean mkldnnEnabled,
        boolean mkldnnAvailable,
        boolean mklAvailable
) {

    public RuntimeEnvironment {
        Objects.requireNonNull(osName, "osName cannot be null");
    }

    /**
     * Environment of the running JVM. Vendor libraries are not probed and reported absent.
     */
    public static RuntimeEnvironment detect() {
        return new RuntimeEnvironment(System.getProperty("os.name", "unknown"), false, false, false, false, false);
    }

    /**
     * A Linux host with no GPU and no vendor libraries.
     */
    public static RuntimeEnvironment cpuOnly() {
        return new RuntimeEnvironment("Linux", false, false, false, false, false);
    }

    public boolean isLinux() {
        return osName.toLowerCase(Locale.ROOT).startsWith("linux");
    }

    /**
     * True if the oneDNN backend is both present and switched on.
     */
    public boolean mkldnnUsable() {
        return mkldnnEnabled && mkldnnAvailable;
    }

    public RuntimeEnvironment withOsName(String name) {
        return new RuntimeEnvironment(name, rocm, gpuAvailable, mkldnnEnabled, mkldnnAvailable, mklAvailable);
    }

    public RuntimeEnvironment withGpu(boolean available, boolean isRocm) {
        return new RuntimeEnvironment(osName, isRocm, available, mkldnnEnabled, mkldnnAvailable, mklAvailable);
    }

    public RuntimeEnvironment withMkldnn(boolean enabled, boolean available) {
        return new RuntimeEnvironment(osName, rocm, gpuAvailable, enabled, available, mklAvailable);
    }

    public RuntimeEnvironment withMkl(boolean available) {
        return new RuntimeEnvironment(osName, rocm, gpuAvailable, mkldnnEnabled, mkldnnAvailable, available);
    }
}
