package io.surfworks.graphlower.core.backend;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-wide table of scheduling and wrapper generators per device type.
 *
 * <p>Example:
 * <pre>{@code
 * BackendRegistry.registerBackendForDevice("cpu", SequentialScheduling::new, TextWrapperCodeGen::new);
 * Scheduling scheduling = BackendRegistry.schedulingFor("cpu");
 * }</pre>
 */
public final class BackendRegistry {

    private static final Map<String, Backend> BACKENDS = new ConcurrentHashMap<>();

    private BackendRegistry() {
    }

    private record Backend(Supplier<? extends Scheduling> scheduling, Supplier<? extends WrapperCodeGen> wrapper) {
    }

    /**
     * Registers the backend for {@code deviceType}, replacing any earlier registration.
     */
    public static void registerBackendForDevice(String deviceType,
                                                Supplier<? extends Scheduling> scheduling,
                                                Supplier<? extends WrapperCodeGen> wrapper) {
        BACKENDS.put(Objects.requireNonNull(deviceType, "deviceType cannot be null"),
                new Backend(Objects.requireNonNull(scheduling), Objects.requireNonNull(wrapper)));
    }

    /**
     * Registers the backend for {@code deviceType} unless one is already present.
     */
    public static void registerIfAbsent(String deviceType,
                                        Supplier<? extends Scheduling> scheduling,
                                        Supplier<? extends WrapperCodeGen> wrapper) {
        BACKENDS.putIfAbsent(deviceType, new Backend(scheduling, wrapper));
    }

    public static boolean isRegistered(String deviceType) {
        return BACKENDS.containsKey(deviceType);
    }

    /**
     * @return a new scheduling instance, or null if no backend is registered
     */
    public static Scheduling schedulingFor(String deviceType) {
        Backend backend = BACKENDS.get(deviceType);
        return backend != null ? backend.scheduling().get() : null;
    }

    /**
     * @return a new wrapper generator, or null if no backend is registered
     */
    public static WrapperCodeGen wrapperCodegenFor(String deviceType) {
        Backend backend = BACKENDS.get(deviceType);
        return backend != null ? backend.wrapper().get() : null;
    }

    public static Set<String> registeredDevices() {
        return new TreeSet<>(BACKENDS.keySet());
    }

    /**
     * Removes every registration (for testing).
     */
    static void clear() {
        BACKENDS.clear();
    }
}
