package io.surfworks.graphlower.core.constants;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

import io.surfworks.graphlower.tensor.ConstantTensor;
import io.surfworks.graphlower.tensor.Device;

/**
 * The tensors a lowered graph holds by value, keyed by identifier-safe names.
 *
 * <p>Adding a tensor whose shape, strides, dtype, device and elements equal an existing
 * entry returns the existing name. New entries record a SHA-256 content hash that is
 * stable across runs; the code cache folds these hashes into its key.
 *
 * <p>Not thread-safe. A table belongs to the lowering of a single graph.
 */
public final class ConstantTable {

    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^a-zA-Z0-9_]");

    private final Map<String, ConstantTensor> constants = new LinkedHashMap<>();
    private final Map<String, String> hashes = new LinkedHashMap<>();
    private final Map<String, String> allocatedNames = new LinkedHashMap<>();

    /**
     * Adds a constant, deduplicating against existing entries.
     *
     * @param data          the tensor
     * @param suggestedName preferred name, or null or empty for {@code constant<N>}
     * @return the name of the entry holding {@code data}
     */
    public String add(ConstantTensor data, String suggestedName) {
        Objects.requireNonNull(data, "data cannot be null");
        for (Map.Entry<String, ConstantTensor> entry : constants.entrySet()) {
            if (entry.getValue().contentEquals(data)) {
                return entry.getKey();
            }
        }

        String name = suggestedName == null || suggestedName.isEmpty() ? "constant" + constants.size() : suggestedName;
        if (Character.isDigit(name.charAt(0))) {
            name = "constant_" + name;
        }
        String prefix = NON_IDENTIFIER.matcher(name).replaceAll("_");
        name = prefix;
        int cnt = 0;
        while (constants.containsKey(name)) {
            name = prefix + "_" + cnt;
            cnt++;
        }

        constants.put(name, data);
        hashes.put(name, contentHash(data));
        allocatedNames.put(name, suggestedName);
        return name;
    }

    /**
     * Name of the copy of constant {@code name} on {@code device}, creating the copy on
     * first use. Copies are named {@code <name>_<type><index>}, e.g. {@code w_cuda0}.
     *
     * @param device target device, or null for the constant's own device
     */
    public String constantName(String name, Device device) {
        ConstantTensor value = get(name);
        if (device == null || value.device().equals(device)) {
            return name;
        }
        String altName = name + "_" + device.type() + (device.hasIndex() ? device.index() : 0);
        if (!constants.containsKey(altName)) {
            ConstantTensor copy = value.to(device);
            constants.put(altName, copy);
            hashes.put(altName, contentHash(copy));
            allocatedNames.put(altName, allocatedNames.get(name));
        }
        return altName;
    }

    /**
     * @throws IllegalArgumentException if there is no constant named {@code name}
     */
    public ConstantTensor get(String name) {
        ConstantTensor value = constants.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown constant: " + name);
        }
        return value;
    }

    public boolean contains(String name) {
        return constants.containsKey(name);
    }

    public int size() {
        return constants.size();
    }

    /**
     * All entries in insertion order.
     */
    public Map<String, ConstantTensor> constants() {
        return Collections.unmodifiableMap(constants);
    }

    /**
     * Content hashes by constant name, in insertion order.
     */
    public Map<String, String> hashes() {
        return Collections.unmodifiableMap(hashes);
    }

    /**
     * The name that was requested when {@code name} was allocated; null if none was.
     */
    public String allocatedName(String name) {
        return allocatedNames.get(name);
    }

    /**
     * Hex SHA-256 of the tensor's canonical representation.
     */
    public static String contentHash(ConstantTensor data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(data.repr().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "ConstantTable" + constants.keySet();
    }
}
