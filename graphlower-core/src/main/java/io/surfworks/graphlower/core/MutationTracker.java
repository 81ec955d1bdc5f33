package io.surfworks.graphlower.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.surfworks.graphlower.ir.TensorBox;

/**
 * Tracks which lowered values read which buffers, so that writing a buffer in place can
 * first materialize everything that read its old contents.
 *
 * <p>Readers are recorded as nodes are lowered and never forgotten; marking a buffer
 * mutated only affects readers recorded before the call.
 */
final class MutationTracker {

    private final Map<String, List<TensorBox>> nameToUsers = new LinkedHashMap<>();
    private final Set<String> mutatedBuffers = new LinkedHashSet<>();

    /**
     * Records {@code value} (or each tensor in a list value) as a reader of the buffers it reads.
     */
    void registerUsersOf(Object value) {
        if (value instanceof List<?> list) {
            for (Object element : list) {
                registerUsersOf(element);
            }
        } else if (value instanceof TensorBox box) {
            for (String name : new LinkedHashSet<>(box.readNames())) {
                nameToUsers.computeIfAbsent(name, k -> new ArrayList<>()).add(box);
            }
        }
    }

    /**
     * Records that {@code name} is written in place and realizes its readers, freezing the
     * value they saw.
     */
    void markBufferMutated(String name) {
        mutatedBuffers.add(name);
        List<TensorBox> users = nameToUsers.get(name);
        if (users == null) {
            return;
        }
        for (TensorBox user : users) {
            user.realize();
        }
    }

    List<TensorBox> usersOf(String name) {
        return Collections.unmodifiableList(nameToUsers.getOrDefault(name, List.of()));
    }

    Set<String> mutatedBuffers() {
        return Collections.unmodifiableSet(mutatedBuffers);
    }
}
