package com.groundstaff.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Dense index of decision variables. Keys that already existed in the previous table are
 * reused by identity, so a persisting variable is the same object across rebuilds.
 */
public final class VariableTable {

    private static final VariableTable EMPTY = new VariableTable(List.of(), Map.of());

    private final List<AssignmentKey> keys;
    private final Map<AssignmentKey, Integer> index;

    private VariableTable(List<AssignmentKey> keys, Map<AssignmentKey, Integer> index) {
        this.keys = keys;
        this.index = index;
    }

    public static VariableTable empty() {
        return EMPTY;
    }

    public static Builder builder(VariableTable previous) {
        return new Builder(previous == null ? EMPTY : previous);
    }

    public int size() {
        return keys.size();
    }

    public AssignmentKey key(int variable) {
        return keys.get(variable);
    }

    /** Dense index of the key, or -1 when it is not part of this table. */
    public int indexOf(AssignmentKey key) {
        Integer i = index.get(key);
        return i == null ? -1 : i;
    }

    public boolean contains(AssignmentKey key) {
        return index.containsKey(key);
    }

    public List<AssignmentKey> keys() {
        return keys;
    }

    /** The instance this table holds for an equal key, or null. */
    AssignmentKey canonical(AssignmentKey key) {
        Integer i = index.get(key);
        return i == null ? null : keys.get(i);
    }

    public static final class Builder {
        private final VariableTable previous;
        private final List<AssignmentKey> keys = new ArrayList<>();
        private final Map<AssignmentKey, Integer> index = new HashMap<>();

        private Builder(VariableTable previous) {
            this.previous = previous;
        }

        public int add(String flightNumber, String serviceId, String staffId) {
            AssignmentKey key = new AssignmentKey(flightNumber, serviceId, staffId);
            Integer existing = index.get(key);
            if (existing != null) {
                return existing;
            }
            AssignmentKey reused = previous.canonical(key);
            if (reused != null) {
                key = reused;
            }
            int i = keys.size();
            keys.add(key);
            index.put(key, i);
            return i;
        }

        public VariableTable build() {
            return new VariableTable(Collections.unmodifiableList(new ArrayList<>(keys)),
                    Collections.unmodifiableMap(new HashMap<>(index)));
        }
    }
}
