package com.loglens.fields;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory pinned-field preferences for the field sidebar.
 * Pinned fields keep their pin order; reordering replaces it.
 */
@Component
public class FieldPreferences {

    private final Set<String> pinned = new LinkedHashSet<>();

    public synchronized Snapshot pinField(String name) {
        requireName(name);
        pinned.add(name);
        return snapshot();
    }

    public synchronized Snapshot unpinField(String name) {
        requireName(name);
        pinned.remove(name);
        return snapshot();
    }

    /**
     * Replace the pin order. Every name in {@code order} becomes pinned;
     * pinned fields missing from it are appended in their previous order.
     */
    public synchronized Snapshot reorderFields(List<String> order) {
        if (order == null) {
            throw new IllegalArgumentException("Field order must not be null");
        }
        Set<String> reordered = new LinkedHashSet<>();
        for (String name : order) {
            requireName(name);
            reordered.add(name);
        }
        reordered.addAll(pinned);
        pinned.clear();
        pinned.addAll(reordered);
        return snapshot();
    }

    public synchronized Snapshot preferences() {
        return snapshot();
    }

    private Snapshot snapshot() {
        return new Snapshot(new ArrayList<>(pinned));
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Field name must not be blank");
        }
    }

    /**
     * Immutable view of the preferences at one point in time.
     */
    public static final class Snapshot {

        @JsonProperty("pinned")
        private final List<String> pinned;

        public Snapshot(List<String> pinned) {
            this.pinned = List.copyOf(pinned);
        }

        public List<String> getPinned() {
            return pinned;
        }
    }
}
