package org.pathviz.routing.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Locale;

/**
 * Shortest-path strategy selector.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum ShortestPathAlgorithm {
    /** Priority selection, non-negative weights. */
    DIJKSTRA("Dijkstra"),
    /** Edge relaxation, signed weights with negative-cycle detection. */
    BELLMAN_FORD("Bellman-Ford");

    private final String displayName;

    /**
     * Parses a user-supplied algorithm name such as {@code dijkstra}, {@code Bellman-Ford}
     * or {@code bellman_ford}.
     *
     * @throws IllegalArgumentException if the name matches no algorithm.
     */
    public static ShortestPathAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("algorithm name must be non-blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ShortestPathAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("unknown algorithm: " + name);
    }
}
