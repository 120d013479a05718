package com.beacon.observability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of a single probe against one dependency.
 * <p>
 * Created fresh on every probe invocation and never mutated afterwards. A reachable check
 * carries whatever metadata the dependency exposed and no error; an unreachable check carries
 * the cause description and no metadata.
 *
 * @param name      dependency name (e.g., "database", "redis")
 * @param reachable whether the liveness operation succeeded
 * @param detail    metadata reported by the dependency, in insertion order (empty when unreachable)
 * @param error     cause description when unreachable, otherwise {@code null}
 */
public record DependencyCheck(String name, boolean reachable, Map<String, String> detail, String error) {

    public DependencyCheck {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (reachable && error != null) {
            throw new IllegalArgumentException("a reachable check must not carry an error");
        }
        if (!reachable && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("an unreachable check must carry an error");
        }
        detail = reachable ? copyWithoutNulls(detail) : Map.of();
    }

    /** Creates a reachable check with the given metadata. */
    public static DependencyCheck reachable(String name, Map<String, String> detail) {
        return new DependencyCheck(name, true, detail, null);
    }

    /** Creates an unreachable check with the given cause description. */
    public static DependencyCheck unreachable(String name, String error) {
        return new DependencyCheck(name, false, Map.of(), error);
    }

    /**
     * Returns the error as an {@link Optional}.
     */
    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }

    private static Map<String, String> copyWithoutNulls(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, String> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
