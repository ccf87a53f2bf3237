package io.stagecraft.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Copy helpers used by the model records' compact constructors.
///
/// Every call allocates a fresh container, so a record never aliases a caller's
/// collection (not even an already-unmodifiable one). String maps are copied into a
/// key-sorted {@link TreeMap} so iteration order is stable across runs and JVMs.
public final class Immutables {

    private Immutables() {}

    /// Returns a fresh, unmodifiable, key-sorted copy of a string map.
    ///
    /// `null` maps become empty; `null` values become the empty string.
    ///
    /// @param source map to copy, may be null
    /// @return unmodifiable sorted copy, never null
    /// @throws NullPointerException if the map contains a null key
    public static Map<String, String> copyOf(Map<String, String> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        TreeMap<String, String> copy = new TreeMap<>();
        source.forEach(
                (key, value) ->
                        copy.put(
                                Objects.requireNonNull(key, "map key must not be null"),
                                value != null ? value : ""));
        return Collections.unmodifiableMap(copy);
    }

    /// Returns a fresh unmodifiable copy of a list.
    ///
    /// @param source list to copy, may be null
    /// @param <T> element type
    /// @return unmodifiable copy, never null
    /// @throws NullPointerException if the list contains null elements
    public static <T> List<T> copyOf(List<T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        List<T> copy = new ArrayList<>(source.size());
        for (T element : source) {
            copy.add(Objects.requireNonNull(element, "list element must not be null"));
        }
        return Collections.unmodifiableList(copy);
    }

    /// Normalises a nullable string to the empty string.
    ///
    /// @param value string, may be null
    /// @return the value, or `""` when null
    public static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
