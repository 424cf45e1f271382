package io.edgesim.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Case-insensitive, multi-valued HTTP header collection.
 *
 * <p>
 * All header names are normalized to <strong>lowercase</strong>. The class is
 * immutable: {@link #with}, {@link #add} and {@link #without} return new
 * instances, so a stage handler can rewrite headers without affecting the
 * event it received.
 */
public final class HttpHeaders {

    private static final HttpHeaders EMPTY = new HttpHeaders(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));

    /** Internal storage: case-insensitive key order, values are non-empty lists. */
    private final TreeMap<String, List<String>> store;

    private HttpHeaders(TreeMap<String, List<String>> store) {
        this.store = store;
    }

    /**
     * First value for a header name (case-insensitive).
     *
     * @return the first value, or {@code null} if the header is absent
     */
    public String first(String name) {
        List<String> values = store.get(name);
        return values != null && !values.isEmpty() ? values.get(0) : null;
    }

    /**
     * All values for a header name (case-insensitive).
     *
     * @return an unmodifiable list of values, or an empty list if absent
     */
    public List<String> all(String name) {
        List<String> values = store.get(name);
        return values != null ? values : List.of();
    }

    /** True if the header exists (case-insensitive). */
    public boolean contains(String name) {
        return store.containsKey(name);
    }

    /** Returns {@code true} if no headers are present. */
    public boolean isEmpty() {
        return store.isEmpty();
    }

    /** Lowercase header names in sorted order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(store.keySet());
    }

    /** Visits every header name with all of its values. */
    public void forEach(BiConsumer<String, List<String>> action) {
        store.forEach(action);
    }

    /**
     * All-values-per-name view with lowercase keys.
     *
     * @return an unmodifiable map
     */
    public Map<String, List<String>> toMultiValueMap() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        store.forEach(result::put);
        return Collections.unmodifiableMap(result);
    }

    /** Returns a copy with {@code name} set to the single {@code value}. */
    public HttpHeaders with(String name, String value) {
        TreeMap<String, List<String>> copy = copyStore();
        copy.put(name.toLowerCase(Locale.ROOT), List.of(value));
        return new HttpHeaders(copy);
    }

    /** Returns a copy with {@code value} appended to the values of {@code name}. */
    public HttpHeaders add(String name, String value) {
        TreeMap<String, List<String>> copy = copyStore();
        List<String> values = new ArrayList<>(copy.getOrDefault(name, List.of()));
        values.add(value);
        copy.put(name.toLowerCase(Locale.ROOT), List.copyOf(values));
        return new HttpHeaders(copy);
    }

    /** Returns a copy without {@code name}. */
    public HttpHeaders without(String name) {
        if (!store.containsKey(name)) {
            return this;
        }
        TreeMap<String, List<String>> copy = copyStore();
        copy.remove(name);
        return copy.isEmpty() ? EMPTY : new HttpHeaders(copy);
    }

    private TreeMap<String, List<String>> copyStore() {
        TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(store);
        return copy;
    }

    // ── Factory methods ──

    /**
     * Creates headers from a single-value map. Keys are normalized to lowercase.
     *
     * @param singleValue header name → single value
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders of(Map<String, String> singleValue) {
        if (singleValue == null || singleValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        singleValue.forEach((key, value) -> map.put(key.toLowerCase(Locale.ROOT), List.of(value)));
        return new HttpHeaders(map);
    }

    /**
     * Creates headers from a multi-value map. Keys are normalized to lowercase;
     * names with an empty value list are dropped. Values of names that differ only
     * by case are merged in iteration order.
     *
     * @param multiValue header name → list of values
     * @return immutable {@code HttpHeaders}
     */
    public static HttpHeaders ofMulti(Map<String, List<String>> multiValue) {
        if (multiValue == null || multiValue.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, List<String>> map = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        multiValue.forEach((key, values) -> {
            if (values == null || values.isEmpty()) {
                return;
            }
            List<String> merged = new ArrayList<>(map.getOrDefault(key, List.of()));
            merged.addAll(values);
            map.put(key.toLowerCase(Locale.ROOT), List.copyOf(merged));
        });
        return map.isEmpty() ? EMPTY : new HttpHeaders(map);
    }

    /** Returns an empty headers instance. */
    public static HttpHeaders empty() {
        return EMPTY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HttpHeaders that)) return false;
        return store.equals(that.store);
    }

    @Override
    public int hashCode() {
        return store.hashCode();
    }

    @Override
    public String toString() {
        return "HttpHeaders" + store.keySet();
    }
}
