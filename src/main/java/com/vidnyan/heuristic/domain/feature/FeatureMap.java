package com.vidnyan.heuristic.domain.feature;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, namespaced bag of page signals produced by the HTML and image
 * feature extractors.
 *
 * <p>Values are read through {@link FeatureKey} only. A value that is absent,
 * null, or of an unexpected type resolves to the key's default, so reads never fail.
 */
public final class FeatureMap {

    private static final FeatureMap EMPTY = new FeatureMap(new EnumMap<>(FeatureNamespace.class));

    private final Map<FeatureNamespace, Map<String, Object>> namespaces;

    private FeatureMap(Map<FeatureNamespace, Map<String, Object>> namespaces) {
        this.namespaces = Collections.unmodifiableMap(namespaces);
    }

    /**
     * A feature map with no namespaces; every read yields its default.
     */
    public static FeatureMap empty() {
        return EMPTY;
    }

    /**
     * Create from raw extractor output. A null namespace means the extractor produced nothing.
     */
    public static FeatureMap of(Map<String, Object> html, Map<String, Object> image) {
        Builder builder = builder();
        if (html != null) {
            builder.namespace(FeatureNamespace.HTML, html);
        }
        if (image != null) {
            builder.namespace(FeatureNamespace.IMAGE, image);
        }
        return builder.build();
    }

    /**
     * Check whether the extractor for a namespace contributed any data.
     */
    public boolean hasNamespace(FeatureNamespace namespace) {
        return namespaces.containsKey(namespace);
    }

    public boolean bool(FeatureKey key) {
        requireType(key, FeatureKey.FeatureType.BOOLEAN);
        return lookup(key)
                .filter(Boolean.class::isInstance)
                .map(Boolean.class::cast)
                .orElse((Boolean) key.defaultValue());
    }

    /**
     * Numeric value of an integer or decimal key, read without narrowing so that
     * fractional or very large counts compare as given.
     */
    public double number(FeatureKey key) {
        if (key.type() != FeatureKey.FeatureType.INTEGER && key.type() != FeatureKey.FeatureType.DECIMAL) {
            throw new IllegalArgumentException("Feature " + key.path() + " is " + key.type() + ", not numeric");
        }
        return lookup(key)
                .filter(Number.class::isInstance)
                .map(v -> ((Number) v).doubleValue())
                .orElse(((Number) key.defaultValue()).doubleValue());
    }

    @SuppressWarnings("unchecked")
    public List<Object> list(FeatureKey key) {
        requireType(key, FeatureKey.FeatureType.LIST);
        return lookup(key)
                .filter(List.class::isInstance)
                .map(v -> (List<Object>) v)
                .orElse((List<Object>) key.defaultValue());
    }

    /**
     * Resolved value of any key, default applied, as used in rule descriptions.
     */
    public Object value(FeatureKey key) {
        return switch (key.type()) {
            case BOOLEAN -> bool(key);
            case INTEGER -> wholeOrDecimal(number(key));
            case DECIMAL -> number(key);
            case LIST -> list(key);
        };
    }

    // 4.0 prints as 4, 4.5 stays 4.5
    private static Object wholeOrDecimal(double value) {
        if (value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
            return (long) value;
        }
        return value;
    }

    private Optional<Object> lookup(FeatureKey key) {
        Map<String, Object> root = namespaces.get(key.namespace());
        if (root == null) {
            return Optional.empty();
        }
        Object section = root.get(key.section());
        if (!(section instanceof Map<?, ?> sectionMap)) {
            return Optional.empty();
        }
        return Optional.ofNullable(sectionMap.get(key.featureName()));
    }

    private static void requireType(FeatureKey key, FeatureKey.FeatureType expected) {
        if (key.type() != expected) {
            throw new IllegalArgumentException(
                    "Feature " + key.path() + " is " + key.type() + ", not " + expected);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureMap other)) return false;
        return namespaces.equals(other.namespaces);
    }

    @Override
    public int hashCode() {
        return namespaces.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureMap" + namespaces;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<FeatureNamespace, Map<String, Object>> namespaces = new EnumMap<>(FeatureNamespace.class);

        /**
         * Replace a whole namespace with raw extractor output.
         */
        public Builder namespace(FeatureNamespace namespace, Map<String, Object> sections) {
            namespaces.put(namespace, new LinkedHashMap<>(sections));
            return this;
        }

        /**
         * Set a single feature, creating its namespace and section as needed.
         */
        @SuppressWarnings("unchecked")
        public Builder set(FeatureKey key, Object value) {
            Map<String, Object> root = namespaces.computeIfAbsent(key.namespace(), ns -> new LinkedHashMap<>());
            Object section = root.get(key.section());
            Map<String, Object> sectionMap = section instanceof Map<?, ?>
                    ? new LinkedHashMap<>((Map<String, Object>) section)
                    : new LinkedHashMap<>();
            sectionMap.put(key.featureName(), value);
            root.put(key.section(), sectionMap);
            return this;
        }

        public FeatureMap build() {
            Map<FeatureNamespace, Map<String, Object>> copy = new EnumMap<>(FeatureNamespace.class);
            namespaces.forEach((ns, sections) -> copy.put(ns, freezeMap(sections)));
            return new FeatureMap(copy);
        }

        private static Map<String, Object> freezeMap(Map<?, ?> source) {
            Map<String, Object> frozen = new LinkedHashMap<>();
            source.forEach((k, v) -> frozen.put(String.valueOf(k), freeze(v)));
            return Collections.unmodifiableMap(frozen);
        }

        private static Object freeze(Object value) {
            if (value instanceof Map<?, ?> map) {
                return freezeMap(map);
            }
            if (value instanceof List<?> list) {
                List<Object> frozen = new ArrayList<>(list.size());
                list.forEach(item -> frozen.add(freeze(item)));
                return Collections.unmodifiableList(frozen);
            }
            return value;
        }
    }
}
