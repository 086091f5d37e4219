package com.xammer.anomaly.service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Present dimension values for one usage query, kept in {@link CostDimension} order.
 * Null and empty values are treated as absent and never stored.
 */
public final class UsageDimensions {

    private static final UsageDimensions NONE = new UsageDimensions(new EnumMap<>(CostDimension.class));

    private final Map<CostDimension, String> values;

    private UsageDimensions(EnumMap<CostDimension, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static UsageDimensions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<CostDimension, String> asMap() {
        return values;
    }

    /**
     * Label used when logging a failed lookup, e.g. {@code SERVICE=Amazon EC2, REGION=us-east-1}.
     */
    public String describe() {
        if (values.isEmpty()) {
            return "<unfiltered>";
        }
        return values.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UsageDimensions)) {
            return false;
        }
        return values.equals(((UsageDimensions) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return describe();
    }

    public static final class Builder {

        private final EnumMap<CostDimension, String> values = new EnumMap<>(CostDimension.class);

        private Builder() {
        }

        public Builder with(CostDimension dimension, String value) {
            if (value != null && !value.isEmpty()) {
                values.put(dimension, value);
            }
            return this;
        }

        public UsageDimensions build() {
            return values.isEmpty() ? NONE : new UsageDimensions(new EnumMap<>(values));
        }
    }
}
