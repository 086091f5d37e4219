package com.xammer.anomaly.dto;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary value held at a fixed scale of two decimals.
 * Absent or invalid input always resolves to {@code 0.00}, never to an error.
 */
@EqualsAndHashCode
public final class CostAmount implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final int SCALE = 2;

    public static final CostAmount ZERO = new CostAmount(BigDecimal.ZERO);

    private final BigDecimal value;

    private CostAmount(BigDecimal value) {
        this.value = value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static CostAmount of(Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return ZERO;
        }
        // valueOf keeps the shortest decimal form, so 12.345 rounds to 12.35
        return new CostAmount(BigDecimal.valueOf(value));
    }

    public static CostAmount of(BigDecimal value) {
        return value == null ? ZERO : new CostAmount(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value.toPlainString();
    }
}
