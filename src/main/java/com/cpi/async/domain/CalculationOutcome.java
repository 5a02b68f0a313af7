package com.cpi.async.domain;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Result of one calculation task.
 * A successful outcome always carries an index value; a failed one never does.
 */
public record CalculationOutcome(
    String id,
    BigDecimal personalIndex,
    boolean success
) {

    public CalculationOutcome {
        if (success && personalIndex == null) {
            throw new IllegalArgumentException("Successful outcome requires a personal index");
        }
        if (!success && personalIndex != null) {
            throw new IllegalArgumentException("Failed outcome must not carry a personal index");
        }
    }

    public static CalculationOutcome success(String id, BigDecimal personalIndex) {
        return new CalculationOutcome(id, personalIndex, true);
    }

    public static CalculationOutcome failure(String id) {
        return new CalculationOutcome(id, null, false);
    }

    public Optional<BigDecimal> personalIndexValue() {
        return Optional.ofNullable(personalIndex);
    }
}
