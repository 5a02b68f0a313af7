package com.cpi.async.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Body of {@code PUT <base>/{id}/async-result}.
 * {@code personalCPI} is written as an explicit {@code null} on failure.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record CalculationResultPayload(

    @JsonProperty("personalCPI")
    BigDecimal personalCpi,

    @JsonProperty("success")
    boolean success
) {

    public static CalculationResultPayload from(CalculationOutcome outcome) {
        return new CalculationResultPayload(outcome.personalIndex(), outcome.success());
    }
}
