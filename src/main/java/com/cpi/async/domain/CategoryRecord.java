package com.cpi.async.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * One spending category of an application, as served by the collaborator service.
 * Missing amounts are read as zero through {@link #userSpentOrZero()} and
 * {@link #basePriceOrZero()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CategoryRecord(

    @JsonProperty("id")
    String id,

    @JsonProperty("userSpent")
    BigDecimal userSpent,

    @JsonProperty("basePrice")
    BigDecimal basePrice
) {

    public BigDecimal userSpentOrZero() {
        return userSpent != null ? userSpent : BigDecimal.ZERO;
    }

    public BigDecimal basePriceOrZero() {
        return basePrice != null ? basePrice : BigDecimal.ZERO;
    }
}
