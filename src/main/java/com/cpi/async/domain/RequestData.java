package com.cpi.async.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Input payload fetched from {@code GET <base>/{id}/async-data}.
 * The comparison date is passed through untouched; it plays no part in the calculation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestData(

    @JsonProperty("categories")
    List<CategoryRecord> categories,

    @JsonProperty("comparisonDate")
    String comparisonDate
) {

    public RequestData {
        categories = categories != null ? List.copyOf(categories) : List.of();
    }
}
