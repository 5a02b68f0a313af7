package com.cpi.async.domain;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Inbound trigger asking for a personal index calculation.
 */
@Schema(description = "Request to start an asynchronous personal price-index calculation")
public record ProcessRequest(

    @Schema(description = "Application identifier", example = "42")
    @NotBlank(message = "pk is required")
    String pk,

    @Schema(description = "Shared secret token", example = "secret-token")
    @NotNull(message = "token is required")
    String token
) {

    @Override
    public String toString() {
        return "ProcessRequest{pk='" + pk + "', token=***}";
    }
}
