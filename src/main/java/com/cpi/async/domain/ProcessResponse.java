package com.cpi.async.domain;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Acknowledgement returned as soon as a calculation has been queued.
 */
@Schema(description = "Acknowledgement that processing has started")
public record ProcessResponse(

    @Schema(description = "Human readable message", example = "Processing started for request 42")
    String message
) {

    public static ProcessResponse started(String requestId) {
        return new ProcessResponse("Processing started for request " + requestId);
    }
}
