package com.cpi.async.controller;

import com.cpi.async.domain.ProcessRequest;
import com.cpi.async.domain.ProcessResponse;
import com.cpi.async.exception.InvalidTokenException;
import com.cpi.async.service.TaskRunner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * REST Controller that triggers personal CPI calculations.
 * Answers as soon as the work is queued; the result reaches the main service
 * through the result callback.
 */
@RestController
@RequestMapping("/api/v1/process")
@CrossOrigin(
        origins = "*",
        methods = {RequestMethod.POST, RequestMethod.OPTIONS},
        allowedHeaders = {"Content-Type", "X-Auth-Token", "Authorization"},
        maxAge = 86400
)
@Tag(name = "Processing", description = "Asynchronous personal CPI calculation")
@Slf4j
public class ProcessController {

    private final TaskRunner taskRunner;
    private final byte[] authToken;

    public ProcessController(TaskRunner taskRunner,
                             @Value("${cpi.auth.token}") String authToken) {
        this.taskRunner = taskRunner;
        this.authToken = authToken.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Queues a calculation for the given application.
     */
    @PostMapping
    @Operation(
            summary = "Start personal CPI calculation",
            description = "Validates the shared token and queues the calculation. " +
                         "The result is delivered later to the main service."
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Processing started",
                    content = @Content(schema = @Schema(implementation = ProcessResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Missing body or required fields",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            ),
            @ApiResponse(
                    responseCode = "401",
                    description = "Invalid token",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))
            )
    })
    public ResponseEntity<ProcessResponse> process(
            @Parameter(description = "Application id and shared token", required = true)
            @Valid @RequestBody ProcessRequest request) {

        log.info("Received processing request: {}", request);

        if (!MessageDigest.isEqual(authToken, request.token().getBytes(StandardCharsets.UTF_8))) {
            throw new InvalidTokenException();
        }

        taskRunner.submit(request.pk());
        log.info("Async task started for request {}", request.pk());

        return ResponseEntity.ok(ProcessResponse.started(request.pk()));
    }

    /**
     * Health check endpoint for the processing queue.
     */
    @GetMapping("/health")
    @Operation(
            summary = "Health check",
            description = "Reports whether the worker accepts tasks and how many are queued"
    )
    @ApiResponse(
            responseCode = "200",
            description = "Service is healthy"
    )
    public ResponseEntity<String> health() {
        if (taskRunner.isShutdown()) {
            return ResponseEntity.status(503).body("Task runner is shut down");
        }
        return ResponseEntity.ok("CPI service is healthy, queued tasks: " + taskRunner.queuedCount());
    }
}
