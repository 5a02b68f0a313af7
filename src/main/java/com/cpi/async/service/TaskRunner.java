package com.cpi.async.service;

import com.cpi.async.domain.CalculationOutcome;
import com.cpi.async.domain.RequestData;
import com.cpi.async.domain.TaskState;
import com.cpi.async.exception.DataFetchException;
import com.cpi.async.exception.ResultReportException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs personal index calculations in the background.
 * <p>
 * Each submitted request becomes one task: wait the simulated delay, fetch the
 * data, calculate, report. Tasks start in submission order on a fixed pool of
 * {@code concurrency} workers (one by default, so tasks never overlap). The
 * queue is unbounded; {@link #submit(String)} never blocks.
 * <p>
 * Every task that starts running ends with exactly one report attempt: the
 * computed outcome, or {@code success=false} when fetching or calculating
 * failed. Delivery failures are logged and dropped. Tasks still queued at
 * {@link #shutdown()} are cancelled without any outbound call.
 */
@Slf4j
public class TaskRunner {

    private final RequestDataFetcher requestDataFetcher;
    private final PersonalIndexCalculator calculator;
    private final ResultReporter resultReporter;
    private final Duration simulatedDelay;
    private final Duration shutdownGrace;
    private final ThreadPoolExecutor executor;

    public TaskRunner(RequestDataFetcher requestDataFetcher,
                      PersonalIndexCalculator calculator,
                      ResultReporter resultReporter,
                      int concurrency,
                      Duration simulatedDelay,
                      Duration shutdownGrace) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("Concurrency must be at least 1, got " + concurrency);
        }
        this.requestDataFetcher = requestDataFetcher;
        this.calculator = calculator;
        this.resultReporter = resultReporter;
        this.simulatedDelay = simulatedDelay;
        this.shutdownGrace = shutdownGrace;
        this.executor = new ThreadPoolExecutor(
                concurrency,
                concurrency,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new WorkerThreadFactory()
        );
        log.info("Task runner started: concurrency={}, simulatedDelay={}", concurrency, simulatedDelay);
    }

    /**
     * Queues a calculation for the given request and returns immediately.
     *
     * @param requestId application identifier
     * @return future completed with the task's terminal state
     * @throws IllegalArgumentException if the identifier is blank
     * @throws IllegalStateException    if the runner has been shut down
     */
    public CompletableFuture<TaskState> submit(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("Request identifier is required");
        }

        CalculationTask task = new CalculationTask(requestId);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Task runner is shut down", e);
        }

        log.info("Async task queued for request {} (queued={})", requestId, queuedCount());
        return task.completion;
    }

    /**
     * Number of tasks waiting for a worker.
     */
    public int queuedCount() {
        return executor.getQueue().size();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Stops accepting work, cancels every queued task and waits for the
     * running ones to finish. Running tasks are interrupted only once the
     * grace period has elapsed.
     */
    public void shutdown() {
        executor.shutdown();

        List<Runnable> pending = new ArrayList<>();
        executor.getQueue().drainTo(pending);
        for (Runnable runnable : pending) {
            ((CalculationTask) runnable).cancel();
        }
        log.info("Task runner shutting down: {} queued task(s) cancelled", pending.size());

        try {
            if (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Running task did not finish within {}; interrupting", shutdownGrace);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One fetch, calculate, report unit for a single request.
     */
    private final class CalculationTask implements Runnable {

        private final String requestId;
        private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.QUEUED);
        private final CompletableFuture<TaskState> completion = new CompletableFuture<>();

        private CalculationTask(String requestId) {
            this.requestId = requestId;
        }

        @Override
        public void run() {
            if (!state.compareAndSet(TaskState.QUEUED, TaskState.RUNNING)) {
                return;
            }
            log.info("Task started for request {}", requestId);
            long startedAt = System.nanoTime();

            TaskState terminal = TaskState.FAILED;
            try {
                terminal = execute();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Task for request {} interrupted; no result sent", requestId);
                terminal = TaskState.CANCELLED;
            } catch (RuntimeException e) {
                log.error("Unexpected error in task for request {}", requestId, e);
            } finally {
                state.set(terminal);
                completion.complete(terminal);
                log.info("Task for request {} finished: state={}, elapsed={}ms", requestId, terminal,
                        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
            }
        }

        private TaskState execute() throws InterruptedException {
            if (!simulatedDelay.isZero() && !simulatedDelay.isNegative()) {
                TimeUnit.MILLISECONDS.sleep(simulatedDelay.toMillis());
            }

            RequestData data;
            try {
                data = await(requestDataFetcher.fetch(requestId));
            } catch (DataFetchException e) {
                if (e.isBadStatus()) {
                    log.warn("Failed to fetch request {}: HTTP {}", requestId, e.getStatusCode());
                } else {
                    log.warn("Request error fetching data for {}: {}", requestId, e.getMessage(), e);
                }
                deliver(CalculationOutcome.failure(requestId));
                return TaskState.FAILED;
            }
            if (data == null) {
                log.warn("No data returned for request {}", requestId);
                deliver(CalculationOutcome.failure(requestId));
                return TaskState.FAILED;
            }

            CalculationOutcome outcome;
            try {
                outcome = calculator.compute(requestId, data);
            } catch (RuntimeException e) {
                log.error("Error calculating personal index for request {}", requestId, e);
                deliver(CalculationOutcome.failure(requestId));
                return TaskState.FAILED;
            }

            log.info("Task completed for request {}: personalCPI={}, success={}",
                    requestId, outcome.personalIndex(), outcome.success());
            deliver(outcome);
            return TaskState.COMPLETED;
        }

        private void deliver(CalculationOutcome outcome) throws InterruptedException {
            try {
                await(resultReporter.report(outcome));
            } catch (ResultReportException e) {
                log.error("Error sending results for request {}: {}", requestId, e.getMessage(), e);
            } catch (RuntimeException e) {
                log.error("Unexpected error sending results for request {}", requestId, e);
            }
        }

        /**
         * Blocks on the call. An interrupt arrives from Reactor wrapped in a
         * runtime exception with the flag cleared; it is rethrown as
         * {@link InterruptedException} so the task ends cancelled.
         */
        private <T> T await(Mono<T> call) throws InterruptedException {
            try {
                return call.block();
            } catch (RuntimeException e) {
                if (Exceptions.unwrap(e) instanceof InterruptedException) {
                    throw new InterruptedException("Interrupted while waiting on collaborator for request " + requestId);
                }
                throw e;
            }
        }

        private void cancel() {
            if (state.compareAndSet(TaskState.QUEUED, TaskState.CANCELLED)) {
                log.info("Task for request {} cancelled before start", requestId);
                completion.complete(TaskState.CANCELLED);
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "cpi-worker-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }
}
