package com.cpi.async.config;

import com.cpi.async.service.PersonalIndexCalculator;
import com.cpi.async.service.RequestDataFetcher;
import com.cpi.async.service.ResultReporter;
import com.cpi.async.service.TaskRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Builds the single process-wide task runner.
 */
@Configuration
public class TaskRunnerConfig {

    @Value("${cpi.task.concurrency:1}")
    private int concurrency;

    @Value("${cpi.task.simulated-delay:30s}")
    private Duration simulatedDelay;

    @Value("${cpi.task.shutdown-grace:60s}")
    private Duration shutdownGrace;

    @Bean(destroyMethod = "shutdown")
    public TaskRunner taskRunner(RequestDataFetcher requestDataFetcher,
                                 PersonalIndexCalculator personalIndexCalculator,
                                 ResultReporter resultReporter) {
        return new TaskRunner(
                requestDataFetcher,
                personalIndexCalculator,
                resultReporter,
                concurrency,
                simulatedDelay,
                shutdownGrace
        );
    }
}
