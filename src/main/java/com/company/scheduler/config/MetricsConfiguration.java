package com.company.scheduler.config;

import com.company.scheduler.repository.ScheduledJobRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Gauges for the job backlog and the dispatch pool.
 */
@Configuration
@Slf4j
public class MetricsConfiguration {

    private final ScheduledJobRepository jobRepository;
    private final ThreadPoolTaskExecutor dispatchExecutor;

    public MetricsConfiguration(ScheduledJobRepository jobRepository,
                                @Qualifier("dispatchExecutor") ThreadPoolTaskExecutor dispatchExecutor) {
        this.jobRepository = jobRepository;
        this.dispatchExecutor = dispatchExecutor;
    }

    @Bean
    public MeterBinder schedulerMetrics() {
        return registry -> {
            Gauge.builder("scheduler.jobs.pending", jobRepository, repo -> {
                        try {
                            return repo.countPending();
                        } catch (Exception e) {
                            log.warn("Failed to count pending jobs", e);
                            return 0;
                        }
                    })
                    .description("Jobs not yet sent, including future ones")
                    .register(registry);

            Gauge.builder("scheduler.dispatch.active", dispatchExecutor, ThreadPoolTaskExecutor::getActiveCount)
                    .description("Dispatch tasks currently running")
                    .register(registry);

            Gauge.builder("scheduler.dispatch.queued", dispatchExecutor,
                            executor -> executor.getThreadPoolExecutor().getQueue().size())
                    .description("Dispatch tasks waiting for a worker")
                    .register(registry);

            log.info("Scheduler metrics registered");
        };
    }
}
