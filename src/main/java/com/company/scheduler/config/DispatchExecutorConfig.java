package com.company.scheduler.config;

import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@RequiredArgsConstructor
public class DispatchExecutorConfig {

    private final SchedulerProperties properties;

    /**
     * Pool for per-job dispatch tasks. Shutdown waits for launched tasks so a
     * pass that has started delivering is allowed to persist its outcome.
     */
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor() {
        SchedulerProperties.Dispatch dispatch = properties.getDispatch();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.getCorePoolSize());
        executor.setMaxPoolSize(dispatch.getMaxPoolSize());
        executor.setQueueCapacity(dispatch.getQueueCapacity());
        executor.setThreadNamePrefix("dispatch-");
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) dispatch.getShutdownAwait().toSeconds());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Copies the submitter's MDC into the task and restores the running
     * thread's own MDC afterwards. Caller-runs tasks execute on the submitting
     * thread, so its context must survive the task.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    } else {
                        MDC.clear();
                    }
                }
            };
        };
    }
}
