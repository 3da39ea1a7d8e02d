package com.example.campaign.shared.config;

import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@RequiredArgsConstructor
public class TaskConfig {

    private final AppProperties appProperties;

    /**
     * Thread pool for the @Scheduled sweeps.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Bounded pool for per-recipient dispatch work. When the queue is full the
     * launching thread runs the task itself, which throttles the launch loop.
     */
    @Bean
    public ThreadPoolTaskExecutor dispatchExecutor() {
        AppProperties.Dispatch dispatch = appProperties.getDispatch();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(dispatch.getWorkerPoolSize());
        executor.setMaxPoolSize(dispatch.getWorkerPoolSize());
        executor.setQueueCapacity(dispatch.getWorkerQueueCapacity());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("dispatch-");
        executor.setTaskDecorator(mdcTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    // Carries the submitting thread's MDC (correlation id) onto the worker.
    private static TaskDecorator mdcTaskDecorator() {
        return runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                if (context == null) {
                    MDC.clear();
                } else {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    if (previous == null) {
                        MDC.clear();
                    } else {
                        MDC.setContextMap(previous);
                    }
                }
            };
        };
    }

    @Bean(destroyMethod = "dispose")
    public Scheduler jdbcScheduler() {
        // Fixed-size pool of platform threads for blocking JDBC calls made from WebFlux handlers.
        int parallelism = 10;
        return Schedulers.newParallel("jdbc-io-", parallelism);
    }
}
