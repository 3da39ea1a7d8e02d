package com.example.campaign.shared.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Metrics for the campaign dispatch engine.
 */
@Configuration
@EnableAspectJAutoProxy
public class MonitoringConfig {

    public static final String JOBS_PUBLISHED = "campaign.dispatch.jobs.published";
    public static final String JOBS_FAILED = "campaign.dispatch.jobs.failed";
    public static final String CAMPAIGNS_LAUNCHED = "campaign.launches";
    public static final String CAMPAIGNS_COMPLETED = "campaign.completions";
    public static final String RECIPIENTS_SKIPPED = "campaign.dispatch.recipients.skipped";

    @Bean
    public MeterBinder campaignMetrics() {
        return registry -> {
            registry.counter(JOBS_PUBLISHED, "queue", "dispatch");
            registry.counter(JOBS_FAILED, "queue", "dispatch");
            registry.counter(CAMPAIGNS_LAUNCHED, "trigger", "INTERACTIVE", "status", "success");
            registry.counter(CAMPAIGNS_LAUNCHED, "trigger", "SCHEDULER", "status", "success");
            registry.counter(CAMPAIGNS_COMPLETED);

            Timer.builder("campaign.launch.latency")
                  .description("Time taken to fan a campaign out to its audience")
                  .register(registry);
        };
    }

    @Bean
    public CampaignMetricsCollector campaignMetricsCollector(MeterRegistry registry) {
        return new CampaignMetricsCollector(registry);
    }

    /**
     * Caches meters by name and tags so hot paths do not look them up in the registry.
     */
    public static class CampaignMetricsCollector {
        private final MeterRegistry registry;
        private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();

        public CampaignMetricsCollector(MeterRegistry registry) {
            this.registry = registry;
        }

        public void incrementCounter(String name, String... tags) {
            incrementCounter(name, 1, tags);
        }

        public void incrementCounter(String name, double amount, String... tags) {
            String key = name + "_" + String.join("_", tags);
            counters.computeIfAbsent(key, k -> registry.counter(name, tags)).increment(amount);
        }

        public void recordTimer(String name, long durationMs, String... tags) {
            String key = name + "_" + String.join("_", tags);
            timers.computeIfAbsent(key, k -> Timer.builder(name).tags(tags).register(registry))
                  .record(durationMs, TimeUnit.MILLISECONDS);
        }

        public double getCounterValue(String name, String... tags) {
            String key = name + "_" + String.join("_", tags);
            Counter counter = counters.get(key);
            return counter != null ? counter.count() : 0;
        }
    }
}
