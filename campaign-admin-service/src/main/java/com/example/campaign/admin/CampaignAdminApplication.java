package com.example.campaign.admin;

import com.example.campaign.shared.config.CorrelationIdFilter;
import io.micrometer.context.ContextRegistry;
import org.slf4j.MDC;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import reactor.core.publisher.Hooks;

/**
 * Campaign dispatch and scheduling engine.
 *
 * Resolves campaign audiences, assigns A/B variants, records one dispatch item per
 * recipient and pushes one send job per new item onto the dispatch queue. Deferred and
 * recurring campaigns are launched by a polling scheduler.
 */
@SpringBootApplication(scanBasePackages = "com.example.campaign")
public class CampaignAdminApplication {

    static {
        // Carry the correlation id from the Reactor context into the MDC of jdbc-io threads.
        ContextRegistry.getInstance().registerThreadLocalAccessor(
                CorrelationIdFilter.CORRELATION_ID_KEY,
                () -> MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY),
                value -> MDC.put(CorrelationIdFilter.CORRELATION_ID_KEY, value),
                () -> MDC.remove(CorrelationIdFilter.CORRELATION_ID_KEY));
        Hooks.enableAutomaticContextPropagation();
    }

    public static void main(String[] args) {
        SpringApplication.run(CampaignAdminApplication.class, args);
    }
}
