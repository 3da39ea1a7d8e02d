package com.example.campaign.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Turns on the periodic sweeps unless {@code campaign.scheduler.enabled=false}.
 * Tests switch them off and call the sweeps directly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "campaign.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConditionalConfig {
}
