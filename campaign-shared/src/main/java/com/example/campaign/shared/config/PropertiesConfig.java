package com.example.campaign.shared.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;

import java.time.Clock;

@Configuration
@EnableJdbcRepositories(basePackages = "com.example.campaign.shared.repository")
public class PropertiesConfig {

    @Bean
    @ConfigurationProperties(prefix = "campaign")
    public AppProperties appProperties() {
        return new AppProperties();
    }

    /**
     * Single source of "now" for scheduling decisions. Always UTC.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
