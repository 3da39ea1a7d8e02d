package com.example.campaign.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
public class AppProperties {

    private final Scheduler scheduler = new Scheduler();
    private final Completion completion = new Completion();
    private final Dispatch dispatch = new Dispatch();
    private final Queue queue = new Queue();
    private final Kafka kafka = new Kafka();

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        @Positive
        private long intervalMs = 60000L;
        @Positive
        private int batchLimit = 100;
    }

    @Data
    public static class Completion {
        @Positive
        private long intervalMs = 30000L;
        @Positive
        private long staleAfterMs = 3600000L;
        @Positive
        private int batchLimit = 100;
    }

    @Data
    public static class Dispatch {
        @Positive
        private int workerPoolSize = 8;
        @Positive
        private int workerQueueCapacity = 1000;
        @NotBlank
        private String defaultLanguage = "fr";
    }

    @Data
    public static class Queue {
        @NotBlank
        private String type = "redis"; // redis or kafka
        @NotBlank
        private String name = "marketing_queue";
        @Positive
        private long publishTimeoutMs = 5000L;
    }

    @Data
    public static class Kafka {
        private final Topic topic = new Topic();

        @Data
        public static class Topic {
            @NotBlank
            private String name = "campaign-dispatch";
            @Positive
            private int partitions = 3;
            @Positive
            private short replicationFactor = 1;
        }
    }
}
