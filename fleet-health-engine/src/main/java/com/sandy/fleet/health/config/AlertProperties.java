package com.sandy.fleet.health.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "fleet.alert")
public class AlertProperties {

    private Delivery delivery = new Delivery();

    /** Max tasks handled by one dispatcher pass. */
    private int dispatchBatchSize = 50;

    /** Window used by dashboard trend stats. */
    private int trendDays = 7;

    @Data
    public static class Delivery {
        private boolean enabled = true;
        private int maxAttempts = 5;
        /** First retry delay; doubled on each further failure. */
        private long initialBackoffMs = 30_000;
        private long maxBackoffMs = 3_600_000;
        /** HTTP timeouts for webhook delivery. */
        private int connectTimeoutMs = 5_000;
        private int readTimeoutMs = 10_000;
    }
}
