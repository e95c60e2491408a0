package com.sandy.fleet.health.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class EngineConfig {

    /** Every "now" in the engine comes from this clock so tests can pin time. */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder, AlertProperties alertProperties) {
        AlertProperties.Delivery d = alertProperties.getDelivery();
        log.info("Webhook RestTemplate timeouts connect={}ms read={}ms", d.getConnectTimeoutMs(), d.getReadTimeoutMs());
        return builder
                .setConnectTimeout(Duration.ofMillis(d.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(d.getReadTimeoutMs()))
                .build();
    }
}
