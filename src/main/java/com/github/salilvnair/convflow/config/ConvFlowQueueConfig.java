package com.github.salilvnair.convflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "convflow.queue")
@Getter
@Setter
public class ConvFlowQueueConfig {

    private int maxConcurrency = 5;
    private int maxQueueSize = 1000;
    private Duration processingTimeout = Duration.ofSeconds(30);
    private Duration retryDelay = Duration.ofSeconds(5);
    private int maxRetries = 3;
    private Duration dispatchInterval = Duration.ofMillis(100);
    private Duration cleanupCompletedAfter = Duration.ofMinutes(5);
    private Duration cleanupFailedAfter = Duration.ofMinutes(10);
    private boolean autoStart = true;
    private Duration responseTimeout = Duration.ofMinutes(2);
    private Health health = new Health();

    @Getter
    @Setter
    public static class Health {
        private double warningErrorRate = 0.1;
        private double criticalErrorRate = 0.3;
        private Duration warningWait = Duration.ofMinutes(5);
        private Duration criticalWait = Duration.ofMinutes(10);
    }
}
