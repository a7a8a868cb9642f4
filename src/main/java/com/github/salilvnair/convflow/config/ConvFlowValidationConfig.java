package com.github.salilvnair.convflow.config;

import com.github.salilvnair.convflow.engine.validation.ValidationCategory;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "convflow.validation")
@Getter
@Setter
public class ConvFlowValidationConfig {

    private boolean strictMode = true;
    private boolean allowWarningsToBlock = false;
    private boolean enableCaching = true;
    private Duration cacheExpiration = Duration.ofMinutes(5);
    private int maxCachedReports = 5000;
    private Set<ValidationCategory> enabledCategories = EnumSet.allOf(ValidationCategory.class);
    private AntiLoop antiLoop = new AntiLoop();
    private RateLimit rateLimit = new RateLimit();

    @Getter
    @Setter
    public static class AntiLoop {
        private int window = 5;
        private int threshold = 2;
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int maxNavigations = 30;
        private Duration window = Duration.ofMinutes(1);
    }
}
