package com.github.salilvnair.convflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "convflow.session")
@Getter
@Setter
public class ConvFlowSessionConfig {

    private boolean persistenceEnabled = true;
    private Duration fallbackTtl = Duration.ofMinutes(10);
    private String defaultTemplateId = "default";
}
