package com.github.salilvnair.convflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "convflow.navigation")
@Getter
@Setter
public class ConvFlowNavigationConfig {

    private boolean validate = true;
    private boolean strictValidation = false;
    private boolean preserveContext = true;
    private int maxHistory = 100;
    private int maxConditionDepth = 10;
    private int defaultMaxRetries = 3;
    private UnresolvedPlaceholder unresolvedPlaceholder = UnresolvedPlaceholder.EMPTY;
    private String fallbackMessage = "I couldn't process that right now. Please try again.";
    private String repromptMessage = "Please choose one of the available options.";

    public enum UnresolvedPlaceholder {
        EMPTY,
        VERBATIM
    }
}
