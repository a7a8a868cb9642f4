package com.github.salilvnair.convflow.engine.navigation;

import com.github.salilvnair.convflow.engine.session.NavigationType;
import lombok.Builder;
import lombok.Getter;

import java.util.Set;

/**
 * Per-call overrides; {@code null} fields fall back to {@code convflow.navigation.*}.
 */
@Getter
@Builder(toBuilder = true)
public class NavigationOptions {

    private final Boolean validate;
    private final Boolean strictValidation;
    private final Boolean preserveContext;
    private final boolean rollbackOnError;
    @Builder.Default
    private final NavigationType navigationType = NavigationType.FORWARD;
    private final Set<String> ruleIds;
    private final String requestId;
    private final String userText;

    public static NavigationOptions defaults() {
        return NavigationOptions.builder().build();
    }
}
