package com.github.salilvnair.convflow.engine.session;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NavigationStep {

    private String stepId;
    private String fromNodeId;
    private String toNodeId;
    private NavigationType navigationType;
    private Instant timestamp;
    private boolean success;
    private String errorCode;
    private String error;
    private ContextSnapshot contextSnapshot;
}
