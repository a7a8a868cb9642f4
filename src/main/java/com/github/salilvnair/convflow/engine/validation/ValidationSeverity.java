package com.github.salilvnair.convflow.engine.validation;

public enum ValidationSeverity {
    INFO,
    WARNING,
    ERROR
}
