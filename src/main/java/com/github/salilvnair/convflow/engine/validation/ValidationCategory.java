package com.github.salilvnair.convflow.engine.validation;

public enum ValidationCategory {
    STRUCTURE,
    SECURITY,
    DATA,
    CONTEXT,
    LEADS,
    BUSINESS_LOGIC,
    PERFORMANCE
}
