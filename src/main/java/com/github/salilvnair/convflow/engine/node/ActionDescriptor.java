package com.github.salilvnair.convflow.engine.node;

import java.util.Map;

public record ActionDescriptor(String type, Map<String, Object> config) {

    public ActionDescriptor {
        config = config == null ? Map.of() : config;
    }

    public Object configValue(String key) {
        return config.get(key);
    }
}
