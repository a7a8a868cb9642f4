package com.github.salilvnair.convflow.engine.navigation.action;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class ActionHandlerFactory {

    private final Map<String, ActionHandler> handlers = new HashMap<>();

    public ActionHandlerFactory(List<ActionHandler> handlers) {
        for (ActionHandler handler : handlers) {
            this.handlers.put(handler.type().toUpperCase(), handler);
            handler.aliases().forEach(alias -> this.handlers.putIfAbsent(alias.toUpperCase(), handler));
        }
    }

    public Optional<ActionHandler> get(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(type.toUpperCase()));
    }
}
