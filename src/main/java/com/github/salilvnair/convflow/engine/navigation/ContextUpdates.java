package com.github.salilvnair.convflow.engine.navigation;

import com.github.salilvnair.convflow.engine.session.ConversationSession;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Explicit delta produced by a transition, reported back to the caller and applied to
 * the session with {@link #applyTo(ConversationSession)}.
 */
@Getter
public class ContextUpdates {

    private final Map<String, Object> collectedData = new LinkedHashMap<>();
    private final Map<String, Object> globalVars = new LinkedHashMap<>();
    private final Set<String> removedVariables = new LinkedHashSet<>();

    public static ContextUpdates empty() {
        return new ContextUpdates();
    }

    public ContextUpdates collect(String name, Object value) {
        removedVariables.remove(name);
        collectedData.put(name, value);
        return this;
    }

    public ContextUpdates global(String name, Object value) {
        removedVariables.remove(name);
        globalVars.put(name, value);
        return this;
    }

    public ContextUpdates remove(String name) {
        collectedData.remove(name);
        globalVars.remove(name);
        removedVariables.add(name);
        return this;
    }

    /** Later writes win. */
    public ContextUpdates merge(ContextUpdates other) {
        if (other == null) {
            return this;
        }
        other.removedVariables.forEach(this::remove);
        other.collectedData.forEach(this::collect);
        other.globalVars.forEach(this::global);
        return this;
    }

    public boolean isEmpty() {
        return collectedData.isEmpty() && globalVars.isEmpty() && removedVariables.isEmpty();
    }

    public void applyTo(ConversationSession session) {
        if (session.getCollectedData() == null) {
            session.setCollectedData(new LinkedHashMap<>());
        }
        if (session.getGlobalVars() == null) {
            session.setGlobalVars(new LinkedHashMap<>());
        }
        for (String name : removedVariables) {
            session.getCollectedData().remove(name);
            session.getGlobalVars().remove(name);
        }
        session.getCollectedData().putAll(collectedData);
        session.getGlobalVars().putAll(globalVars);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (!collectedData.isEmpty()) {
            map.put("collectedData", new LinkedHashMap<>(collectedData));
        }
        if (!globalVars.isEmpty()) {
            map.put("globalVars", new LinkedHashMap<>(globalVars));
        }
        if (!removedVariables.isEmpty()) {
            map.put("removed", new LinkedHashSet<>(removedVariables));
        }
        return map;
    }
}
