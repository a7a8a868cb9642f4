package com.github.salilvnair.convflow.engine.navigation.action;

import com.github.salilvnair.convflow.config.ConvFlowNavigationConfig;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowException;
import com.github.salilvnair.convflow.engine.navigation.ContextUpdates;
import com.github.salilvnair.convflow.engine.navigation.VariableInterpolator;
import com.github.salilvnair.convflow.engine.node.ActionDescriptor;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.github.salilvnair.convflow.support.TestConstants.NAME_JUAN;
import static com.github.salilvnair.convflow.support.TestConstants.PLAN_PRO;
import static com.github.salilvnair.convflow.support.TestConstants.STAGE_QUALIFIED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionHandlersTest {

    private ActionHandlerFactory factory;
    private ConversationSession session;

    @BeforeEach
    void setUp() {
        VariableInterpolator interpolator =
                new VariableInterpolator(new ConvFlowNavigationConfig(), MutableClock.startingAt("2026-01-15T10:00:00Z"));
        factory = new ActionHandlerFactory(List.of(
                new SetVariableActionHandler(interpolator),
                new ClearVariableActionHandler(),
                new UpdateStageActionHandler()));
        session = ConversationSession.builder().build();
        session.getCollectedData().put("name", NAME_JUAN);
    }

    @Test
    void factoryResolvesTypesAndAliasesCaseInsensitively() {
        assertInstanceOf(SetVariableActionHandler.class, factory.get("SET_VARIABLE").orElseThrow());
        assertInstanceOf(UpdateStageActionHandler.class, factory.get("update_stage").orElseThrow());
        assertInstanceOf(UpdateStageActionHandler.class, factory.get("Update_Lead").orElseThrow());
        assertTrue(factory.get("send_email").isEmpty());
        assertTrue(factory.get(null).isEmpty());
    }

    @Test
    void aliasNeverShadowsPrimaryType() {
        ActionHandler custom = new ActionHandler() {
            @Override
            public String type() {
                return "custom";
            }

            @Override
            public Set<String> aliases() {
                return Set.of("set_variable");
            }

            @Override
            public ContextUpdates execute(ActionDescriptor action, ConversationSession session) {
                return ContextUpdates.empty();
            }
        };
        ActionHandlerFactory withCustom = new ActionHandlerFactory(List.of(
                new SetVariableActionHandler(new VariableInterpolator(new ConvFlowNavigationConfig(),
                        MutableClock.startingAt("2026-01-15T10:00:00Z"))),
                custom));

        assertInstanceOf(SetVariableActionHandler.class, withCustom.get("set_variable").orElseThrow());
    }

    @Test
    void setVariableInterpolatesIntoGlobalsByDefault() {
        ContextUpdates updates = execute("set_variable", Map.of("key", "greeting", "value", "Hi {{name}}"));

        assertEquals("Hi Juan", updates.getGlobalVars().get("greeting"));
        assertTrue(updates.getCollectedData().isEmpty());
    }

    @Test
    void setVariableWritesCollectedScope() {
        ContextUpdates updates = execute("set_variable", Map.of("key", "plan", "value", PLAN_PRO, "scope", "collected"));

        assertEquals(PLAN_PRO, updates.getCollectedData().get("plan"));
    }

    @Test
    void setVariableRequiresKey() {
        ConversationFlowException error = assertThrows(ConversationFlowException.class,
                () -> execute("set_variable", Map.of("value", "x")));

        assertEquals(ConversationFlowErrorCode.ACTION_FAILED, error.getCode());
    }

    @Test
    void clearVariableRemovesKeys() {
        ContextUpdates updates = execute("clear_variable", Map.of("keys", List.of("name", "plan"), "key", "email"));

        assertEquals(Set.of("name", "plan", "email"), updates.getRemovedVariables());
        updates.applyTo(session);
        assertFalse(session.getCollectedData().containsKey("name"));
    }

    @Test
    void updateStageTracksPreviousStage() {
        ContextUpdates first = execute("update_stage", Map.of("stageId", "contacted"));
        assertEquals("contacted", first.getGlobalVars().get(UpdateStageActionHandler.STAGE_VARIABLE));
        assertFalse(first.getGlobalVars().containsKey(UpdateStageActionHandler.PREVIOUS_STAGE_VARIABLE));
        first.applyTo(session);

        ContextUpdates second = execute("update_lead", Map.of("stage", STAGE_QUALIFIED));

        assertEquals(STAGE_QUALIFIED, second.getGlobalVars().get(UpdateStageActionHandler.STAGE_VARIABLE));
        assertEquals("contacted", second.getGlobalVars().get(UpdateStageActionHandler.PREVIOUS_STAGE_VARIABLE));
    }

    @Test
    void updateStageRequiresStage() {
        assertThrows(ConversationFlowException.class, () -> execute("update_stage", Map.of()));
    }

    private ContextUpdates execute(String type, Map<String, Object> config) {
        return factory.get(type).orElseThrow().execute(new ActionDescriptor(type, config), session);
    }
}
