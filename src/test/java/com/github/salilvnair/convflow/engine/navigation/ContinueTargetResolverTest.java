package com.github.salilvnair.convflow.engine.navigation;

import com.github.salilvnair.convflow.engine.node.ButtonNode;
import com.github.salilvnair.convflow.engine.node.ButtonOption;
import com.github.salilvnair.convflow.engine.node.InputNode;
import com.github.salilvnair.convflow.engine.node.InputValidationRule;
import com.github.salilvnair.convflow.engine.node.MessageNode;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.engine.store.InMemoryFlowNodeStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.convflow.support.TestConstants.NAME_JUAN;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_ASK_EMAIL;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_ASK_NAME;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_ASK_PLAN;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_BASIC;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_MISSING;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_PRO;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_ROUTE_PLAN;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_WELCOME;
import static com.github.salilvnair.convflow.support.TestConstants.PLAN_BASIC;
import static com.github.salilvnair.convflow.support.TestConstants.PLAN_PRO;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContinueTargetResolverTest {

    private ContinueTargetResolver resolver;
    private ConversationSession session;

    @BeforeEach
    void setUp() {
        InMemoryFlowNodeStore store = new InMemoryFlowNodeStore()
                .registerNode(MessageNode.builder().nodeId(NODE_WELCOME).text("Hi").nextNodeId(NODE_ASK_NAME).build())
                .registerNode(InputNode.builder()
                        .nodeId(NODE_ASK_NAME)
                        .prompt("Your name?")
                        .variableName("name")
                        .validation(List.of(
                                new InputValidationRule("required", null, "Name is required"),
                                new InputValidationRule("min_length", 2, null),
                                new InputValidationRule("pattern", "[", null)))
                        .nextNodeId(NODE_ASK_EMAIL)
                        .build())
                .registerNode(InputNode.builder()
                        .nodeId(NODE_ASK_EMAIL)
                        .validation(List.of(new InputValidationRule("email", null, null)))
                        .build())
                .registerNode(ButtonNode.builder()
                        .nodeId(NODE_ASK_PLAN)
                        .prompt("Pick a plan")
                        .options(List.of(
                                new ButtonOption("opt_basic", "Basic", PLAN_BASIC, NODE_BASIC),
                                new ButtonOption("opt_pro", "Pro", PLAN_PRO, null)))
                        .nextNodeId(NODE_ROUTE_PLAN)
                        .build());
        resolver = new ContinueTargetResolver(store);
        session = ConversationSession.builder().build();
    }

    @Test
    void continueSentinelIsCaseInsensitive() {
        assertTrue(ContinueTargetResolver.isContinue(null));
        assertTrue(ContinueTargetResolver.isContinue(" Continue "));
        assertFalse(ContinueTargetResolver.isContinue(NODE_PRO));
    }

    @Test
    void nonWaitingSessionFollowsDefaultSuccessor() {
        session.setCurrentNodeId(NODE_WELCOME);

        ContinueResolution resolution = resolver.resolve(session, null);

        assertEquals(NODE_ASK_NAME, resolution.targetNodeId());
        assertTrue(resolution.updates().isEmpty());
    }

    @Test
    void inputReplyIsStoredUnderVariableName() {
        waitOn(NODE_ASK_NAME);

        ContinueResolution resolution = resolver.resolve(session, "  Juan ");

        assertEquals(NODE_ASK_EMAIL, resolution.targetNodeId());
        assertEquals(NAME_JUAN, resolution.updates().getCollectedData().get("name"));
    }

    @Test
    void invalidInputReprompts() {
        waitOn(NODE_ASK_NAME);

        ContinueResolution empty = resolver.resolve(session, " ");
        assertTrue(empty.reprompt());
        assertEquals("Name is required", empty.repromptReason());

        ContinueResolution tooShort = resolver.resolve(session, "J");
        assertTrue(tooShort.reprompt());
        assertEquals("Invalid min_length value", tooShort.repromptReason());
        assertNull(tooShort.targetNodeId());
    }

    @Test
    void inputWithoutVariableNameUsesNodeId() {
        waitOn(NODE_ASK_EMAIL);

        assertTrue(resolver.resolve(session, "juan@").reprompt());
        ContinueResolution ok = resolver.resolve(session, "juan@acme.io");
        assertEquals("juan@acme.io", ok.updates().getCollectedData().get(NODE_ASK_EMAIL));
        assertNull(ok.targetNodeId());
    }

    @Test
    void optionMatchedByLabelIdOrIndex() {
        waitOn(NODE_ASK_PLAN);

        ContinueResolution byLabel = resolver.resolve(session, "pro");
        assertEquals(NODE_ROUTE_PLAN, byLabel.targetNodeId());
        assertEquals(PLAN_PRO, byLabel.updates().getCollectedData().get(NODE_ASK_PLAN));
        assertEquals(PLAN_PRO, byLabel.updates().getCollectedData().get(ContinueTargetResolver.SELECTED_OPTION));

        assertEquals(NODE_BASIC, resolver.resolve(session, "OPT_BASIC").targetNodeId());
        assertEquals(NODE_BASIC, resolver.resolve(session, "1").targetNodeId());
        assertTrue(resolver.resolve(session, "3").reprompt());
        assertTrue(resolver.resolve(session, "enterprise").reprompt());
    }

    @Test
    void activeOptionsOverrideNodeOptions() {
        waitOn(NODE_ASK_PLAN);
        session.setActiveOptions(List.of(new ButtonOption("only", "Only", "only", NODE_PRO)));

        assertEquals(NODE_PRO, resolver.resolve(session, "1").targetNodeId());
    }

    @Test
    void missingAnchorAdvancesNowhere() {
        session.setCurrentNodeId(NODE_MISSING);

        ContinueResolution resolution = resolver.resolve(session, "hi");

        assertNull(resolution.targetNodeId());
        assertFalse(resolution.reprompt());
    }

    private void waitOn(String nodeId) {
        session.setCurrentNodeId(nodeId);
        session.setWaitingNodeId(nodeId);
        session.setWaitingForInput(true);
    }
}
