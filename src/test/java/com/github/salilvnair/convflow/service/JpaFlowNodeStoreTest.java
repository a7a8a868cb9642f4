package com.github.salilvnair.convflow.service;

import com.github.salilvnair.convflow.engine.node.FlowNode;
import com.github.salilvnair.convflow.engine.node.MessageNode;
import com.github.salilvnair.convflow.engine.node.NodeType;
import com.github.salilvnair.convflow.entity.CfFlowNode;
import com.github.salilvnair.convflow.repo.FlowNodeRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.github.salilvnair.convflow.support.TestConstants.NODE_ASK_NAME;
import static com.github.salilvnair.convflow.support.TestConstants.NODE_WELCOME;
import static com.github.salilvnair.convflow.support.TestConstants.TEMPLATE_ONBOARDING;
import static com.github.salilvnair.convflow.support.TestConstants.TENANT_ACME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaFlowNodeStoreTest {

    private static final String WELCOME_JSON = """
            {"type":"message","nodeId":"welcome","tenantId":"tenant-acme","templateId":"onboarding",
             "text":"Welcome to Acme!","nextNodeId":"ask_name"}
            """;

    @Mock
    private FlowNodeRepository flowNodeRepository;

    @InjectMocks
    private JpaFlowNodeStore store;

    @Test
    void getNodeReadsTypedNodeFromJson() {
        when(flowNodeRepository.findByNodeIdAndEnabledTrue(NODE_WELCOME)).thenReturn(Optional.of(row(NODE_WELCOME, WELCOME_JSON)));

        FlowNode node = store.getNode(NODE_WELCOME).orElseThrow();

        MessageNode message = assertInstanceOf(MessageNode.class, node);
        assertEquals(NodeType.MESSAGE, message.nodeType());
        assertEquals(TENANT_ACME, message.tenantId());
        assertEquals(NODE_ASK_NAME, message.nextNodeId());
        assertEquals("Welcome to Acme!", message.text());
    }

    @Test
    void blankNodeIdSkipsRepository() {
        assertTrue(store.getNode(" ").isEmpty());
        verifyNoInteractions(flowNodeRepository);
    }

    @Test
    void getFlowSkipsUnreadableRows() {
        when(flowNodeRepository.findByTemplateIdAndEnabledTrueOrderByPriorityAsc(TEMPLATE_ONBOARDING))
                .thenReturn(List.of(row(NODE_WELCOME, WELCOME_JSON), row("broken", "{\"type\":\"teleport\"}")));

        List<FlowNode> flow = store.getFlow(TEMPLATE_ONBOARDING);

        assertEquals(1, flow.size());
        assertEquals(NODE_WELCOME, flow.get(0).nodeId());
    }

    private CfFlowNode row(String nodeId, String json) {
        return CfFlowNode.builder()
                .nodeId(nodeId)
                .tenantId(TENANT_ACME)
                .templateId(TEMPLATE_ONBOARDING)
                .nodeType("message")
                .nodeJson(json)
                .priority(1)
                .enabled(true)
                .build();
    }
}
