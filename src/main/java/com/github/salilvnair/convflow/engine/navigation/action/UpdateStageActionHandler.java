package com.github.salilvnair.convflow.engine.navigation.action;

import com.github.salilvnair.convflow.engine.exception.ConversationFlowErrorCode;
import com.github.salilvnair.convflow.engine.exception.ConversationFlowException;
import com.github.salilvnair.convflow.engine.navigation.ContextUpdates;
import com.github.salilvnair.convflow.engine.node.ActionDescriptor;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Moves the lead to a funnel stage. The stage is recorded in the session's global
 * variables; syncing it to a CRM is left to listeners on the queue completion.
 */
@Slf4j
@Component
public class UpdateStageActionHandler implements ActionHandler {

    public static final String STAGE_VARIABLE = "leadStage";
    public static final String PREVIOUS_STAGE_VARIABLE = "previousLeadStage";

    @Override
    public String type() {
        return "update_stage";
    }

    @Override
    public Set<String> aliases() {
        return Set.of("update_lead");
    }

    @Override
    public ContextUpdates execute(ActionDescriptor action, ConversationSession session) {
        Object stage = action.configValue("stageId");
        if (stage == null) {
            stage = action.configValue("stage");
        }
        if (stage == null || String.valueOf(stage).isBlank()) {
            throw new ConversationFlowException(ConversationFlowErrorCode.ACTION_FAILED,
                    "update_stage requires a 'stageId'");
        }
        ContextUpdates updates = ContextUpdates.empty().global(STAGE_VARIABLE, String.valueOf(stage));
        Object current = session.getGlobalVars() == null ? null : session.getGlobalVars().get(STAGE_VARIABLE);
        if (current != null && !current.equals(stage)) {
            updates.global(PREVIOUS_STAGE_VARIABLE, current);
        }
        log.debug("Lead stage update sessionId={} from={} to={}", session.getSessionId(), current, stage);
        return updates;
    }
}
