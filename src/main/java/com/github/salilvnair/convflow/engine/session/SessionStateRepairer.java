package com.github.salilvnair.convflow.engine.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lenient repair pass run on every session load. Keeps the waiting flags and the
 * current node coherent after partial writes or older snapshot formats.
 */
@Slf4j
@Component
public class SessionStateRepairer {

    /**
     * @return {@code true} when the session was modified
     */
    public boolean repair(ConversationSession session) {
        if (session == null) {
            return false;
        }
        boolean changed = false;
        String waitingNodeId = blankToNull(session.getWaitingNodeId());
        if (waitingNodeId != null) {
            if (!session.isWaitingForInput()) {
                session.setWaitingForInput(true);
                changed = true;
            }
            if (!waitingNodeId.equals(session.getCurrentNodeId())) {
                session.setCurrentNodeId(waitingNodeId);
                changed = true;
            }
            if (session.getState() != NavigationState.AWAITING_INPUT) {
                session.setState(NavigationState.AWAITING_INPUT);
                changed = true;
            }
        }
        else if (session.isWaitingForInput()) {
            String currentNodeId = blankToNull(session.getCurrentNodeId());
            if (currentNodeId != null) {
                session.setWaitingNodeId(currentNodeId);
            }
            else {
                session.setWaitingForInput(false);
            }
            changed = true;
        }
        if (session.getState() == null) {
            session.setState(session.isWaitingForInput() ? NavigationState.AWAITING_INPUT : NavigationState.IDLE);
            changed = true;
        }
        if (session.getPriority() == null) {
            session.setPriority(SessionPriority.NORMAL);
            changed = true;
        }
        if (changed) {
            log.debug("Repaired session state sessionId={} currentNodeId={} waitingNodeId={}",
                    session.getSessionId(), session.getCurrentNodeId(), session.getWaitingNodeId());
        }
        return changed;
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
