package com.github.salilvnair.convflow.engine.navigation;

import com.github.salilvnair.convflow.engine.node.ConditionClause;
import com.github.salilvnair.convflow.engine.node.ConditionNode;
import com.github.salilvnair.convflow.engine.node.ConditionOperator;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.util.JsonPathUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Total evaluation of condition clauses: a malformed clause or missing variable is simply
 * {@code false}.
 */
@Slf4j
@Component
public class ConditionEvaluator {

    private static final String CONVERSATION_PREFIX = "conversation.";

    /**
     * Target of the first matching clause, else the node's default successor.
     */
    public Optional<String> resolveTarget(ConditionNode node, ConversationSession session) {
        for (ConditionClause clause : node.clauses()) {
            if (matches(clause, session) && clause.targetNodeId() != null) {
                return Optional.of(clause.targetNodeId());
            }
        }
        return Optional.ofNullable(node.nextNodeId());
    }

    public boolean matches(ConditionClause clause, ConversationSession session) {
        if (clause == null || clause.field() == null || clause.field().isBlank() || clause.operator() == null) {
            return false;
        }
        try {
            Object actual = lookup(clause.field().trim(), session);
            return evaluate(clause.operator(), actual, clause.value());
        }
        catch (RuntimeException e) {
            log.debug("Condition clause evaluated to false field={} operator={}: {}",
                    clause.field(), clause.operator(), e.getMessage());
            return false;
        }
    }

    Object lookup(String field, ConversationSession session) {
        Map<String, Object> collected = session.getCollectedData();
        if (collected != null && collected.containsKey(field)) {
            return collected.get(field);
        }
        Map<String, Object> globals = session.getGlobalVars();
        if (globals != null && globals.containsKey(field)) {
            return globals.get(field);
        }
        if (field.startsWith(CONVERSATION_PREFIX)) {
            return JsonPathUtil.readDotted(session, field.substring(CONVERSATION_PREFIX.length()));
        }
        if (field.indexOf('.') > 0) {
            Object nested = JsonPathUtil.readDotted(collected, field);
            return nested != null ? nested : JsonPathUtil.readDotted(globals, field);
        }
        return null;
    }

    private boolean evaluate(ConditionOperator operator, Object actual, Object expected) {
        return switch (operator) {
            case EQUALS -> equalsLoosely(actual, expected);
            case NOT_EQUALS -> !equalsLoosely(actual, expected);
            case GREATER_THAN -> compare(actual, expected) > 0;
            case LESS_THAN -> compare(actual, expected) < 0;
            case CONTAINS -> contains(actual, expected);
            case NOT_CONTAINS -> !contains(actual, expected);
            case EXISTS -> exists(actual);
            case NOT_EXISTS -> !exists(actual);
        };
    }

    private boolean equalsLoosely(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return actual == expected;
        }
        Double a = toNumber(actual);
        Double e = toNumber(expected);
        if (a != null && e != null) {
            return a.doubleValue() == e.doubleValue();
        }
        return Objects.equals(String.valueOf(actual), String.valueOf(expected));
    }

    /** Zero when either side is not numeric, so both {@code gt} and {@code lt} are false. */
    private int compare(Object actual, Object expected) {
        Double a = toNumber(actual);
        Double e = toNumber(expected);
        if (a == null || e == null) {
            return 0;
        }
        return Double.compare(a, e);
    }

    private boolean contains(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Collection<?> values) {
            return values.stream().anyMatch(value -> equalsLoosely(value, expected));
        }
        return String.valueOf(actual).toLowerCase(Locale.ROOT)
                .contains(String.valueOf(expected).toLowerCase(Locale.ROOT));
    }

    private boolean exists(Object actual) {
        if (actual == null) {
            return false;
        }
        if (actual instanceof String text) {
            return !text.isBlank();
        }
        return true;
    }

    private Double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            }
            catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
