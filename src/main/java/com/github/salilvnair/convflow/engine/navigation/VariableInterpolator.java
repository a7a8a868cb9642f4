package com.github.salilvnair.convflow.engine.navigation;

import com.github.salilvnair.convflow.config.ConvFlowNavigationConfig;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import com.github.salilvnair.convflow.util.JsonPathUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {{name}}} placeholders from session variables. Never throws; unresolved
 * placeholders render empty or verbatim depending on configuration.
 */
@Component
@RequiredArgsConstructor
public class VariableInterpolator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*}}");

    private final ConvFlowNavigationConfig config;
    private final Clock clock;

    public String interpolate(String template, ConversationSession session) {
        if (template == null || template.isEmpty() || template.indexOf("{{") < 0) {
            return template == null ? "" : template;
        }
        Map<String, Object> collected = session.getCollectedData();
        Map<String, Object> globals = session.getGlobalVars();

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            Object value = resolve(name, session, collected, globals);
            String replacement;
            if (value != null) {
                replacement = format(value);
            }
            else if (config.getUnresolvedPlaceholder() == ConvFlowNavigationConfig.UnresolvedPlaceholder.VERBATIM) {
                replacement = matcher.group(0);
            }
            else {
                replacement = "";
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private Object resolve(String name, ConversationSession session, Map<String, Object> collected, Map<String, Object> globals) {
        if (collected != null && collected.get(name) != null) {
            return collected.get(name);
        }
        if (globals != null && globals.get(name) != null) {
            return globals.get(name);
        }
        if (name.indexOf('.') > 0) {
            Object nested = JsonPathUtil.readDotted(collected, name);
            if (nested == null) {
                nested = JsonPathUtil.readDotted(globals, name);
            }
            if (nested != null) {
                return nested;
            }
        }
        // flow variables shadow built-ins
        switch (name) {
            case "now":
                return clock.instant().toString();
            case "date":
                return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).toString();
            case "userId":
                return session.getUserId();
            case "tenantId":
                return session.getTenantId();
            case "sessionId":
                return session.getSessionId();
            default:
                return null;
        }
    }

    private String format(Object value) {
        if (value instanceof Double number && number == Math.rint(number) && !Double.isInfinite(number)) {
            return String.valueOf(number.longValue());
        }
        return String.valueOf(value);
    }
}
