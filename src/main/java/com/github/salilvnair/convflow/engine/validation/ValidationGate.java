package com.github.salilvnair.convflow.engine.validation;

import com.github.salilvnair.convflow.config.ConvFlowValidationConfig;
import com.github.salilvnair.convflow.engine.session.ConversationSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of {@link ValidationRule}s vetting every proposed transition.
 */
@Slf4j
@Component
public class ValidationGate {

    private final ConvFlowValidationConfig config;
    private final Clock clock;
    private final Map<String, ValidationRule> rules = new ConcurrentHashMap<>();
    private final Map<String, CachedReport> reportCache = new ConcurrentHashMap<>();

    public ValidationGate(List<ValidationRule> ruleBeans, ConvFlowValidationConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        if (ruleBeans != null) {
            ruleBeans.forEach(this::register);
        }
        log.info("Validation gate initialized with rules={}", rules.keySet());
    }

    public void register(ValidationRule rule) {
        ValidationRule previous = rules.put(rule.id(), rule);
        if (previous != null && previous != rule) {
            log.warn("Validation rule replaced id={} previous={} current={}",
                    rule.id(), previous.getClass().getSimpleName(), rule.getClass().getSimpleName());
        }
        reportCache.clear();
    }

    public boolean unregister(String ruleId) {
        boolean removed = rules.remove(ruleId) != null;
        if (removed) {
            reportCache.clear();
        }
        return removed;
    }

    public Optional<ValidationRule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    public Collection<ValidationRule> getRules() {
        return List.copyOf(rules.values());
    }

    public void clearCache() {
        reportCache.clear();
    }

    public ValidationReport validate(ValidationContext context) {
        return validate(context, null, config.isStrictMode());
    }

    public ValidationReport validate(ValidationContext context, Set<String> ruleIds) {
        return validate(context, ruleIds, config.isStrictMode());
    }

    /**
     * Runs the selected rules, highest priority first.
     *
     * @param ruleIds explicit subset; {@code null} or empty runs every rule of an enabled category
     * @param strict  whether a failing blocking rule halts evaluation and vetoes the transition
     */
    public ValidationReport validate(ValidationContext context, Set<String> ruleIds, boolean strict) {
        Instant now = context.getEvaluatedAt() != null ? context.getEvaluatedAt() : clock.instant();
        String cacheKey = config.isEnableCaching() ? cacheKey(context, ruleIds, strict) : null;
        if (cacheKey != null) {
            CachedReport cached = reportCache.get(cacheKey);
            if (cached != null && now.isBefore(cached.expiresAt())) {
                return cached.report().toBuilder().fromCache(true).build();
            }
        }

        List<ValidationRule> selected = selectRules(ruleIds);
        List<RuleVerdict> verdicts = new ArrayList<>();
        for (ValidationRule rule : selected) {
            RuleVerdict verdict;
            try {
                verdict = rule.validate(context);
                if (verdict == null) {
                    verdict = RuleVerdict.pass(rule.id(), rule.name());
                }
            }
            catch (RuntimeException e) {
                log.error("Validation rule failed ruleId={} sessionId={}: {}",
                        rule.id(), sessionId(context), e.getMessage(), e);
                verdict = new RuleVerdict(rule.id(), false, ValidationSeverity.ERROR, false,
                        "Error executing validation: " + rule.name(), null, Map.of("error", String.valueOf(e.getMessage())));
            }
            verdicts.add(verdict);
            if (rule.blocking() && !verdict.canProceed() && strict) {
                log.warn("Validation halted by blocking rule ruleId={} sessionId={} target={}",
                        rule.id(), sessionId(context), context.getTargetNodeId());
                break;
            }
        }

        ValidationReport report = buildReport(verdicts, selected.size(), strict, now);
        if (cacheKey != null) {
            if (reportCache.size() >= config.getMaxCachedReports()) {
                purgeExpired(now);
            }
            reportCache.put(cacheKey, new CachedReport(report, now.plus(config.getCacheExpiration())));
        }
        return report;
    }

    private ValidationReport buildReport(List<RuleVerdict> verdicts, int rulesExecuted, boolean strict, Instant now) {
        boolean hasErrors = verdicts.stream().anyMatch(RuleVerdict::isError);
        boolean hasWarnings = verdicts.stream().anyMatch(RuleVerdict::isWarning);
        boolean valid = !hasErrors && (!config.isAllowWarningsToBlock() || !hasWarnings);
        boolean canProceed = verdicts.stream().allMatch(RuleVerdict::canProceed) || (!strict && !hasErrors);
        ValidationSeverity overall = hasErrors
                ? ValidationSeverity.ERROR
                : (hasWarnings ? ValidationSeverity.WARNING : ValidationSeverity.INFO);
        return ValidationReport.builder()
                .valid(valid)
                .canProceed(canProceed)
                .overallSeverity(overall)
                .verdicts(verdicts)
                .rulesExecuted(rulesExecuted)
                .recommendations(recommendations(verdicts))
                .evaluatedAt(now)
                .fromCache(false)
                .build();
    }

    private List<ValidationRule> selectRules(Set<String> ruleIds) {
        List<ValidationRule> selected = new ArrayList<>();
        if (ruleIds != null && !ruleIds.isEmpty()) {
            for (String ruleId : ruleIds) {
                ValidationRule rule = rules.get(ruleId);
                if (rule == null) {
                    log.warn("Unknown validation rule requested ruleId={}", ruleId);
                    continue;
                }
                selected.add(rule);
            }
        }
        else {
            Set<ValidationCategory> enabled = config.getEnabledCategories();
            rules.values().stream()
                    .filter(rule -> enabled == null || enabled.contains(rule.category()))
                    .forEach(selected::add);
        }
        selected.sort(Comparator.comparingInt((ValidationRule rule) -> rule.priority().weight()).reversed()
                .thenComparing(ValidationRule::id));
        return selected;
    }

    private List<String> recommendations(List<RuleVerdict> verdicts) {
        Set<String> unique = new LinkedHashSet<>();
        for (RuleVerdict verdict : verdicts) {
            if (verdict.suggestedAction() != null && !verdict.suggestedAction().isBlank()) {
                unique.add(verdict.suggestedAction());
            }
        }
        long errors = verdicts.stream().filter(RuleVerdict::isError).count();
        if (errors > 0) {
            unique.add("Resolve " + errors + " critical validation error(s) before continuing");
        }
        return new ArrayList<>(unique);
    }

    private String cacheKey(ValidationContext context, Set<String> ruleIds, boolean strict) {
        ConversationSession session = context.getSession();
        if (session == null) {
            return null;
        }
        int historySize = session.getHistory() == null ? 0 : session.getHistory().size();
        String subset = ruleIds == null || ruleIds.isEmpty() ? "*" : String.join(",", new TreeSet<>(ruleIds));
        return String.join("|",
                String.valueOf(session.getSessionId()),
                String.valueOf(session.getUserId()),
                String.valueOf(session.getTenantId()),
                String.valueOf(context.getFromNodeId()),
                String.valueOf(context.getTargetNodeId()),
                String.valueOf(session.getTemplateId()),
                String.valueOf(historySize),
                subset,
                String.valueOf(strict));
    }

    private void purgeExpired(Instant now) {
        reportCache.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().expiresAt()));
        if (reportCache.size() >= config.getMaxCachedReports()) {
            reportCache.clear();
        }
    }

    private String sessionId(ValidationContext context) {
        return context.getSession() == null ? null : context.getSession().getSessionId();
    }

    public int cachedReportCount() {
        return reportCache.size();
    }

    private record CachedReport(ValidationReport report, Instant expiresAt) {
    }
}
