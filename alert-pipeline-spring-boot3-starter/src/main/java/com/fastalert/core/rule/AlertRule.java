package com.fastalert.core.rule;

import com.fastalert.core.support.WildcardPattern;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.enums.AlertSeverity;
import com.fastalert.model.enums.ErrorHandlingMode;
import lombok.Getter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 告警规则定义, 构建时校验, 之后不可变
 * 启停状态与统计由 RuleEngine 维护
 */
@Getter
public final class AlertRule {

    private final String id;
    private final String name;
    private final RuleType type;
    private final boolean enabled;
    /** 数值越小越先执行 */
    private final int priority;
    private final AlertSeverity severity;
    private final WildcardPattern sourcePattern;
    private final WildcardPattern tagPattern;
    private final WildcardPattern messagePattern;
    private final Double threshold;
    private final ConditionOperator thresholdOperator;
    private final String thresholdProperty;
    private final Duration timeWindow;
    private final int maxOccurrences;
    private final List<RuleCondition> conditions;
    private final List<RuleAction> actions;
    private final ErrorHandlingMode errorHandlingMode;
    private final int maxConsecutiveErrors;

    private AlertRule(Builder b) {
        this.id = b.id == null ? UUID.randomUUID().toString() : b.id;
        this.name = b.name;
        this.type = b.type;
        this.enabled = b.enabled;
        this.priority = b.priority;
        this.severity = b.severity;
        this.sourcePattern = pattern(b.sourcePattern, b.caseSensitive);
        this.tagPattern = pattern(b.tagPattern, b.caseSensitive);
        this.messagePattern = pattern(b.messagePattern, b.caseSensitive);
        this.threshold = b.threshold;
        this.thresholdOperator = b.thresholdOperator;
        this.thresholdProperty = b.thresholdProperty;
        this.timeWindow = b.timeWindow;
        this.maxOccurrences = b.maxOccurrences;
        this.conditions = List.copyOf(b.conditions);
        List<RuleAction> acts = new ArrayList<>(b.actions);
        if (acts.isEmpty() && b.type.impliesSuppress()) {
            acts.add(RuleAction.suppress());
        }
        this.actions = List.copyOf(acts);
        this.errorHandlingMode = b.errorHandlingMode;
        this.maxConsecutiveErrors = b.maxConsecutiveErrors;
    }

    public static Builder builder(String name, RuleType type) {
        return new Builder(name, type);
    }

    private static WildcardPattern pattern(String expr, boolean caseSensitive) {
        return expr == null || expr.isBlank() ? null : WildcardPattern.of(expr.trim(), caseSensitive);
    }

    @Override
    public String toString() {
        return "AlertRule{id=" + id + ", name=" + name + ", type=" + type + ", priority=" + priority + "}";
    }

    public static final class Builder {
        private String id;
        private final String name;
        private final RuleType type;
        private boolean enabled = true;
        private int priority = 100;
        private AlertSeverity severity;
        private String sourcePattern;
        private String tagPattern;
        private String messagePattern;
        private boolean caseSensitive = false;
        private Double threshold;
        private ConditionOperator thresholdOperator = ConditionOperator.GREATER_THAN_OR_EQUAL;
        private String thresholdProperty = "count";
        private Duration timeWindow;
        private int maxOccurrences;
        private final List<RuleCondition> conditions = new ArrayList<>();
        private final List<RuleAction> actions = new ArrayList<>();
        private ErrorHandlingMode errorHandlingMode = ErrorHandlingMode.LOG_AND_CONTINUE;
        private int maxConsecutiveErrors = 5;

        private Builder(String name, RuleType type) {
            this.name = name;
            this.type = type;
        }

        public Builder id(String id) { this.id = id; return this; }
        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }
        public Builder priority(int priority) { this.priority = priority; return this; }
        public Builder severity(AlertSeverity severity) { this.severity = severity; return this; }
        public Builder source(String pattern) { this.sourcePattern = pattern; return this; }
        public Builder tag(String pattern) { this.tagPattern = pattern; return this; }
        public Builder message(String pattern) { this.messagePattern = pattern; return this; }
        public Builder caseSensitive(boolean caseSensitive) { this.caseSensitive = caseSensitive; return this; }
        public Builder threshold(double threshold, ConditionOperator operator) {
            this.threshold = threshold;
            this.thresholdOperator = operator;
            return this;
        }
        public Builder thresholdProperty(String property) { this.thresholdProperty = property; return this; }
        public Builder window(Duration timeWindow, int maxOccurrences) {
            this.timeWindow = timeWindow;
            this.maxOccurrences = maxOccurrences;
            return this;
        }
        public Builder condition(RuleCondition condition) { this.conditions.add(condition); return this; }
        public Builder action(RuleAction action) { this.actions.add(action); return this; }
        public Builder onError(ErrorHandlingMode mode, int maxConsecutiveErrors) {
            this.errorHandlingMode = mode;
            this.maxConsecutiveErrors = maxConsecutiveErrors;
            return this;
        }

        public AlertRule build() {
            AlertConfigurationException.check(name != null && !name.isBlank(), "rule name must not be blank");
            AlertConfigurationException.check(type != null, "rule type must not be null");
            AlertConfigurationException.check(id == null || !id.isBlank(), "rule id must not be blank");
            AlertConfigurationException.check(!conditions.contains(null), "rule [" + name + "] contains null condition");
            AlertConfigurationException.check(!actions.contains(null), "rule [" + name + "] contains null action");
            AlertConfigurationException.check(errorHandlingMode != null, "rule [" + name + "] errorHandlingMode must not be null");
            AlertConfigurationException.check(maxConsecutiveErrors >= 1, "rule [" + name + "] maxConsecutiveErrors must be >= 1");
            if (threshold != null) {
                AlertConfigurationException.check(threshold >= 0 && !threshold.isNaN(),
                        "rule [" + name + "] threshold must be >= 0");
                AlertConfigurationException.check(thresholdOperator != null && thresholdOperator.isOrdering(),
                        "rule [" + name + "] threshold operator must be an ordering comparator");
                AlertConfigurationException.check(thresholdProperty != null && !thresholdProperty.isBlank(),
                        "rule [" + name + "] threshold property must not be blank");
            }
            switch (type) {
                case RATE_LIMIT -> {
                    AlertConfigurationException.check(timeWindow != null && !timeWindow.isNegative() && !timeWindow.isZero(),
                            "rule [" + name + "] RATE_LIMIT requires a positive time window");
                    AlertConfigurationException.check(maxOccurrences >= 1,
                            "rule [" + name + "] RATE_LIMIT requires maxOccurrences >= 1");
                }
                case THRESHOLD -> AlertConfigurationException.check(threshold != null,
                        "rule [" + name + "] THRESHOLD requires a threshold");
                case TRANSFORMATION, ROUTING -> AlertConfigurationException.check(!actions.isEmpty(),
                        "rule [" + name + "] " + type + " requires at least one action");
                default -> { }
            }
            if (type == RuleType.ROUTING) {
                AlertConfigurationException.check(actions.stream().anyMatch(a -> a.getType() == RuleAction.Type.ROUTE),
                        "rule [" + name + "] ROUTING requires a ROUTE action");
            }
            return new AlertRule(this);
        }
    }
}
