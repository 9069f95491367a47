package com.fastalert.core.rule;

import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.value.AlertValue;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 规则条件: 属性 + 比较符 + 期望值
 * 属性取值顺序: 内置字段(severity/source/tag/message/count/state/...) → 告警元数据 → RuleContext
 * 属性不存在时条件不成立
 */
public final class RuleCondition {

    private final String property;
    private final ConditionOperator operator;
    private final AlertValue expected;
    private final Pattern regex;

    private RuleCondition(String property, ConditionOperator operator, AlertValue expected) {
        AlertConfigurationException.check(property != null && !property.isBlank(), "condition property must not be blank");
        AlertConfigurationException.check(operator != null, "condition operator must not be null");
        AlertConfigurationException.check(expected != null, "condition value must not be null");
        this.property = property.trim();
        this.operator = operator;
        this.expected = expected;
        this.regex = operator == ConditionOperator.MATCHES ? compile(expected.asString()) : null;
    }

    public static RuleCondition of(String property, ConditionOperator operator, AlertValue expected) {
        return new RuleCondition(property, operator, expected);
    }

    public static RuleCondition of(String property, ConditionOperator operator, String expected) {
        return new RuleCondition(property, operator, AlertValue.parse(expected));
    }

    public static RuleCondition of(String property, ConditionOperator operator, double expected) {
        return new RuleCondition(property, operator, AlertValue.of(expected));
    }

    public boolean test(AlertValue actual) {
        return operator.test(actual, expected, regex);
    }

    private static Pattern compile(String expr) {
        try {
            return Pattern.compile(expr, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new AlertConfigurationException("invalid MATCHES pattern: " + expr);
        }
    }

    public String getProperty() {
        return property;
    }

    public ConditionOperator getOperator() {
        return operator;
    }

    public AlertValue getExpected() {
        return expected;
    }

    @Override
    public String toString() {
        return property + " " + operator + " " + expected;
    }
}
