package com.fastalert.core.rule;

import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.Alert;
import com.fastalert.model.enums.AlertSeverity;
import com.fastalert.model.value.AlertValue;

import java.util.Arrays;
import java.util.function.UnaryOperator;

/**
 * 规则动作, 按列表顺序应用; SUPPRESS 返回 null 并短路
 */
public final class RuleAction {

    public enum Type { SUPPRESS, MODIFY_SEVERITY, ADD_TAG, ROUTE, ADD_METADATA, TRANSFORM }

    private static final RuleAction SUPPRESS = new RuleAction(Type.SUPPRESS, null, null);

    private final Type type;
    private final String key;
    private final AlertValue value;
    /** 仅 TRANSFORM 使用 */
    private final UnaryOperator<Alert> transformer;

    private RuleAction(Type type, String key, AlertValue value) {
        this(type, key, value, null);
    }

    private RuleAction(Type type, String key, AlertValue value, UnaryOperator<Alert> transformer) {
        this.type = type;
        this.key = key;
        this.value = value;
        this.transformer = transformer;
    }

    public static RuleAction suppress() {
        return SUPPRESS;
    }

    public static RuleAction modifySeverity(AlertSeverity severity) {
        AlertConfigurationException.check(severity != null, "severity must not be null");
        return new RuleAction(Type.MODIFY_SEVERITY, null, AlertValue.of(severity));
    }

    public static RuleAction addTag(String tag) {
        AlertConfigurationException.check(tag != null && !tag.isBlank(), "tag must not be blank");
        return new RuleAction(Type.ADD_TAG, null, AlertValue.of(tag.trim()));
    }

    public static RuleAction route(String channel) {
        AlertConfigurationException.check(channel != null && !channel.isBlank(), "route channel must not be blank");
        return new RuleAction(Type.ROUTE, null, AlertValue.of(channel.trim()));
    }

    public static RuleAction addMetadata(String key, AlertValue value) {
        AlertConfigurationException.check(key != null && !key.isBlank(), "metadata key must not be blank");
        AlertConfigurationException.check(value != null, "metadata value must not be null");
        return new RuleAction(Type.ADD_METADATA, key, value);
    }

    /**
     * 自定义变换, 返回 null 等同于抑制
     */
    public static RuleAction transform(String name, UnaryOperator<Alert> transformer) {
        AlertConfigurationException.check(name != null && !name.isBlank(), "transform name must not be blank");
        AlertConfigurationException.check(transformer != null, "transformer must not be null");
        return new RuleAction(Type.TRANSFORM, name, null, transformer);
    }

    /**
     * @return 应用后的告警, SUPPRESS 返回 null
     */
    public Alert apply(Alert alert) {
        return switch (type) {
            case SUPPRESS -> null;
            case MODIFY_SEVERITY -> alert.withSeverity(value.asSeverity());
            case ADD_TAG -> alert.withTag(appendTag(alert.getTag(), value.asString()));
            case ROUTE -> alert.withRoute(value.asString());
            case ADD_METADATA -> alert.withMetadata(key, value);
            case TRANSFORM -> transformer.apply(alert);
        };
    }

    /**
     * tag 为逗号分隔列表, 已存在则不重复追加
     */
    static String appendTag(String existing, String tag) {
        if (existing == null || existing.isBlank()) {
            return tag;
        }
        boolean present = Arrays.stream(existing.split(","))
                .map(String::trim)
                .anyMatch(t -> t.equalsIgnoreCase(tag));
        return present ? existing : existing + "," + tag;
    }

    public Type getType() {
        return type;
    }

    public String getKey() {
        return key;
    }

    public AlertValue getValue() {
        return value;
    }

    @Override
    public String toString() {
        if (type == Type.TRANSFORM) {
            return type + "(" + key + ")";
        }
        return key == null ? type + (value == null ? "" : "(" + value + ")") : type + "(" + key + "=" + value + ")";
    }
}
