package com.fastalert.core.rule;

import com.fastalert.model.value.AlertValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 条件比较符, 字符串类比较忽略大小写
 */
public enum ConditionOperator {
    EQUALS,
    NOT_EQUALS,
    CONTAINS,
    STARTS_WITH,
    ENDS_WITH,
    MATCHES,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL;

    public boolean isOrdering() {
        return this == GREATER_THAN || this == GREATER_THAN_OR_EQUAL || this == LESS_THAN || this == LESS_THAN_OR_EQUAL;
    }

    /**
     * @param regex 仅 MATCHES 使用, 预编译
     */
    boolean test(AlertValue actual, AlertValue expected, Pattern regex) {
        if (actual == null) {
            return false;
        }
        return switch (this) {
            case EQUALS -> actual.sameAs(expected);
            case NOT_EQUALS -> !actual.sameAs(expected);
            case CONTAINS -> lower(actual).contains(lower(expected));
            case STARTS_WITH -> lower(actual).startsWith(lower(expected));
            case ENDS_WITH -> lower(actual).endsWith(lower(expected));
            case MATCHES -> regex.matcher(actual.asString()).find();
            case GREATER_THAN -> actual.isComparableWith(expected) && actual.compareTo(expected) > 0;
            case GREATER_THAN_OR_EQUAL -> actual.isComparableWith(expected) && actual.compareTo(expected) >= 0;
            case LESS_THAN -> actual.isComparableWith(expected) && actual.compareTo(expected) < 0;
            case LESS_THAN_OR_EQUAL -> actual.isComparableWith(expected) && actual.compareTo(expected) <= 0;
        };
    }

    private static String lower(AlertValue v) {
        return v.asString().toLowerCase(Locale.ROOT);
    }
}
