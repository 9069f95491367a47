package com.fastalert.core.support;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 通配符匹配: '*' 任意长度, '?' 单个字符, 默认忽略大小写
 * 不含通配符时按全等比较
 */
public final class WildcardPattern {

    private final String expression;
    private final boolean caseSensitive;
    private final Pattern regex;

    private WildcardPattern(String expression, boolean caseSensitive) {
        this.expression = Objects.requireNonNull(expression, "expression");
        this.caseSensitive = caseSensitive;
        this.regex = hasWildcard(expression) ? compile(expression, caseSensitive) : null;
    }

    public static WildcardPattern of(String expression) {
        return new WildcardPattern(expression, false);
    }

    public static WildcardPattern of(String expression, boolean caseSensitive) {
        return new WildcardPattern(expression, caseSensitive);
    }

    public boolean matches(String value) {
        if (value == null) {
            return false;
        }
        if (regex != null) {
            return regex.matcher(value).matches();
        }
        return caseSensitive ? expression.equals(value) : expression.equalsIgnoreCase(value);
    }

    public String getExpression() {
        return expression;
    }

    private static boolean hasWildcard(String s) {
        return s.indexOf('*') >= 0 || s.indexOf('?') >= 0;
    }

    private static Pattern compile(String expression, boolean caseSensitive) {
        StringBuilder sb = new StringBuilder(expression.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : expression.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    sb.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                sb.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            sb.append(Pattern.quote(literal.toString()));
        }
        int flags = caseSensitive ? Pattern.DOTALL : Pattern.DOTALL | Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        return Pattern.compile(sb.toString(), flags);
    }

    @Override
    public String toString() {
        return caseSensitive ? expression : expression.toLowerCase(Locale.ROOT);
    }
}
