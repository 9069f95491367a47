package com.fastalert.model.value;

import com.fastalert.model.enums.AlertSeverity;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * 规则参数/元数据的类型化取值: string | number | bool | enum
 */
public final class AlertValue implements Comparable<AlertValue> {

    public enum Kind { STRING, NUMBER, BOOL, ENUM }

    private final Kind kind;
    private final String text;
    private final double number;
    private final boolean bool;
    /** ENUM 时记录枚举类型, 用于同类型比较 */
    private final Class<? extends Enum<?>> enumType;
    private final int ordinal;

    private AlertValue(Kind kind, String text, double number, boolean bool,
                       Class<? extends Enum<?>> enumType, int ordinal) {
        this.kind = kind;
        this.text = text;
        this.number = number;
        this.bool = bool;
        this.enumType = enumType;
        this.ordinal = ordinal;
    }

    public static AlertValue of(String s) {
        return new AlertValue(Kind.STRING, Objects.requireNonNull(s, "value"), 0, false, null, -1);
    }

    public static AlertValue of(double n) {
        return new AlertValue(Kind.NUMBER, null, n, false, null, -1);
    }

    public static AlertValue of(boolean b) {
        return new AlertValue(Kind.BOOL, null, 0, b, null, -1);
    }

    @SuppressWarnings("unchecked")
    public static AlertValue of(Enum<?> e) {
        Objects.requireNonNull(e, "value");
        return new AlertValue(Kind.ENUM, e.name(), 0, false,
                (Class<? extends Enum<?>>) e.getDeclaringClass(), e.ordinal());
    }

    /**
     * 配置文本解析: true/false → BOOL, 数字 → NUMBER, 其余 STRING
     */
    public static AlertValue parse(String raw) {
        String s = Objects.requireNonNull(raw, "raw").trim();
        if ("true".equalsIgnoreCase(s) || "false".equalsIgnoreCase(s)) {
            return of(Boolean.parseBoolean(s));
        }
        try {
            return of(new BigDecimal(s).doubleValue());
        } catch (NumberFormatException e) {
            return of(s);
        }
    }

    public Kind getKind() { return kind; }

    public boolean isNumber() { return kind == Kind.NUMBER; }

    public String asString() {
        return switch (kind) {
            case STRING, ENUM -> text;
            case NUMBER -> number == Math.rint(number) && !Double.isInfinite(number)
                    ? Long.toString((long) number) : Double.toString(number);
            case BOOL -> Boolean.toString(bool);
        };
    }

    public double asNumber() {
        return switch (kind) {
            case NUMBER -> number;
            case BOOL -> bool ? 1 : 0;
            case ENUM -> ordinal;
            case STRING -> {
                try {
                    yield Double.parseDouble(text.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalStateException("not a number: " + text, e);
                }
            }
        };
    }

    public boolean asBool() {
        return switch (kind) {
            case BOOL -> bool;
            case NUMBER -> number != 0;
            case STRING, ENUM -> Boolean.parseBoolean(text);
        };
    }

    public AlertSeverity asSeverity() {
        return AlertSeverity.from(asString());
    }

    /**
     * 数值可比较: NUMBER 之间, 同类型 ENUM 之间(按声明顺序), 以及可解析为数字的 STRING
     */
    public boolean isComparableWith(AlertValue other) {
        if (kind == Kind.ENUM && other.kind == Kind.ENUM) {
            return Objects.equals(enumType, other.enumType);
        }
        if (kind == Kind.ENUM || other.kind == Kind.ENUM) {
            // 枚举与字符串比较时按名称解析
            return enumType == AlertSeverity.class || other.enumType == AlertSeverity.class;
        }
        return numeric(this) && numeric(other);
    }

    @Override
    public int compareTo(AlertValue other) {
        if (kind == Kind.ENUM || other.kind == Kind.ENUM) {
            return Integer.compare(severityOrdinal(this), severityOrdinal(other));
        }
        return Double.compare(asNumber(), other.asNumber());
    }

    /** 字符串与枚举名称比较忽略大小写 */
    public boolean sameAs(AlertValue other) {
        if (other == null) {
            return false;
        }
        if (kind == Kind.NUMBER || other.kind == Kind.NUMBER) {
            return numeric(this) && numeric(other) && Double.compare(asNumber(), other.asNumber()) == 0;
        }
        if (kind == Kind.BOOL || other.kind == Kind.BOOL) {
            return asString().equalsIgnoreCase(other.asString());
        }
        return asString().toLowerCase(Locale.ROOT).equals(other.asString().toLowerCase(Locale.ROOT));
    }

    private static boolean numeric(AlertValue v) {
        if (v.kind == Kind.NUMBER) {
            return true;
        }
        if (v.kind != Kind.STRING) {
            return false;
        }
        try {
            Double.parseDouble(v.text.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static int severityOrdinal(AlertValue v) {
        if (v.kind == Kind.ENUM) {
            return v.ordinal;
        }
        return v.asSeverity().ordinal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AlertValue that = (AlertValue) o;
        return kind == that.kind
                && Double.compare(number, that.number) == 0
                && bool == that.bool
                && ordinal == that.ordinal
                && Objects.equals(text, that.text)
                && Objects.equals(enumType, that.enumType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, number, bool, enumType, ordinal);
    }

    @Override
    public String toString() {
        return asString();
    }
}
