package com.fastalert.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Locale;

/**
 * 告警级别, 按声明顺序由低到高
 */
@AllArgsConstructor
@Getter
public enum AlertSeverity {
    LOW(0, "低"),
    MEDIUM(1, "中"),
    HIGH(2, "高"),
    WARNING(3, "警告"),
    CRITICAL(4, "严重");

    public final int level;
    public final String desc;

    public boolean isAtLeast(AlertSeverity other) {
        return this.level >= other.level;
    }

    public AlertSeverity max(AlertSeverity other) {
        return other == null || this.level >= other.level ? this : other;
    }

    /** 配置中大小写均可 */
    public static AlertSeverity from(String v) {
        return AlertSeverity.valueOf(v.trim().toUpperCase(Locale.ROOT));
    }
}
