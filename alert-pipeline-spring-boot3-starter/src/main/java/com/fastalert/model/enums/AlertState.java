package com.fastalert.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 告警状态
 * ACTIVE → ACKNOWLEDGED → RESOLVED, ACTIVE/ACKNOWLEDGED → SUPPRESSED
 */
@AllArgsConstructor
@Getter
public enum AlertState {
    ACTIVE(0, "活跃, 初始状态"),
    ACKNOWLEDGED(1, "已确认"),
    RESOLVED(2, "已解决, 终态"),
    SUPPRESSED(3, "已抑制, 终态");

    public final int code;
    public final String desc;

    public boolean isTerminal() {
        return this == RESOLVED || this == SUPPRESSED;
    }

    public boolean canTransitionTo(AlertState target) {
        return switch (this) {
            case ACTIVE -> target == ACKNOWLEDGED || target == RESOLVED || target == SUPPRESSED;
            case ACKNOWLEDGED -> target == RESOLVED || target == SUPPRESSED;
            case RESOLVED, SUPPRESSED -> false;
        };
    }
}
