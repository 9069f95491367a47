package com.fastalert.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 告警生命周期事件
 */
@AllArgsConstructor
@Getter
public enum AlertEventType {
    RAISED("通过过滤与规则, 进入投递"),
    ACKNOWLEDGED("已确认"),
    RESOLVED("已解决"),
    SUPPRESSED("被抑制");

    public final String desc;
}
