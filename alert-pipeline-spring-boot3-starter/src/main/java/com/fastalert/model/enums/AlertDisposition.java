package com.fastalert.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 一条告警在管道中的最终去向
 */
@AllArgsConstructor
@Getter
public enum AlertDisposition {
    DELIVERED("至少一个渠道投递成功"),
    FAILED("所有尝试的渠道均失败或被熔断跳过"),
    UNDELIVERABLE("没有符合条件的渠道"),
    SUPPRESSED("被抑制"),
    DEFERRED("暂缓, 等待重新评估");

    public final String desc;
}
