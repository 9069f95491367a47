package com.fastalert.model.ctx;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.time.Instant;
import java.util.Map;

/**
 * 过滤器评估上下文
 */
@Data
@Builder
public class FilterContext {

    private String correlationId;
    // 评估时刻, 采样/时间窗类过滤器以此为准
    private Instant evaluatedAt;
    private boolean emergencyMode;
    // 第几次重新评估, 首次为 0
    private int deferralCount;
    @Singular
    private Map<String, Object> attributes;

    public static FilterContext of(Instant now) {
        return FilterContext.builder().evaluatedAt(now).build();
    }
}
