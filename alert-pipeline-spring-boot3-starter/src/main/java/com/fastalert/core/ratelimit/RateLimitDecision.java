package com.fastalert.core.ratelimit;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 限流判定结果
 */
@Getter
@AllArgsConstructor
public final class RateLimitDecision {

    private final boolean allowed;

    /** 判定之后的桶状态 */
    private final RateLimitBucket.Snapshot bucket;
}
