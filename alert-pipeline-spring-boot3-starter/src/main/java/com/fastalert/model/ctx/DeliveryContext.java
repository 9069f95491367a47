package com.fastalert.model.ctx;

import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * 单次渠道投递尝试的上下文
 */
@Data
@Builder
public class DeliveryContext {

    private UUID alertId;
    private String channel;
    // 第几次尝试, 首次为 1
    private int attempt;
    private int maxRetries;
    private String err;
}
