package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.exception.guard.ChannelRateLimitedException;
import com.fastalert.model.ctx.DeliveryContext;

/**
 * 渠道限流拒绝
 */
public class RateLimitedHandler implements FailureCaseHandler<ChannelRateLimitedException> {
    @Override
    public Class<ChannelRateLimitedException> exceptionType() {
        return ChannelRateLimitedException.class;
    }

    @Override
    public FailureDecider.Decision execute(ChannelRateLimitedException ex, DeliveryContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.RATE_LIMITED)
                .factor(2.0).withCode("RATE_LIMIT");
    }
}
