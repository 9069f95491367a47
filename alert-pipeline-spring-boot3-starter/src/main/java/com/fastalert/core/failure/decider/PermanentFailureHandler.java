package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.exception.guard.ChannelPermanentFailureException;
import com.fastalert.model.ctx.DeliveryContext;

/**
 * 渠道声明不可重试
 */
public class PermanentFailureHandler implements FailureCaseHandler<ChannelPermanentFailureException> {
    @Override
    public Class<ChannelPermanentFailureException> exceptionType() {
        return ChannelPermanentFailureException.class;
    }

    @Override
    public FailureDecider.Decision execute(ChannelPermanentFailureException ex, DeliveryContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.GIVE_UP, FailureDecider.Category.PERMANENT)
                .withCode("PERMANENT");
    }
}
