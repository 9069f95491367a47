package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.model.ctx.DeliveryContext;

/**
 * 线程被中断(通常是停机), 不再重试
 */
public class InterruptedHandler implements FailureCaseHandler<InterruptedException> {
    @Override
    public Class<InterruptedException> exceptionType() {
        return InterruptedException.class;
    }

    @Override
    public FailureDecider.Decision execute(InterruptedException ex, DeliveryContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.GIVE_UP, FailureDecider.Category.INTERRUPTED)
                .withCode("INTERRUPTED");
    }
}
