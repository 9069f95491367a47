package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.exception.guard.ChannelBulkheadFullException;
import com.fastalert.model.ctx.DeliveryContext;

/**
 * 并发已满
 */
public class BulkheadFullHandler implements FailureCaseHandler<ChannelBulkheadFullException> {

    @Override
    public Class<ChannelBulkheadFullException> exceptionType() {
        return ChannelBulkheadFullException.class;
    }

    @Override
    public FailureDecider.Decision execute(ChannelBulkheadFullException ex, DeliveryContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.BULKHEAD_FULL)
                .factor(4.0)
                .withCode("BULKHEAD_FULL");
    }
}
