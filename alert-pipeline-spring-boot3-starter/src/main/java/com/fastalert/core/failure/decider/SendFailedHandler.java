package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.exception.guard.ChannelSendFailedException;
import com.fastalert.model.ctx.DeliveryContext;

/**
 * 渠道返回失败结果
 */
public class SendFailedHandler implements FailureCaseHandler<ChannelSendFailedException> {
    @Override
    public Class<ChannelSendFailedException> exceptionType() {
        return ChannelSendFailedException.class;
    }

    @Override
    public FailureDecider.Decision execute(ChannelSendFailedException ex, DeliveryContext ctx) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.CHANNEL_ERROR)
                .withCode("SEND_FAILED");
    }
}
