package com.fastalert.core.failure;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.exception.guard.ChannelBulkheadFullException;
import com.fastalert.exception.guard.ChannelPermanentFailureException;
import com.fastalert.exception.guard.ChannelRateLimitedException;
import com.fastalert.exception.guard.ChannelSendFailedException;
import com.fastalert.model.ctx.DeliveryContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class RouterFailureDeciderTest {

    private static final DeliveryContext CTX = DeliveryContext.builder().channel("hook").attempt(1).maxRetries(2).build();

    private final RouterFailureDecider decider = RouterFailureDecider.withDefaults(null);

    @Test
    void builtInCategories() {
        FailureDecider.Decision timeout = decider.decide(new TimeoutException("slow"), CTX);
        assertThat(timeout.isRetry()).isTrue();
        assertThat(timeout.getCategory()).isEqualTo(FailureDecider.Category.TIMEOUT);
        assertThat(timeout.getBackoffFactor()).isEqualTo(1.5);

        FailureDecider.Decision full = decider.decide(new ChannelBulkheadFullException(new RuntimeException()), CTX);
        assertThat(full.getCategory()).isEqualTo(FailureDecider.Category.BULKHEAD_FULL);
        assertThat(full.getBackoffFactor()).isEqualTo(4.0);

        assertThat(decider.decide(new ChannelRateLimitedException("hook", null), CTX).getCategory())
                .isEqualTo(FailureDecider.Category.RATE_LIMITED);
        assertThat(decider.decide(new ChannelSendFailedException("hook", "503"), CTX).getCategory())
                .isEqualTo(FailureDecider.Category.CHANNEL_ERROR);
        assertThat(decider.decide(new InterruptedException(), CTX).isRetry()).isFalse();
    }

    @Test
    void permanentFailureGivesUpEvenWhenWrapped() {
        RuntimeException wrapped = new RuntimeException("outer", new ChannelPermanentFailureException("bad token"));

        FailureDecider.Decision d = decider.decide(wrapped, CTX);

        assertThat(d.isRetry()).isFalse();
        assertThat(d.getCategory()).isEqualTo(FailureDecider.Category.PERMANENT);
    }

    @Test
    void unknownErrorsAreRetriedByDefault() {
        FailureDecider.Decision d = decider.decide(new IllegalStateException("?"), CTX);

        assertThat(d.isRetry()).isTrue();
        assertThat(d.getCategory()).isEqualTo(FailureDecider.Category.UNKNOWN);
        assertThat(d.getCode()).isEqualTo("UNHANDLED");
    }

    @Test
    void closestHandlerWins() {
        RouterFailureDecider custom = RouterFailureDecider.withDefaults(List.of(
                handler(RuntimeException.class, FailureDecider.Outcome.RETRY),
                handler(IllegalArgumentException.class, FailureDecider.Outcome.GIVE_UP)));

        assertThat(custom.decide(new NumberFormatException("x"), CTX).isRetry()).isFalse();
        assertThat(custom.decide(new IllegalStateException("x"), CTX).isRetry()).isTrue();
        // 内置处理器距离为 0, 优先于 RuntimeException 处理器
        assertThat(custom.decide(new ChannelPermanentFailureException("x"), CTX).isRetry()).isFalse();
    }

    private static <E extends Throwable> FailureCaseHandler<E> handler(Class<E> type, FailureDecider.Outcome outcome) {
        return new FailureCaseHandler<>() {
            @Override
            public Class<E> exceptionType() {
                return type;
            }

            @Override
            public FailureDecider.Decision execute(E ex, DeliveryContext ctx) {
                return FailureDecider.Decision.of(outcome, FailureDecider.Category.UNKNOWN).withCode(type.getSimpleName());
            }
        };
    }
}
