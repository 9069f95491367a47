package com.fastalert.core.spi.failure;

import com.fastalert.model.ctx.DeliveryContext;
import lombok.Getter;

/**
 * 失败判定器 按异常类型给出决策
 */
public interface FailureDecider {

    /**
     * 根据异常做出决策
     */
    Decision decide(Throwable t, DeliveryContext ctx);

    @Getter
    final class Decision {
        private final Outcome outcome;
        private final Category category;
        private final double backoffFactor;
        private final String code;

        private Decision(Outcome o, Category c, double f, String code) {
            this.outcome = o; this.category = c; this.backoffFactor = f; this.code = code;
        }
        public static Decision of(Outcome o, Category c) { return new Decision(o, c, 1.0, null); }
        public Decision factor(double f) { return new Decision(outcome, category, f, code); }
        public Decision withCode(String code) { return new Decision(outcome, category, backoffFactor, code); }

        public boolean isRetry() { return outcome == Outcome.RETRY; }

        @Override
        public String toString() {
            return outcome + "/" + category + (code == null ? "" : "(" + code + ")");
        }
    }

    enum Outcome { RETRY, GIVE_UP }
    enum Category { TIMEOUT, BULKHEAD_FULL, RATE_LIMITED, CHANNEL_ERROR, PERMANENT, INTERRUPTED, UNKNOWN }
}
