package com.fastalert.core.failure;

import com.fastalert.core.failure.decider.BulkheadFullHandler;
import com.fastalert.core.failure.decider.InterruptedHandler;
import com.fastalert.core.failure.decider.PermanentFailureHandler;
import com.fastalert.core.failure.decider.RateLimitedHandler;
import com.fastalert.core.failure.decider.SendFailedHandler;
import com.fastalert.core.failure.decider.TimeoutHandler;
import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.model.ctx.DeliveryContext;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

public class RouterFailureDecider implements FailureDecider {

    private final List<FailureCaseHandler<?>> handlers;

    /** 未匹配时的默认决策 */
    private final Decision defaultDecision;

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers) {
        this(handlers, Decision.of(Outcome.RETRY, Category.UNKNOWN).withCode("UNHANDLED"));
    }

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers, Decision defaultDecision) {
        this.handlers = handlers.stream().distinct().collect(Collectors.toList());
        this.defaultDecision = defaultDecision;
    }

    /**
     * 内置处理器 + 外部扩展, 外部处理器与内置同类型时按距离择优
     */
    public static RouterFailureDecider withDefaults(List<FailureCaseHandler<?>> extra) {
        List<FailureCaseHandler<?>> all = new ArrayList<>();
        if (extra != null) {
            all.addAll(extra);
        }
        all.add(new TimeoutHandler());
        all.add(new BulkheadFullHandler());
        all.add(new RateLimitedHandler());
        all.add(new PermanentFailureHandler());
        all.add(new InterruptedHandler());
        all.add(new SendFailedHandler());
        return new RouterFailureDecider(all);
    }

    /**
     * 同类型匹配时选择离异常类最近的处理器
     */
    @Override
    public Decision decide(Throwable t, DeliveryContext ctx) {
        // 展开 cause 链 先本体, 再逐级cause
        for (Throwable e = t; e != null; e = e.getCause()) {
            FailureCaseHandler<?> matched = findBestHandler(e);
            if (matched != null) {
                return safeCall(matched, e, ctx);
            }
            if (e.getCause() == e) {
                break;
            }
        }
        return defaultDecision;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Decision safeCall(FailureCaseHandler h, Throwable e, DeliveryContext ctx) {
        return h.execute(e, ctx);
    }

    private FailureCaseHandler<?> findBestHandler(Throwable e) {
        // 过滤 supports 再按继承层级深度排序, 同距离时先注册者优先
        return handlers.stream()
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        // 计算from向上继承到to的距离
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }
}
