package com.fastalert.core.filter;

import com.fastalert.core.spi.filter.AlertFilter;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.exception.AlertEvaluationException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.FilterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 按优先级(降序)依次执行的过滤链
 * 首个 SUPPRESS 即短路(collectAllResults 时继续评估仅用于指标), MODIFY 替换后续评估对象, DEFER 停止评估
 */
public class FilterChain {

    private static final Logger log = LoggerFactory.getLogger(FilterChain.class);

    private static final Comparator<Slot> ORDER =
            Comparator.comparingInt((Slot s) -> s.priority).reversed().thenComparingLong(s -> s.seq);

    private final AtomicLong seq = new AtomicLong();

    private final Object lock = new Object();

    /** 只读快照, 修改时整体替换 */
    private volatile List<Slot> slots = List.of();

    private volatile boolean collectAllResults;

    public FilterChain() {
        this(false);
    }

    public FilterChain(boolean collectAllResults) {
        this.collectAllResults = collectAllResults;
    }

    /**
     * 执行过滤链, 评估异常按过滤器自身的 ErrorHandlingMode 处理, 不向外抛出
     */
    public FilterChainResult evaluate(Alert alert, FilterContext ctx) {
        Objects.requireNonNull(alert, "alert");
        FilterContext c = ctx == null ? FilterContext.of(Instant.now()) : ctx;
        Instant at = c.getEvaluatedAt() == null ? Instant.now() : c.getEvaluatedAt();

        Alert current = alert;
        boolean modified = false;
        FilterDecision terminal = null;
        String decidedBy = null;
        String reason = null;
        List<FilterChainResult.Application> apps = new ArrayList<>();

        for (Slot slot : slots) {
            if (!slot.enabled) {
                continue;
            }
            AlertFilter f = slot.filter;
            if (!canHandle(f, current)) {
                continue;
            }
            long start = System.nanoTime();
            FilterResult r;
            Throwable error = null;
            try {
                r = f.evaluate(current, c);
                if (r == null) {
                    r = FilterResult.allow();
                }
                slot.consecutiveErrors.set(0);
                slot.metrics.record(r.getDecision(), System.nanoTime() - start, at);
            } catch (RuntimeException ex) {
                error = new AlertEvaluationException(slot.name, ex);
                r = onError(slot, error);
                slot.metrics.recordError(r.getDecision(), System.nanoTime() - start, at);
            }
            apps.add(new FilterChainResult.Application(slot.name, r, System.nanoTime() - start, error));

            // 已被抑制, 其余过滤器只计指标
            if (terminal == FilterDecision.SUPPRESS) {
                continue;
            }
            switch (r.getDecision()) {
                case MODIFY -> {
                    current = r.getModifiedAlert();
                    modified = true;
                }
                case SUPPRESS -> {
                    terminal = FilterDecision.SUPPRESS;
                    decidedBy = slot.name;
                    reason = r.getReason();
                }
                case DEFER -> {
                    terminal = FilterDecision.DEFER;
                    decidedBy = slot.name;
                    reason = r.getReason();
                }
                case ALLOW -> { }
            }
            if (terminal == FilterDecision.DEFER || (terminal == FilterDecision.SUPPRESS && !collectAllResults)) {
                break;
            }
        }

        FilterDecision finalDecision = terminal != null ? terminal
                : (modified ? FilterDecision.MODIFY : FilterDecision.ALLOW);
        return new FilterChainResult(finalDecision, current, decidedBy, reason, apps);
    }

    private boolean canHandle(AlertFilter f, Alert alert) {
        try {
            return f.canHandle(alert);
        } catch (RuntimeException ex) {
            log.warn("[Filter-Chain] filter={} canHandle failed, skipped", f.name(), ex);
            return false;
        }
    }

    private FilterResult onError(Slot slot, Throwable error) {
        AlertFilter f = slot.filter;
        int n = slot.consecutiveErrors.incrementAndGet();
        FilterResult r = switch (f.errorHandlingMode()) {
            case ALLOW_ON_ERROR -> {
                log.debug("[Filter-Chain] filter={} error, allow through: {}", slot.name, error.getMessage());
                yield FilterResult.allow("allowed on error");
            }
            case SUPPRESS_ON_ERROR -> {
                log.warn("[Filter-Chain] filter={} error, suppress: {}", slot.name, error.getMessage());
                yield FilterResult.suppress("suppressed on error: " + error.getCause().getMessage());
            }
            case LOG_AND_CONTINUE -> {
                log.warn("[Filter-Chain] filter={} error, continue", slot.name, error.getCause());
                yield FilterResult.allow("error ignored");
            }
            case DISABLE_ON_ERROR -> {
                slot.enabled = false;
                log.error("[Filter-Chain] filter={} disabled on error", slot.name, error.getCause());
                yield FilterResult.allow("filter disabled on error");
            }
        };
        if (slot.enabled && n >= Math.max(1, f.maxConsecutiveErrors())) {
            slot.enabled = false;
            log.error("[Filter-Chain] filter={} auto disabled after {} consecutive errors", slot.name, n);
        }
        return r;
    }

    /* ========== 管理 ========== */

    public void register(AlertFilter filter) {
        Objects.requireNonNull(filter, "filter");
        String name = filter.name();
        AlertConfigurationException.check(name != null && !name.isBlank(), "filter name must not be blank");
        synchronized (lock) {
            AlertConfigurationException.check(find(name) == null, "filter already registered: " + name);
            List<Slot> next = new ArrayList<>(slots);
            next.add(new Slot(filter, filter.priority(), seq.incrementAndGet()));
            publish(next);
        }
        log.info("[Filter-Chain] registered filter={}, type={}, priority={}", name, filter.type(), filter.priority());
    }

    public boolean unregister(String name) {
        synchronized (lock) {
            List<Slot> next = new ArrayList<>(slots);
            boolean removed = next.removeIf(s -> s.name.equals(name));
            if (removed) {
                publish(next);
                log.info("[Filter-Chain] unregistered filter={}", name);
            }
            return removed;
        }
    }

    /**
     * 重新启用并清零连续错误计数
     */
    public boolean enable(String name) {
        Slot s = find(name);
        if (s == null) {
            return false;
        }
        s.consecutiveErrors.set(0);
        s.enabled = true;
        return true;
    }

    public boolean disable(String name) {
        Slot s = find(name);
        if (s == null) {
            return false;
        }
        s.enabled = false;
        return true;
    }

    public boolean isEnabled(String name) {
        Slot s = find(name);
        return s != null && s.enabled;
    }

    public boolean updatePriority(String name, int priority) {
        synchronized (lock) {
            Slot s = find(name);
            if (s == null) {
                return false;
            }
            s.priority = priority;
            publish(new ArrayList<>(slots));
            return true;
        }
    }

    public Optional<AlertFilterMetrics.Snapshot> getMetrics(String name) {
        Slot s = find(name);
        return s == null ? Optional.empty() : Optional.of(s.metrics.snapshot());
    }

    public Map<String, AlertFilterMetrics.Snapshot> getAllMetrics() {
        Map<String, AlertFilterMetrics.Snapshot> out = new LinkedHashMap<>();
        for (Slot s : slots) {
            out.put(s.name, s.metrics.snapshot());
        }
        return out;
    }

    public void resetMetrics() {
        for (Slot s : slots) {
            s.metrics.reset();
        }
    }

    /**
     * 当前执行顺序
     */
    public List<String> getFilterNames() {
        List<String> names = new ArrayList<>();
        for (Slot s : slots) {
            names.add(s.name);
        }
        return names;
    }

    public int size() {
        return slots.size();
    }

    public void setCollectAllResults(boolean collectAllResults) {
        this.collectAllResults = collectAllResults;
    }

    private Slot find(String name) {
        for (Slot s : slots) {
            if (s.name.equals(name)) {
                return s;
            }
        }
        return null;
    }

    private void publish(List<Slot> next) {
        next.sort(ORDER);
        slots = List.copyOf(next);
    }

    private static final class Slot {
        private final AlertFilter filter;
        private final String name;
        private final long seq;
        private final AlertFilterMetrics metrics;
        private final AtomicInteger consecutiveErrors = new AtomicInteger();
        private volatile int priority;
        private volatile boolean enabled = true;

        Slot(AlertFilter filter, int priority, long seq) {
            this.filter = filter;
            this.name = filter.name();
            this.priority = priority;
            this.seq = seq;
            this.metrics = new AlertFilterMetrics(name);
        }
    }
}
