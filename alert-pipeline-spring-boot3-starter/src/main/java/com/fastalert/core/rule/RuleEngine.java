package com.fastalert.core.rule;

import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.exception.AlertEvaluationException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.RuleContext;
import com.fastalert.model.value.AlertValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 规则引擎
 * 启用的规则按 priority 升序执行(相同优先级按注册顺序), 命中后依次应用动作, SUPPRESS 立即返回 null
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private static final Comparator<Entry> ORDER =
            Comparator.comparingInt((Entry e) -> e.rule.getPriority()).thenComparingLong(e -> e.seq);

    private final AtomicLong seq = new AtomicLong();

    private final Object lock = new Object();

    private volatile List<Entry> entries = List.of();

    /**
     * @return 处理后的告警, 被抑制返回 null
     */
    public Alert apply(Alert alert, RuleContext ctx) {
        return evaluate(alert, ctx).getAlert();
    }

    public RuleEvaluation evaluate(Alert alert, RuleContext ctx) {
        Objects.requireNonNull(alert, "alert");
        RuleContext c = ctx == null ? RuleContext.of(Instant.now()) : ctx;
        Instant now = c.getEvaluatedAt() == null ? Instant.now() : c.getEvaluatedAt();

        Alert current = alert;
        List<String> matched = new ArrayList<>();
        for (Entry e : entries) {
            if (!e.enabled) {
                continue;
            }
            AlertRule rule = e.rule;
            // 规则内动作出错时回退到该规则执行前的告警
            Alert beforeRule = current;
            try {
                e.stats.recordEvaluation(now);
                if (!matches(e, current, c, now)) {
                    continue;
                }
                e.stats.recordMatch(now);
                matched.add(rule.getId());
                for (RuleAction action : rule.getActions()) {
                    Alert next = action.apply(current);
                    e.stats.recordApplied();
                    if (next == null) {
                        e.stats.recordSuppressed();
                        e.consecutiveErrors.set(0);
                        log.debug("[Rule-Engine] alert={} suppressed by rule={}", alert.getId(), rule.getName());
                        return new RuleEvaluation(null, rule.getId(), matched);
                    }
                    current = next;
                }
                e.consecutiveErrors.set(0);
            } catch (RuntimeException ex) {
                current = beforeRule;
                e.stats.recordError();
                if (onError(e, new AlertEvaluationException("rule:" + rule.getName(), ex))) {
                    return new RuleEvaluation(null, rule.getId(), matched);
                }
            }
        }
        return new RuleEvaluation(current, null, matched);
    }

    /**
     * @return true 表示按规则配置抑制该告警
     */
    private boolean onError(Entry e, AlertEvaluationException err) {
        AlertRule rule = e.rule;
        int n = e.consecutiveErrors.incrementAndGet();
        boolean suppress = false;
        switch (rule.getErrorHandlingMode()) {
            case ALLOW_ON_ERROR -> log.debug("[Rule-Engine] rule={} error, skipped: {}", rule.getName(), err.getMessage());
            case LOG_AND_CONTINUE -> log.warn("[Rule-Engine] rule={} error, continue", rule.getName(), err.getCause());
            case SUPPRESS_ON_ERROR -> {
                log.warn("[Rule-Engine] rule={} error, alert suppressed: {}", rule.getName(), err.getMessage());
                suppress = true;
            }
            case DISABLE_ON_ERROR -> {
                e.enabled = false;
                log.error("[Rule-Engine] rule={} disabled on error", rule.getName(), err.getCause());
            }
        }
        if (e.enabled && n >= rule.getMaxConsecutiveErrors()) {
            e.enabled = false;
            log.error("[Rule-Engine] rule={} auto disabled after {} consecutive errors", rule.getName(), n);
        }
        return suppress;
    }

    private boolean matches(Entry e, Alert alert, RuleContext ctx, Instant now) {
        AlertRule rule = e.rule;
        if (rule.getSeverity() != null && rule.getSeverity() != alert.getSeverity()) {
            return false;
        }
        if (rule.getSourcePattern() != null && !rule.getSourcePattern().matches(alert.getSource())) {
            return false;
        }
        if (rule.getTagPattern() != null && !rule.getTagPattern().matches(alert.getTag())) {
            return false;
        }
        if (rule.getMessagePattern() != null && !rule.getMessagePattern().matches(alert.getMessage())) {
            return false;
        }
        for (RuleCondition cond : rule.getConditions()) {
            if (!cond.test(resolve(cond.getProperty(), alert, ctx))) {
                return false;
            }
        }
        if (rule.getThreshold() != null) {
            AlertValue actual = resolve(rule.getThresholdProperty(), alert, ctx);
            if (!RuleCondition.of(rule.getThresholdProperty(), rule.getThresholdOperator(), rule.getThreshold()).test(actual)) {
                return false;
            }
        }
        if (rule.getType() == RuleType.RATE_LIMIT) {
            // 窗口计数放在最后, 只统计满足其余条件的告警
            return e.windowExceeded(alert.getSource(), now);
        }
        return true;
    }

    /**
     * 内置字段 → 元数据 → 上下文
     */
    static AlertValue resolve(String property, Alert alert, RuleContext ctx) {
        AlertValue builtin = switch (property.toLowerCase(Locale.ROOT)) {
            case "severity" -> AlertValue.of(alert.getSeverity());
            case "source" -> AlertValue.of(alert.getSource());
            case "tag" -> AlertValue.of(alert.getTag());
            case "message" -> AlertValue.of(alert.getMessage());
            case "count" -> AlertValue.of(alert.getCount());
            case "state" -> AlertValue.of(alert.getState());
            case "id" -> AlertValue.of(alert.getId().toString());
            case "correlationid" -> alert.getCorrelationId() == null ? null : AlertValue.of(alert.getCorrelationId());
            case "operationid" -> alert.getOperationId() == null ? null : AlertValue.of(alert.getOperationId());
            default -> null;
        };
        if (builtin != null) {
            return builtin;
        }
        AlertValue meta = alert.getMetadata().get(property);
        if (meta != null) {
            return meta;
        }
        return ctx == null ? null : ctx.property(property);
    }

    /* ========== 管理 ========== */

    public void addRule(AlertRule rule) {
        Objects.requireNonNull(rule, "rule");
        synchronized (lock) {
            for (Entry e : entries) {
                AlertConfigurationException.check(!e.rule.getId().equals(rule.getId()), "rule already registered: " + rule.getId());
            }
            List<Entry> next = new ArrayList<>(entries);
            next.add(new Entry(rule, seq.incrementAndGet()));
            next.sort(ORDER);
            entries = List.copyOf(next);
        }
        log.info("[Rule-Engine] added rule={}, type={}, priority={}", rule.getName(), rule.getType(), rule.getPriority());
    }

    public boolean removeRule(String ruleId) {
        synchronized (lock) {
            List<Entry> next = new ArrayList<>(entries);
            boolean removed = next.removeIf(e -> e.rule.getId().equals(ruleId));
            if (removed) {
                entries = List.copyOf(next);
            }
            return removed;
        }
    }

    public boolean enable(String ruleId) {
        Entry e = find(ruleId);
        if (e == null) {
            return false;
        }
        e.consecutiveErrors.set(0);
        e.enabled = true;
        return true;
    }

    public boolean disable(String ruleId) {
        Entry e = find(ruleId);
        if (e == null) {
            return false;
        }
        e.enabled = false;
        return true;
    }

    public boolean isEnabled(String ruleId) {
        Entry e = find(ruleId);
        return e != null && e.enabled;
    }

    public Optional<AlertRuleStatistics.Snapshot> getStatistics(String ruleId) {
        Entry e = find(ruleId);
        return e == null ? Optional.empty() : Optional.of(e.stats.snapshot());
    }

    public Map<String, AlertRuleStatistics.Snapshot> getAllStatistics() {
        Map<String, AlertRuleStatistics.Snapshot> out = new LinkedHashMap<>();
        for (Entry e : entries) {
            out.put(e.rule.getId(), e.stats.snapshot());
        }
        return out;
    }

    public void resetStatistics() {
        for (Entry e : entries) {
            e.stats.reset();
        }
    }

    /**
     * 按执行顺序返回规则
     */
    public List<AlertRule> getRules() {
        List<AlertRule> out = new ArrayList<>();
        for (Entry e : entries) {
            out.add(e.rule);
        }
        return out;
    }

    /**
     * 清理过期的 RATE_LIMIT 窗口
     */
    public void sweep(Instant now) {
        for (Entry e : entries) {
            e.windows.entrySet().removeIf(w -> w.getValue().isExpired(now, e.rule));
        }
    }

    private Entry find(String ruleId) {
        for (Entry e : entries) {
            if (e.rule.getId().equals(ruleId)) {
                return e;
            }
        }
        return null;
    }

    private static final class Entry {
        private final AlertRule rule;
        private final long seq;
        private final AlertRuleStatistics stats;
        private final AtomicInteger consecutiveErrors = new AtomicInteger();
        /** RATE_LIMIT 规则的 source 计数窗口 */
        private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();
        private volatile boolean enabled;

        Entry(AlertRule rule, long seq) {
            this.rule = rule;
            this.seq = seq;
            this.enabled = rule.isEnabled();
            this.stats = new AlertRuleStatistics(rule.getId());
        }

        boolean windowExceeded(String source, Instant now) {
            int[] count = new int[1];
            windows.compute(source, (k, old) -> {
                Window cur = old == null || old.isExpired(now, rule) ? new Window(now) : old;
                count[0] = ++cur.count;
                return cur;
            });
            return count[0] > rule.getMaxOccurrences();
        }
    }

    private static final class Window {
        private final Instant start;
        private int count;

        Window(Instant start) {
            this.start = start;
        }

        boolean isExpired(Instant now, AlertRule rule) {
            return rule.getTimeWindow() != null && !now.isBefore(start.plus(rule.getTimeWindow()));
        }
    }
}
