package com.fastalert.core.suppress;

import com.fastalert.core.spi.suppress.EscalationPolicy;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.Alert;
import com.fastalert.model.enums.AlertSeverity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 基于指纹 + 时间窗的重复告警抑制
 * 指纹 = source + tag + 归一化 message, 窗口从首次出现开始计算
 */
public class DuplicateSuppressor {

    private static final Logger log = LoggerFactory.getLogger(DuplicateSuppressor.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    private final Duration window;

    private volatile EscalationPolicy escalationPolicy;

    public DuplicateSuppressor(Duration window) {
        this(window, EscalationPolicy.NONE);
    }

    public DuplicateSuppressor(Duration window, EscalationPolicy escalationPolicy) {
        AlertConfigurationException.check(window != null && !window.isNegative() && !window.isZero(),
                "duplicate window must be > 0");
        this.window = window;
        this.escalationPolicy = escalationPolicy == null ? EscalationPolicy.NONE : escalationPolicy;
    }

    /**
     * 判定并登记本次出现, 窗口内的重复只累计次数
     */
    public DuplicateCheck check(Alert alert, Instant now) {
        String fp = fingerprint(alert);
        DuplicateCheck[] out = new DuplicateCheck[1];
        entries.compute(fp, (k, e) -> {
            if (e == null || e.isExpired(now, window)) {
                out[0] = new DuplicateCheck(false, alert.getId(), 1, null);
                return new Entry(alert.getId(), alert.getSeverity(), now);
            }
            e.occurrences++;
            e.lastSeen = now;
            AlertSeverity next = escalate(alert, e);
            if (next != null) {
                e.severity = next;
                out[0] = new DuplicateCheck(false, e.primaryId, e.occurrences, next);
            } else {
                out[0] = new DuplicateCheck(true, e.primaryId, e.occurrences, null);
            }
            return e;
        });
        DuplicateCheck r = out[0];
        if (r.isEscalated()) {
            log.info("[Duplicate] fingerprint escalated, primary={}, occurrences={}, severity={}",
                    r.getPrimaryId(), r.getOccurrences(), r.getEscalatedSeverity());
        }
        return r;
    }

    private AlertSeverity escalate(Alert duplicate, Entry e) {
        AlertSeverity proposed;
        try {
            proposed = escalationPolicy.escalate(duplicate, e.severity, e.occurrences);
        } catch (RuntimeException ex) {
            log.warn("[Duplicate] escalation policy failed, keep severity {}", e.severity, ex);
            return null;
        }
        return proposed != null && proposed.level > e.severity.level ? proposed : null;
    }

    /**
     * 清理过期条目, 返回清理数量
     */
    public int sweep(Instant now) {
        int before = entries.size();
        entries.entrySet().removeIf(en -> en.getValue().isExpired(now, window));
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public void setEscalationPolicy(EscalationPolicy escalationPolicy) {
        this.escalationPolicy = escalationPolicy == null ? EscalationPolicy.NONE : escalationPolicy;
    }

    public Duration getWindow() {
        return window;
    }

    public static String fingerprint(Alert alert) {
        return alert.getSource() + '|' + alert.getTag() + '|' + normalize(alert.getMessage());
    }

    static String normalize(String message) {
        return WHITESPACE.matcher(message.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * 只在 compute 内修改, 由 ConcurrentHashMap 的桶锁保护
     */
    private static final class Entry {
        private final UUID primaryId;
        private final Instant firstSeen;
        private AlertSeverity severity;
        private Instant lastSeen;
        private int occurrences;

        Entry(UUID primaryId, AlertSeverity severity, Instant now) {
            this.primaryId = Objects.requireNonNull(primaryId);
            this.severity = severity;
            this.firstSeen = now;
            this.lastSeen = now;
            this.occurrences = 1;
        }

        boolean isExpired(Instant now, Duration window) {
            return !now.isBefore(firstSeen.plus(window));
        }
    }
}
