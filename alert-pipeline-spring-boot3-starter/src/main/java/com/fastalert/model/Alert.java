package com.fastalert.model;

import com.fastalert.model.enums.AlertSeverity;
import com.fastalert.model.enums.AlertState;
import com.fastalert.model.value.AlertValue;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * 告警记录, 不可变
 * 每次状态流转都返回新实例, 状态只前进, count 只增不减
 */
@Getter
public final class Alert {

    private final UUID id;
    private final String message;
    private final AlertSeverity severity;
    private final String source;
    private final String tag;
    private final Instant timestamp;
    private final String correlationId;
    private final String operationId;
    private final AlertState state;
    private final Instant acknowledgedAt;
    private final String acknowledgedBy;
    private final Instant resolvedAt;
    private final String resolvedBy;
    private final Instant suppressedAt;
    /** 重复合并计数 */
    private final int count;
    /** 规则/过滤器附加的元数据 */
    private final Map<String, AlertValue> metadata;
    /** Route 动作指定的渠道 */
    private final Set<String> routes;

    private Alert(Builder b) {
        this.id = b.id == null ? UUID.randomUUID() : b.id;
        this.message = Objects.requireNonNull(b.message, "message");
        this.severity = Objects.requireNonNull(b.severity, "severity");
        this.source = Objects.requireNonNull(b.source, "source");
        this.tag = b.tag == null ? "" : b.tag;
        this.timestamp = b.timestamp == null ? Instant.now() : b.timestamp;
        this.correlationId = b.correlationId;
        this.operationId = b.operationId;
        this.state = b.state == null ? AlertState.ACTIVE : b.state;
        this.acknowledgedAt = b.acknowledgedAt;
        this.acknowledgedBy = b.acknowledgedBy;
        this.resolvedAt = b.resolvedAt;
        this.resolvedBy = b.resolvedBy;
        this.suppressedAt = b.suppressedAt;
        if (b.count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        this.count = b.count;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.routes = Collections.unmodifiableSet(new LinkedHashSet<>(b.routes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Alert of(String message, AlertSeverity severity, String source) {
        return builder().message(message).severity(severity).source(source).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.message = message;
        b.severity = severity;
        b.source = source;
        b.tag = tag;
        b.timestamp = timestamp;
        b.correlationId = correlationId;
        b.operationId = operationId;
        b.state = state;
        b.acknowledgedAt = acknowledgedAt;
        b.acknowledgedBy = acknowledgedBy;
        b.resolvedAt = resolvedAt;
        b.resolvedBy = resolvedBy;
        b.suppressedAt = suppressedAt;
        b.count = count;
        b.metadata.putAll(metadata);
        b.routes.addAll(routes);
        return b;
    }

    /* ========== 状态流转 ========== */

    /**
     * 仅 ACTIVE 可确认
     */
    public Alert acknowledge(String by, Instant at) {
        requireTransition(AlertState.ACKNOWLEDGED);
        return toBuilder()
                .state(AlertState.ACKNOWLEDGED)
                .acknowledgedAt(Objects.requireNonNull(at, "at"))
                .acknowledgedBy(by)
                .build();
    }

    /**
     * ACTIVE/ACKNOWLEDGED 可解决, 未确认时自动补确认
     */
    public Alert resolve(String by, Instant at) {
        requireTransition(AlertState.RESOLVED);
        Objects.requireNonNull(at, "at");
        Builder b = toBuilder().state(AlertState.RESOLVED).resolvedAt(at).resolvedBy(by);
        if (state == AlertState.ACTIVE) {
            b.acknowledgedAt(at).acknowledgedBy(by);
        }
        return b.build();
    }

    public Alert suppress(Instant at) {
        requireTransition(AlertState.SUPPRESSED);
        return toBuilder().state(AlertState.SUPPRESSED).suppressedAt(Objects.requireNonNull(at, "at")).build();
    }

    public Alert incrementCount() {
        return incrementCount(1);
    }

    public Alert incrementCount(int delta) {
        if (delta < 0) {
            throw new IllegalArgumentException("count only increases");
        }
        return delta == 0 ? this : toBuilder().count(Math.addExact(count, delta)).build();
    }

    /* ========== 变换 ========== */

    public Alert withSeverity(AlertSeverity newSeverity) {
        return newSeverity == severity ? this : toBuilder().severity(newSeverity).build();
    }

    public Alert withTag(String newTag) {
        return toBuilder().tag(newTag).build();
    }

    public Alert withRoute(String channel) {
        return routes.contains(channel) ? this : toBuilder().route(channel).build();
    }

    public Alert withMetadata(String key, AlertValue value) {
        return toBuilder().metadata(key, value).build();
    }

    public boolean isActive() {
        return state == AlertState.ACTIVE;
    }

    public boolean isAcknowledged() {
        return state == AlertState.ACKNOWLEDGED || (state == AlertState.RESOLVED && acknowledgedAt != null);
    }

    public boolean isResolved() {
        return state == AlertState.RESOLVED;
    }

    private void requireTransition(AlertState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("alert " + id + " cannot transition " + state + " -> " + target);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Alert alert = (Alert) o;
        return count == alert.count
                && id.equals(alert.id)
                && state == alert.state
                && severity == alert.severity
                && message.equals(alert.message)
                && source.equals(alert.source)
                && tag.equals(alert.tag)
                && metadata.equals(alert.metadata)
                && routes.equals(alert.routes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, state, severity, count);
    }

    @Override
    public String toString() {
        return "Alert{id=" + id + ", severity=" + severity + ", source=" + source + ", tag=" + tag
                + ", state=" + state + ", count=" + count + ", message=" + message + "}";
    }

    public static final class Builder {
        private UUID id;
        private String message;
        private AlertSeverity severity;
        private String source;
        private String tag;
        private Instant timestamp;
        private String correlationId;
        private String operationId;
        private AlertState state;
        private Instant acknowledgedAt;
        private String acknowledgedBy;
        private Instant resolvedAt;
        private String resolvedBy;
        private Instant suppressedAt;
        private int count = 1;
        private final Map<String, AlertValue> metadata = new LinkedHashMap<>();
        private final Set<String> routes = new LinkedHashSet<>();

        private Builder() {}

        public Builder id(UUID id) { this.id = id; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder severity(AlertSeverity severity) { this.severity = severity; return this; }
        public Builder source(String source) { this.source = source; return this; }
        public Builder tag(String tag) { this.tag = tag; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder correlationId(String correlationId) { this.correlationId = correlationId; return this; }
        public Builder operationId(String operationId) { this.operationId = operationId; return this; }
        public Builder count(int count) { this.count = count; return this; }
        public Builder metadata(String key, AlertValue value) {
            this.metadata.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }
        public Builder route(String channel) {
            this.routes.add(Objects.requireNonNull(channel, "channel"));
            return this;
        }

        Builder state(AlertState state) { this.state = state; return this; }
        Builder acknowledgedAt(Instant at) { this.acknowledgedAt = at; return this; }
        Builder acknowledgedBy(String by) { this.acknowledgedBy = by; return this; }
        Builder resolvedAt(Instant at) { this.resolvedAt = at; return this; }
        Builder resolvedBy(String by) { this.resolvedBy = by; return this; }
        Builder suppressedAt(Instant at) { this.suppressedAt = at; return this; }

        public Alert build() {
            return new Alert(this);
        }
    }
}
