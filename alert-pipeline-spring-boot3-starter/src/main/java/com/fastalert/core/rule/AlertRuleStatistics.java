package com.fastalert.core.rule;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 规则统计, 命中与每次成功应用动作都计数, 与最终结论无关
 */
public class AlertRuleStatistics {

    private final String ruleId;

    private long evaluations;
    private long matchCount;
    private long appliedCount;
    private long suppressedCount;
    private long errorCount;
    private Instant firstMatch;
    private Instant lastMatch;
    private Instant lastEvaluated;

    public AlertRuleStatistics(String ruleId) {
        this.ruleId = ruleId;
    }

    synchronized void recordEvaluation(Instant at) {
        evaluations++;
        lastEvaluated = at;
    }

    synchronized void recordMatch(Instant at) {
        matchCount++;
        if (firstMatch == null) {
            firstMatch = at;
        }
        lastMatch = at;
    }

    synchronized void recordApplied() {
        appliedCount++;
    }

    synchronized void recordSuppressed() {
        suppressedCount++;
    }

    synchronized void recordError() {
        errorCount++;
    }

    public synchronized void reset() {
        evaluations = matchCount = appliedCount = suppressedCount = errorCount = 0;
        firstMatch = lastMatch = lastEvaluated = null;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(ruleId, evaluations, matchCount, appliedCount, suppressedCount, errorCount,
                firstMatch, lastMatch, lastEvaluated);
    }

    @Getter
    @AllArgsConstructor
    @ToString
    public static final class Snapshot {
        private final String ruleId;
        private final long evaluations;
        private final long matchCount;
        private final long appliedCount;
        private final long suppressedCount;
        private final long errorCount;
        private final Instant firstMatch;
        private final Instant lastMatch;
        private final Instant lastEvaluated;

        public double getMatchRate() {
            return evaluations == 0 ? 0d : (double) matchCount / evaluations;
        }
    }
}
