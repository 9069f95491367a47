package com.fastalert.core.suppress;

import com.fastalert.core.spi.suppress.EscalationPolicy;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.Alert;
import com.fastalert.model.enums.AlertSeverity;

/**
 * 每累计 N 次重复提升一级, 不超过上限
 */
public class OccurrenceEscalationPolicy implements EscalationPolicy {

    private final int everyOccurrences;
    private final AlertSeverity ceiling;

    public OccurrenceEscalationPolicy(int everyOccurrences, AlertSeverity ceiling) {
        AlertConfigurationException.check(everyOccurrences >= 2, "escalation every-occurrences must be >= 2");
        this.everyOccurrences = everyOccurrences;
        this.ceiling = ceiling == null ? AlertSeverity.CRITICAL : ceiling;
    }

    @Override
    public AlertSeverity escalate(Alert duplicate, AlertSeverity current, int occurrences) {
        if (occurrences % everyOccurrences != 0 || current.isAtLeast(ceiling)) {
            return current;
        }
        return AlertSeverity.values()[current.ordinal() + 1];
    }
}
