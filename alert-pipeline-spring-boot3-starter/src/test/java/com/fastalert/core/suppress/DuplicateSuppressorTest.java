package com.fastalert.core.suppress;

import com.fastalert.model.Alert;
import com.fastalert.model.enums.AlertSeverity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateSuppressorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static Alert alert(String message) {
        return Alert.builder().message(message).severity(AlertSeverity.HIGH).source("db").tag("conn").build();
    }

    @Test
    void fiveIdenticalAlertsSuppressFourAndCountFive() {
        DuplicateSuppressor suppressor = new DuplicateSuppressor(Duration.ofSeconds(60));
        Alert first = alert("DB down");

        DuplicateCheck c1 = suppressor.check(first, T0);
        assertThat(c1.isSuppressed()).isFalse();
        assertThat(c1.isFirstOccurrence()).isTrue();
        assertThat(c1.getPrimaryId()).isEqualTo(first.getId());

        int suppressed = 0;
        DuplicateCheck last = c1;
        for (int i = 1; i < 5; i++) {
            last = suppressor.check(alert("DB down"), T0.plusSeconds(i));
            if (last.isSuppressed()) {
                suppressed++;
            }
        }
        assertThat(suppressed).isEqualTo(4);
        assertThat(last.getOccurrences()).isEqualTo(5);
        assertThat(last.getPrimaryId()).isEqualTo(first.getId());
    }

    @Test
    void messageIsNormalizedBeforeFingerprinting() {
        DuplicateSuppressor suppressor = new DuplicateSuppressor(Duration.ofSeconds(60));
        suppressor.check(alert("DB   Down "), T0);

        assertThat(suppressor.check(alert("db down"), T0.plusSeconds(1)).isSuppressed()).isTrue();
    }

    @Test
    void differentSourceOrTagIsNotDuplicate() {
        DuplicateSuppressor suppressor = new DuplicateSuppressor(Duration.ofSeconds(60));
        suppressor.check(alert("x"), T0);
        Alert otherTag = Alert.builder().message("x").severity(AlertSeverity.HIGH).source("db").tag("disk").build();

        assertThat(suppressor.check(otherTag, T0).isSuppressed()).isFalse();
    }

    @Test
    void windowIsAnchoredAtFirstOccurrence() {
        DuplicateSuppressor suppressor = new DuplicateSuppressor(Duration.ofSeconds(60));
        Alert first = alert("flap");
        suppressor.check(first, T0);
        assertThat(suppressor.check(alert("flap"), T0.plusSeconds(59)).isSuppressed()).isTrue();

        Alert later = alert("flap");
        DuplicateCheck expired = suppressor.check(later, T0.plusSeconds(60));
        assertThat(expired.isSuppressed()).isFalse();
        assertThat(expired.getPrimaryId()).isEqualTo(later.getId());
        assertThat(expired.getOccurrences()).isEqualTo(1);
    }

    @Test
    void sweepRemovesExpiredEntries() {
        DuplicateSuppressor suppressor = new DuplicateSuppressor(Duration.ofSeconds(10));
        suppressor.check(alert("a"), T0);
        suppressor.check(alert("b"), T0.plusSeconds(8));

        assertThat(suppressor.sweep(T0.plusSeconds(12))).isEqualTo(1);
        assertThat(suppressor.size()).isEqualTo(1);
    }

    @Test
    void escalationLetsDuplicateThroughWithHigherSeverity() {
        DuplicateSuppressor suppressor = new DuplicateSuppressor(Duration.ofMinutes(5),
                new OccurrenceEscalationPolicy(3, AlertSeverity.CRITICAL));
        suppressor.check(alert("disk full"), T0);
        assertThat(suppressor.check(alert("disk full"), T0.plusSeconds(1)).isSuppressed()).isTrue();

        DuplicateCheck third = suppressor.check(alert("disk full"), T0.plusSeconds(2));

        assertThat(third.isSuppressed()).isFalse();
        assertThat(third.isEscalated()).isTrue();
        assertThat(third.getEscalatedSeverity()).isEqualTo(AlertSeverity.WARNING);
        assertThat(suppressor.check(alert("disk full"), T0.plusSeconds(3)).isSuppressed()).isTrue();
    }
}
