package com.fastalert.core.filter;

import com.fastalert.core.filter.builtin.CompositeAlertFilter;
import com.fastalert.core.filter.builtin.SamplingAlertFilter;
import com.fastalert.core.filter.builtin.SeverityAlertFilter;
import com.fastalert.core.filter.builtin.SourceAlertFilter;
import com.fastalert.core.spi.filter.AlertFilter;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.FilterContext;
import com.fastalert.model.enums.AlertSeverity;
import com.fastalert.model.enums.ErrorHandlingMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilterChainTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final List<String> calls = new ArrayList<>();

    private FilterChain chain;

    @BeforeEach
    void setUp() {
        chain = new FilterChain();
    }

    private static Alert alert(AlertSeverity severity, String source) {
        return Alert.builder().message("msg").severity(severity).source(source).build();
    }

    private FilterContext ctx() {
        return FilterContext.of(NOW);
    }

    @Test
    void filtersRunInDescendingPriorityThenRegistrationOrder() {
        chain.register(new StubFilter("low", 1, a -> FilterResult.allow()));
        chain.register(new StubFilter("high", 10, a -> FilterResult.allow()));
        chain.register(new StubFilter("mid-a", 5, a -> FilterResult.allow()));
        chain.register(new StubFilter("mid-b", 5, a -> FilterResult.allow()));

        FilterChainResult r = chain.evaluate(alert(AlertSeverity.HIGH, "app"), ctx());

        assertThat(r.isPassed()).isTrue();
        assertThat(calls).containsExactly("high", "mid-a", "mid-b", "low");
    }

    @Test
    void firstSuppressShortCircuits() {
        chain.register(new StubFilter("first", 3, a -> FilterResult.suppress("nope")));
        chain.register(new StubFilter("second", 2, a -> FilterResult.allow()));

        FilterChainResult r = chain.evaluate(alert(AlertSeverity.HIGH, "app"), ctx());

        assertThat(r.isSuppressed()).isTrue();
        assertThat(r.getDecidedBy()).isEqualTo("first");
        assertThat(calls).containsExactly("first");
    }

    @Test
    void collectAllResultsKeepsEvaluatingButStillSuppresses() {
        chain.setCollectAllResults(true);
        chain.register(new StubFilter("first", 3, a -> FilterResult.suppress("nope")));
        chain.register(new StubFilter("second", 2, a -> FilterResult.allow()));

        FilterChainResult r = chain.evaluate(alert(AlertSeverity.HIGH, "app"), ctx());

        assertThat(r.isSuppressed()).isTrue();
        assertThat(calls).containsExactly("first", "second");
        assertThat(r.getApplications()).hasSize(2);
    }

    @Test
    void modifiedAlertFlowsToLaterFilters() {
        chain.register(new StubFilter("tagger", 10, a -> FilterResult.modify(a.withTag("tagged"), "tag")));
        List<String> seenTags = new ArrayList<>();
        chain.register(new StubFilter("reader", 1, a -> {
            seenTags.add(a.getTag());
            return FilterResult.allow();
        }));

        FilterChainResult r = chain.evaluate(alert(AlertSeverity.HIGH, "app"), ctx());

        assertThat(r.getFinalDecision()).isEqualTo(FilterDecision.MODIFY);
        assertThat(r.getAlert().getTag()).isEqualTo("tagged");
        assertThat(seenTags).containsExactly("tagged");
    }

    @Test
    void deferStopsEvaluation() {
        chain.register(new StubFilter("wait", 2, a -> FilterResult.defer("later")));
        chain.register(new StubFilter("after", 1, a -> FilterResult.allow()));

        FilterChainResult r = chain.evaluate(alert(AlertSeverity.HIGH, "app"), ctx());

        assertThat(r.isDeferred()).isTrue();
        assertThat(r.getDecidedBy()).isEqualTo("wait");
        assertThat(calls).containsExactly("wait");
    }

    @Test
    void suppressOnErrorSuppresses() {
        StubFilter broken = new StubFilter("broken", 1, a -> {
            throw new IllegalStateException("boom");
        });
        broken.mode = ErrorHandlingMode.SUPPRESS_ON_ERROR;
        chain.register(broken);

        FilterChainResult r = chain.evaluate(alert(AlertSeverity.HIGH, "app"), ctx());

        assertThat(r.isSuppressed()).isTrue();
        assertThat(r.getApplications().get(0).isError()).isTrue();
    }

    @Test
    void logAndContinueAllowsAndAutoDisablesAfterMaxErrors() {
        StubFilter broken = new StubFilter("broken", 1, a -> {
            throw new IllegalStateException("boom");
        });
        broken.maxErrors = 2;
        chain.register(broken);
        Alert a = alert(AlertSeverity.HIGH, "app");

        assertThat(chain.evaluate(a, ctx()).isPassed()).isTrue();
        assertThat(chain.isEnabled("broken")).isTrue();
        assertThat(chain.evaluate(a, ctx()).isPassed()).isTrue();
        assertThat(chain.isEnabled("broken")).isFalse();

        calls.clear();
        chain.evaluate(a, ctx());
        assertThat(calls).isEmpty();

        assertThat(chain.enable("broken")).isTrue();
        chain.evaluate(a, ctx());
        assertThat(calls).containsExactly("broken");
        assertThat(chain.getMetrics("broken").orElseThrow().getErrors()).isEqualTo(3);
    }

    @Test
    void disableOnErrorDisablesImmediately() {
        StubFilter broken = new StubFilter("broken", 1, a -> {
            throw new IllegalStateException("boom");
        });
        broken.mode = ErrorHandlingMode.DISABLE_ON_ERROR;
        chain.register(broken);

        assertThat(chain.evaluate(alert(AlertSeverity.HIGH, "app"), ctx()).isPassed()).isTrue();
        assertThat(chain.isEnabled("broken")).isFalse();
    }

    @Test
    void managementOperations() {
        chain.register(new StubFilter("a", 1, x -> FilterResult.allow()));
        chain.register(new StubFilter("b", 2, x -> FilterResult.allow()));
        assertThatThrownBy(() -> chain.register(new StubFilter("a", 3, x -> FilterResult.allow())))
                .isInstanceOf(AlertConfigurationException.class);

        assertThat(chain.updatePriority("a", 99)).isTrue();
        assertThat(chain.getFilterNames()).containsExactly("a", "b");

        assertThat(chain.disable("b")).isTrue();
        chain.evaluate(alert(AlertSeverity.LOW, "x"), ctx());
        assertThat(calls).containsExactly("a");

        assertThat(chain.unregister("a")).isTrue();
        assertThat(chain.unregister("a")).isFalse();
        assertThat(chain.size()).isEqualTo(1);
    }

    @Test
    void metricsCountDecisions() {
        chain.register(new SeverityAlertFilter("min-high", AlertSeverity.HIGH, 0));

        chain.evaluate(alert(AlertSeverity.LOW, "x"), ctx());
        chain.evaluate(alert(AlertSeverity.CRITICAL, "x"), ctx());

        AlertFilterMetrics.Snapshot m = chain.getMetrics("min-high").orElseThrow();
        assertThat(m.getEvaluations()).isEqualTo(2);
        assertThat(m.getSuppressed()).isEqualTo(1);
        assertThat(m.getSuppressionRate()).isEqualTo(0.5);

        chain.resetMetrics();
        assertThat(chain.getMetrics("min-high").orElseThrow().getEvaluations()).isZero();
    }

    @Test
    void sourceFilterBlacklistWinsOverWhitelist() {
        SourceAlertFilter f = new SourceAlertFilter("src", List.of("app-*"), List.of("app-debug"), 0);

        assertThat(f.evaluate(alert(AlertSeverity.LOW, "APP-web"), ctx()).getDecision()).isEqualTo(FilterDecision.ALLOW);
        assertThat(f.evaluate(alert(AlertSeverity.LOW, "app-debug"), ctx()).getDecision()).isEqualTo(FilterDecision.SUPPRESS);
        assertThat(f.evaluate(alert(AlertSeverity.LOW, "db"), ctx()).getDecision()).isEqualTo(FilterDecision.SUPPRESS);
    }

    @Test
    void samplingRateIsValidatedAndCriticalIsExempt() {
        assertThatThrownBy(() -> new SamplingAlertFilter("s", 1.5, 0)).isInstanceOf(AlertConfigurationException.class);
        assertThatThrownBy(() -> new SamplingAlertFilter("s", -0.1, 0)).isInstanceOf(AlertConfigurationException.class);

        SamplingAlertFilter none = new SamplingAlertFilter("s", 0d, 0);
        chain.register(none);
        assertThat(chain.evaluate(alert(AlertSeverity.LOW, "x"), ctx()).isSuppressed()).isTrue();
        assertThat(chain.evaluate(alert(AlertSeverity.CRITICAL, "x"), ctx()).isPassed()).isTrue();

        SamplingAlertFilter half = new SamplingAlertFilter("half", 0.5, AlertSeverity.CRITICAL, 0, () -> 0.7);
        assertThat(half.evaluate(alert(AlertSeverity.LOW, "x"), ctx()).getDecision()).isEqualTo(FilterDecision.SUPPRESS);
    }

    @Test
    void compositeOperators() {
        AlertFilter pass = new StubFilter("pass", 0, a -> FilterResult.allow());
        AlertFilter block = new StubFilter("block", 0, a -> FilterResult.suppress("x"));
        Alert a = alert(AlertSeverity.HIGH, "app");

        assertThat(new CompositeAlertFilter("and", CompositeAlertFilter.LogicalOperator.AND, List.of(pass, block), 0)
                .evaluate(a, ctx()).getDecision()).isEqualTo(FilterDecision.SUPPRESS);
        assertThat(new CompositeAlertFilter("or", CompositeAlertFilter.LogicalOperator.OR, List.of(block, pass), 0)
                .evaluate(a, ctx()).getDecision()).isEqualTo(FilterDecision.ALLOW);
        assertThat(new CompositeAlertFilter("xor2", CompositeAlertFilter.LogicalOperator.XOR, List.of(pass, pass), 0)
                .evaluate(a, ctx()).getDecision()).isEqualTo(FilterDecision.SUPPRESS);
        assertThat(new CompositeAlertFilter("xor1", CompositeAlertFilter.LogicalOperator.XOR, List.of(pass, block), 0)
                .evaluate(a, ctx()).getDecision()).isEqualTo(FilterDecision.ALLOW);
        assertThat(new CompositeAlertFilter("not", CompositeAlertFilter.LogicalOperator.NOT, List.of(block), 0)
                .evaluate(a, ctx()).getDecision()).isEqualTo(FilterDecision.ALLOW);
        assertThatThrownBy(() -> new CompositeAlertFilter("bad", CompositeAlertFilter.LogicalOperator.NOT, List.of(pass, block), 0))
                .isInstanceOf(AlertConfigurationException.class);
    }

    private final class StubFilter implements AlertFilter {
        private final String name;
        private final int priority;
        private final Function<Alert, FilterResult> fn;
        private ErrorHandlingMode mode = ErrorHandlingMode.LOG_AND_CONTINUE;
        private int maxErrors = 5;

        StubFilter(String name, int priority, Function<Alert, FilterResult> fn) {
            this.name = name;
            this.priority = priority;
            this.fn = fn;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public FilterResult evaluate(Alert alert, FilterContext ctx) {
            calls.add(name);
            return fn.apply(alert);
        }

        @Override
        public ErrorHandlingMode errorHandlingMode() {
            return mode;
        }

        @Override
        public int maxConsecutiveErrors() {
            return maxErrors;
        }
    }
}
