package com.fastalert.core.rule;

import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.RuleContext;
import com.fastalert.model.enums.AlertSeverity;
import com.fastalert.model.enums.ErrorHandlingMode;
import com.fastalert.model.value.AlertValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleEngineTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private RuleEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RuleEngine();
    }

    private static Alert alert(AlertSeverity severity, String source) {
        return Alert.builder().message("disk usage high").severity(severity).source(source).build();
    }

    private static AlertRule tagRule(String id, int priority, String tag) {
        return AlertRule.builder(id, RuleType.TRANSFORMATION).id(id).priority(priority)
                .action(RuleAction.addTag(tag)).build();
    }

    @Test
    void rulesRunInAscendingPriority() {
        engine.addRule(tagRule("r10", 10, "ten"));
        engine.addRule(tagRule("r5", 5, "five"));
        engine.addRule(tagRule("r20", 20, "twenty"));

        RuleEvaluation r = engine.evaluate(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW));

        assertThat(r.getMatchedRules()).containsExactly("r5", "r10", "r20");
        assertThat(r.getAlert().getTag()).isEqualTo("five,ten,twenty");
        assertThat(engine.getRules()).extracting(AlertRule::getId).containsExactly("r5", "r10", "r20");
    }

    @Test
    void suppressShortCircuitsLaterRules() {
        engine.addRule(AlertRule.builder("mute-db", RuleType.SUPPRESSION).id("mute").priority(1).source("db*").build());
        engine.addRule(tagRule("later", 2, "x"));

        RuleEvaluation r = engine.evaluate(alert(AlertSeverity.HIGH, "db-primary"), RuleContext.of(NOW));

        assertThat(r.isSuppressed()).isTrue();
        assertThat(r.getSuppressedBy()).isEqualTo("mute");
        assertThat(r.getMatchedRules()).containsExactly("mute");
        assertThat(engine.getStatistics("later").get().getEvaluations()).isZero();

        Alert other = engine.apply(alert(AlertSeverity.HIGH, "web"), RuleContext.of(NOW));
        assertThat(other).isNotNull();
        assertThat(other.getTag()).isEqualTo("x");
    }

    @Test
    void filterRuleWithoutActionsSuppresses() {
        AlertRule rule = AlertRule.builder("drop-low", RuleType.FILTER).id("drop-low").severity(AlertSeverity.LOW).build();
        assertThat(rule.getActions()).containsExactly(RuleAction.suppress());
        engine.addRule(rule);

        assertThat(engine.apply(alert(AlertSeverity.LOW, "app"), RuleContext.of(NOW))).isNull();
        assertThat(engine.apply(alert(AlertSeverity.MEDIUM, "app"), RuleContext.of(NOW))).isNotNull();
    }

    @Test
    void actionsApplyInOrder() {
        engine.addRule(AlertRule.builder("page-oncall", RuleType.ROUTING).id("route")
                .message("*disk*")
                .action(RuleAction.modifySeverity(AlertSeverity.CRITICAL))
                .action(RuleAction.route("pager"))
                .action(RuleAction.addMetadata("team", AlertValue.of("infra")))
                .build());

        Alert out = engine.apply(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW));

        assertThat(out.getSeverity()).isEqualTo(AlertSeverity.CRITICAL);
        assertThat(out.getRoutes()).containsExactly("pager");
        assertThat(out.getMetadata().get("team").asString()).isEqualTo("infra");
    }

    @Test
    void conditionsResolveBuiltinsThenMetadataThenContext() {
        engine.addRule(AlertRule.builder("ctx", RuleType.TRANSFORMATION).id("ctx")
                .condition(RuleCondition.of("severity", ConditionOperator.GREATER_THAN_OR_EQUAL, "warning"))
                .condition(RuleCondition.of("region", ConditionOperator.EQUALS, "EU"))
                .condition(RuleCondition.of("env", ConditionOperator.STARTS_WITH, "prod"))
                .action(RuleAction.addTag("matched"))
                .build());

        Alert withMeta = Alert.builder().message("m").severity(AlertSeverity.CRITICAL).source("app")
                .metadata("region", AlertValue.of("eu")).build();
        RuleContext ctx = RuleContext.builder().evaluatedAt(NOW).property("env", AlertValue.of("production")).build();

        assertThat(engine.evaluate(withMeta, ctx).getMatchedRules()).containsExactly("ctx");
        // 缺少上下文属性时条件不成立
        assertThat(engine.evaluate(withMeta, RuleContext.of(NOW)).getMatchedRules()).isEmpty();
        // 级别不够
        Alert high = withMeta.withSeverity(AlertSeverity.HIGH);
        assertThat(engine.evaluate(high, ctx).getMatchedRules()).isEmpty();
    }

    @Test
    void matchesOperatorIsCaseInsensitiveFind() {
        engine.addRule(AlertRule.builder("oom", RuleType.SUPPRESSION).id("oom")
                .condition(RuleCondition.of("message", ConditionOperator.MATCHES, "out of mem(ory)?"))
                .build());

        Alert a = Alert.builder().message("java.lang.OutOfMemoryError: OUT OF MEMORY").severity(AlertSeverity.HIGH)
                .source("jvm").build();
        assertThat(engine.evaluate(a, RuleContext.of(NOW)).isSuppressed()).isTrue();
    }

    @Test
    void rateLimitRuleMatchesOnlyAfterMaxOccurrencesPerSource() {
        engine.addRule(AlertRule.builder("flood", RuleType.RATE_LIMIT).id("flood")
                .window(Duration.ofSeconds(60), 2)
                .action(RuleAction.suppress())
                .build());

        assertThat(engine.evaluate(alert(AlertSeverity.HIGH, "a"), RuleContext.of(NOW)).isSuppressed()).isFalse();
        assertThat(engine.evaluate(alert(AlertSeverity.HIGH, "a"), RuleContext.of(NOW.plusSeconds(1))).isSuppressed()).isFalse();
        assertThat(engine.evaluate(alert(AlertSeverity.HIGH, "a"), RuleContext.of(NOW.plusSeconds(2))).isSuppressed()).isTrue();
        // 其他 source 独立计数
        assertThat(engine.evaluate(alert(AlertSeverity.HIGH, "b"), RuleContext.of(NOW.plusSeconds(2))).isSuppressed()).isFalse();
        // 窗口过期后重新计数
        assertThat(engine.evaluate(alert(AlertSeverity.HIGH, "a"), RuleContext.of(NOW.plusSeconds(60))).isSuppressed()).isFalse();
    }

    @Test
    void thresholdRuleComparesCount() {
        engine.addRule(AlertRule.builder("noisy", RuleType.THRESHOLD).id("noisy")
                .threshold(5, ConditionOperator.GREATER_THAN_OR_EQUAL)
                .action(RuleAction.modifySeverity(AlertSeverity.WARNING))
                .build());

        Alert four = Alert.builder().message("m").severity(AlertSeverity.LOW).source("s").count(4).build();
        Alert five = four.incrementCount();

        assertThat(engine.apply(four, RuleContext.of(NOW)).getSeverity()).isEqualTo(AlertSeverity.LOW);
        assertThat(engine.apply(five, RuleContext.of(NOW)).getSeverity()).isEqualTo(AlertSeverity.WARNING);
    }

    @Test
    void invalidRulesAreRejected() {
        assertThatThrownBy(() -> AlertRule.builder(" ", RuleType.FILTER).build())
                .isInstanceOf(AlertConfigurationException.class);
        assertThatThrownBy(() -> AlertRule.builder("rl", RuleType.RATE_LIMIT).build())
                .isInstanceOf(AlertConfigurationException.class);
        assertThatThrownBy(() -> AlertRule.builder("th", RuleType.THRESHOLD).build())
                .isInstanceOf(AlertConfigurationException.class);
        assertThatThrownBy(() -> AlertRule.builder("th", RuleType.THRESHOLD).threshold(-1, ConditionOperator.GREATER_THAN).build())
                .isInstanceOf(AlertConfigurationException.class);
        assertThatThrownBy(() -> AlertRule.builder("th", RuleType.THRESHOLD).threshold(1, ConditionOperator.CONTAINS).build())
                .isInstanceOf(AlertConfigurationException.class);
        assertThatThrownBy(() -> AlertRule.builder("tr", RuleType.TRANSFORMATION).build())
                .isInstanceOf(AlertConfigurationException.class);
        assertThatThrownBy(() -> AlertRule.builder("rt", RuleType.ROUTING).action(RuleAction.addTag("t")).build())
                .isInstanceOf(AlertConfigurationException.class);
        assertThatThrownBy(() -> RuleCondition.of("message", ConditionOperator.MATCHES, "(unclosed"))
                .isInstanceOf(AlertConfigurationException.class);

        engine.addRule(tagRule("dup", 1, "a"));
        assertThatThrownBy(() -> engine.addRule(tagRule("dup", 2, "b")))
                .isInstanceOf(AlertConfigurationException.class);
    }

    private static AlertRule brokenRule(ErrorHandlingMode mode, int maxErrors) {
        // 级别与无法解析的文本比较时抛出异常
        return AlertRule.builder("broken", RuleType.TRANSFORMATION).id("broken").priority(1)
                .condition(RuleCondition.of("severity", ConditionOperator.GREATER_THAN, "bogus"))
                .action(RuleAction.addTag("never"))
                .onError(mode, maxErrors)
                .build();
    }

    @Test
    void suppressOnErrorDropsTheAlert() {
        engine.addRule(brokenRule(ErrorHandlingMode.SUPPRESS_ON_ERROR, 5));

        RuleEvaluation r = engine.evaluate(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW));

        assertThat(r.isSuppressed()).isTrue();
        assertThat(r.getSuppressedBy()).isEqualTo("broken");
        assertThat(engine.getStatistics("broken").get().getErrorCount()).isEqualTo(1);
    }

    @Test
    void logAndContinueDisablesAfterConsecutiveErrors() {
        engine.addRule(brokenRule(ErrorHandlingMode.LOG_AND_CONTINUE, 2));
        engine.addRule(tagRule("after", 2, "ok"));

        Alert first = engine.apply(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW));
        assertThat(first.getTag()).isEqualTo("ok");
        assertThat(engine.isEnabled("broken")).isTrue();

        engine.apply(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW));
        assertThat(engine.isEnabled("broken")).isFalse();

        engine.apply(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW));
        assertThat(engine.getStatistics("broken").get().getErrorCount()).isEqualTo(2);

        assertThat(engine.enable("broken")).isTrue();
        assertThat(engine.isEnabled("broken")).isTrue();
    }

    @Test
    void disableOnErrorStopsAtFirstError() {
        engine.addRule(brokenRule(ErrorHandlingMode.DISABLE_ON_ERROR, 5));

        Alert out = engine.apply(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW));

        assertThat(out).isNotNull();
        assertThat(engine.isEnabled("broken")).isFalse();
    }

    @Test
    void failingActionRollsBackEarlierActionsOfTheSameRule() {
        engine.addRule(AlertRule.builder("half-done", RuleType.TRANSFORMATION).id("half-done").priority(1)
                .action(RuleAction.modifySeverity(AlertSeverity.CRITICAL))
                .action(RuleAction.addTag("touched"))
                .action(RuleAction.transform("explode", a -> {
                    throw new IllegalStateException("enrichment backend down");
                }))
                .onError(ErrorHandlingMode.LOG_AND_CONTINUE, 5)
                .build());
        engine.addRule(tagRule("after", 2, "ok"));

        Alert out = engine.apply(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW));

        assertThat(out.getSeverity()).isEqualTo(AlertSeverity.HIGH);
        assertThat(out.getTag()).isEqualTo("ok");
        assertThat(engine.getStatistics("half-done").get().getErrorCount()).isEqualTo(1);
    }

    @Test
    void transformActionReturningNullSuppresses() {
        engine.addRule(AlertRule.builder("drop", RuleType.TRANSFORMATION).id("drop")
                .action(RuleAction.transform("drop-all", a -> null)).build());

        RuleEvaluation r = engine.evaluate(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW));

        assertThat(r.isSuppressed()).isTrue();
        assertThat(r.getSuppressedBy()).isEqualTo("drop");
    }

    @Test
    void statisticsTrackMatchesAndSuppressions() {
        engine.addRule(AlertRule.builder("mute-low", RuleType.SUPPRESSION).id("mute-low").severity(AlertSeverity.LOW).build());

        engine.evaluate(alert(AlertSeverity.LOW, "app"), RuleContext.of(NOW));
        engine.evaluate(alert(AlertSeverity.LOW, "app"), RuleContext.of(NOW.plusSeconds(1)));
        engine.evaluate(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW.plusSeconds(2)));

        AlertRuleStatistics.Snapshot s = engine.getStatistics("mute-low").get();
        assertThat(s.getEvaluations()).isEqualTo(3);
        assertThat(s.getMatchCount()).isEqualTo(2);
        assertThat(s.getSuppressedCount()).isEqualTo(2);
        assertThat(s.getFirstMatch()).isEqualTo(NOW);
        assertThat(s.getLastMatch()).isEqualTo(NOW.plusSeconds(1));
        assertThat(s.getMatchRate()).isEqualTo(2d / 3);

        engine.resetStatistics();
        assertThat(engine.getStatistics("mute-low").get().getEvaluations()).isZero();
    }

    @Test
    void disabledAndRemovedRulesAreSkipped() {
        engine.addRule(AlertRule.builder("mute", RuleType.SUPPRESSION).id("mute").build());

        assertThat(engine.disable("mute")).isTrue();
        assertThat(engine.apply(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW))).isNotNull();

        engine.enable("mute");
        assertThat(engine.apply(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW))).isNull();

        assertThat(engine.removeRule("mute")).isTrue();
        assertThat(engine.removeRule("mute")).isFalse();
        assertThat(engine.getStatistics("mute")).isEmpty();
        assertThat(engine.apply(alert(AlertSeverity.HIGH, "app"), RuleContext.of(NOW))).isNotNull();
    }
}
