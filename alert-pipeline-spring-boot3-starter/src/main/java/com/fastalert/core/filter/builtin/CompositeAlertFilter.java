package com.fastalert.core.filter.builtin;

import com.fastalert.core.filter.FilterDecision;
import com.fastalert.core.filter.FilterResult;
import com.fastalert.core.filter.FilterType;
import com.fastalert.core.spi.filter.AlertFilter;
import com.fastalert.exception.AlertConfigurationException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.FilterContext;

import java.util.List;

/**
 * 组合过滤器, 子过滤器"通过"指结论不是 SUPPRESS
 * AND 全部通过(子过滤器的 MODIFY 依次传递); OR 任一通过; XOR 通过个数为奇数; NOT 取反(仅一个子过滤器)
 * 子过滤器抛出的异常交给外层链按本过滤器的 ErrorHandlingMode 处理
 */
public class CompositeAlertFilter extends AbstractAlertFilter {

    public enum LogicalOperator { AND, OR, XOR, NOT }

    private final LogicalOperator operator;
    private final List<AlertFilter> children;

    public CompositeAlertFilter(String name, LogicalOperator operator, List<? extends AlertFilter> children, int priority) {
        super(name, priority);
        AlertConfigurationException.check(operator != null, "operator must not be null");
        AlertConfigurationException.check(children != null && !children.isEmpty(), "composite filter needs children");
        AlertConfigurationException.check(operator != LogicalOperator.NOT || children.size() == 1,
                "NOT composite takes exactly one child");
        this.operator = operator;
        this.children = List.copyOf(children);
    }

    @Override
    public FilterType type() {
        return FilterType.COMPOSITE;
    }

    @Override
    public FilterResult evaluate(Alert alert, FilterContext ctx) {
        return switch (operator) {
            case AND -> and(alert, ctx);
            case OR -> or(alert, ctx);
            case XOR -> xor(alert, ctx);
            case NOT -> passes(children.get(0), alert, ctx)
                    ? FilterResult.suppress("NOT(" + children.get(0).name() + ") matched")
                    : FilterResult.allow("NOT(" + children.get(0).name() + ")");
        };
    }

    private FilterResult and(Alert alert, FilterContext ctx) {
        Alert current = alert;
        boolean modified = false;
        for (AlertFilter child : children) {
            if (!child.canHandle(current)) {
                continue;
            }
            FilterResult r = child.evaluate(current, ctx);
            if (r == null) {
                continue;
            }
            if (r.getDecision() == FilterDecision.SUPPRESS) {
                return FilterResult.suppress("AND: " + child.name() + " -> " + r.getReason());
            }
            if (r.getDecision() == FilterDecision.MODIFY) {
                current = r.getModifiedAlert();
                modified = true;
            }
        }
        return modified ? FilterResult.modify(current, "AND: modified") : FilterResult.allow("AND");
    }

    private FilterResult or(Alert alert, FilterContext ctx) {
        for (AlertFilter child : children) {
            if (passes(child, alert, ctx)) {
                return FilterResult.allow("OR: " + child.name());
            }
        }
        return FilterResult.suppress("OR: no child passed");
    }

    private FilterResult xor(Alert alert, FilterContext ctx) {
        int passed = 0;
        for (AlertFilter child : children) {
            if (passes(child, alert, ctx)) {
                passed++;
            }
        }
        return passed % 2 == 1
                ? FilterResult.allow("XOR: " + passed + " passed")
                : FilterResult.suppress("XOR: " + passed + " passed");
    }

    private static boolean passes(AlertFilter child, Alert alert, FilterContext ctx) {
        if (!child.canHandle(alert)) {
            return true;
        }
        FilterResult r = child.evaluate(alert, ctx);
        return r == null || r.getDecision() != FilterDecision.SUPPRESS;
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public List<AlertFilter> getChildren() {
        return children;
    }
}
