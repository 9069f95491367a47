package com.fastalert.core.filter.builtin;

import com.fastalert.core.filter.FilterResult;
import com.fastalert.core.filter.FilterType;
import com.fastalert.core.support.WildcardPattern;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.FilterContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 按 source 白名单/黑名单过滤, 支持通配符
 * 黑名单优先; 白名单非空时未命中即抑制
 */
public class SourceAlertFilter extends AbstractAlertFilter {

    private final List<WildcardPattern> allowed;
    private final List<WildcardPattern> blocked;

    public SourceAlertFilter(String name, Collection<String> allowed, Collection<String> blocked, int priority) {
        super(name, priority);
        this.allowed = compile(allowed);
        this.blocked = compile(blocked);
    }

    public static SourceAlertFilter allowOnly(String name, Collection<String> sources, int priority) {
        return new SourceAlertFilter(name, sources, List.of(), priority);
    }

    public static SourceAlertFilter block(String name, Collection<String> sources, int priority) {
        return new SourceAlertFilter(name, List.of(), sources, priority);
    }

    @Override
    public FilterType type() {
        return FilterType.SOURCE;
    }

    @Override
    public FilterResult evaluate(Alert alert, FilterContext ctx) {
        String source = alert.getSource();
        for (WildcardPattern p : blocked) {
            if (p.matches(source)) {
                return FilterResult.suppress("source '" + source + "' blocked by " + p.getExpression());
            }
        }
        if (!allowed.isEmpty() && allowed.stream().noneMatch(p -> p.matches(source))) {
            return FilterResult.suppress("source '" + source + "' not in whitelist");
        }
        return FilterResult.allow();
    }

    private static List<WildcardPattern> compile(Collection<String> patterns) {
        List<WildcardPattern> out = new ArrayList<>();
        if (patterns != null) {
            for (String p : patterns) {
                if (p != null && !p.isBlank()) {
                    out.add(WildcardPattern.of(p.trim()));
                }
            }
        }
        return List.copyOf(out);
    }
}
