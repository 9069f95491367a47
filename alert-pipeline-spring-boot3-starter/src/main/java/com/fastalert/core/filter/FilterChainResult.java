package com.fastalert.core.filter;

import com.fastalert.model.Alert;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * 过滤链评估结果
 */
@Getter
@ToString
public final class FilterChainResult {

    private final FilterDecision finalDecision;
    /** 经过 MODIFY 之后的告警, SUPPRESS 时为被抑制前的最后版本 */
    private final Alert alert;
    /** 作出最终结论的过滤器, ALLOW 时为 null */
    private final String decidedBy;
    private final String reason;
    private final List<Application> applications;

    public FilterChainResult(FilterDecision finalDecision, Alert alert, String decidedBy, String reason,
                             List<Application> applications) {
        this.finalDecision = finalDecision;
        this.alert = alert;
        this.decidedBy = decidedBy;
        this.reason = reason;
        this.applications = List.copyOf(applications);
    }

    public boolean isSuppressed() {
        return finalDecision == FilterDecision.SUPPRESS;
    }

    public boolean isDeferred() {
        return finalDecision == FilterDecision.DEFER;
    }

    /**
     * 是否可以继续后续处理(ALLOW/MODIFY)
     */
    public boolean isPassed() {
        return finalDecision == FilterDecision.ALLOW || finalDecision == FilterDecision.MODIFY;
    }

    /**
     * 单个过滤器的一次执行记录
     */
    @Getter
    @AllArgsConstructor
    @ToString
    public static final class Application {
        private final String filterName;
        private final FilterResult result;
        private final long nanos;
        /** 出错时的异常, 正常为 null */
        private final Throwable error;

        public boolean isError() {
            return error != null;
        }
    }
}
