package com.fastalert.model.ctx;

import com.fastalert.model.value.AlertValue;
import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.time.Instant;
import java.util.Map;

/**
 * 规则评估上下文, properties 为条件匹配的最后一级取值来源
 */
@Data
@Builder
public class RuleContext {

    private Instant evaluatedAt;
    private String correlationId;
    private boolean emergencyMode;
    @Singular
    private Map<String, AlertValue> properties;

    public static RuleContext of(Instant now) {
        return RuleContext.builder().evaluatedAt(now).build();
    }

    public AlertValue property(String name) {
        return properties == null ? null : properties.get(name);
    }
}
