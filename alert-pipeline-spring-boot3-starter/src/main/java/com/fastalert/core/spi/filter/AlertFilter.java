package com.fastalert.core.spi.filter;

import com.fastalert.core.filter.FilterResult;
import com.fastalert.core.filter.FilterType;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.FilterContext;
import com.fastalert.model.enums.ErrorHandlingMode;

/**
 * 告警过滤器 SPI
 * 启用状态/连续错误计数/指标由 FilterChain 维护, 实现只需关注判定本身
 */
public interface AlertFilter {

    /**
     * 唯一名称, 用于管理操作与指标维度
     */
    String name();

    /**
     * 数值越大越先执行
     */
    default int priority() {
        return 0;
    }

    default FilterType type() {
        return FilterType.CUSTOM;
    }

    /**
     * 粗粒度判断, 返回 false 时跳过且不计入指标
     */
    default boolean canHandle(Alert alert) {
        return true;
    }

    /**
     * 判定, 同步调用 不应阻塞
     */
    FilterResult evaluate(Alert alert, FilterContext ctx);

    default ErrorHandlingMode errorHandlingMode() {
        return ErrorHandlingMode.LOG_AND_CONTINUE;
    }

    /**
     * 连续出错达到该值后自动禁用, 需手动重新启用
     */
    default int maxConsecutiveErrors() {
        return 5;
    }
}
