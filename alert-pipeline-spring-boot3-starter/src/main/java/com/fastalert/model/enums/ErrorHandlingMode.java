package com.fastalert.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 过滤器/规则评估出错时的处理方式
 */
@AllArgsConstructor
@Getter
public enum ErrorHandlingMode {
    ALLOW_ON_ERROR("出错放行"),
    SUPPRESS_ON_ERROR("出错抑制"),
    LOG_AND_CONTINUE("记录日志后继续"),
    DISABLE_ON_ERROR("出错即禁用");

    public final String desc;
}
