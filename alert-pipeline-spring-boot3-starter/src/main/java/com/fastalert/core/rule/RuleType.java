package com.fastalert.core.rule;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum RuleType {
    FILTER("过滤, 无动作时默认抑制"),
    SUPPRESSION("抑制, 无动作时默认抑制"),
    RATE_LIMIT("时间窗内同 source 命中次数超过上限才生效"),
    THRESHOLD("数值属性与阈值比较"),
    TRANSFORMATION("改写级别/标签/元数据"),
    ROUTING("指定投递渠道");

    public final String desc;

    /**
     * 未配置动作时是否隐含 Suppress
     */
    public boolean impliesSuppress() {
        return this == FILTER || this == SUPPRESSION;
    }
}
