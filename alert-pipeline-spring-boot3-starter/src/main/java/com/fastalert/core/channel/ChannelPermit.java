package com.fastalert.core.channel;

/**
 * 投递许可
 */
public enum ChannelPermit {
    /** OPEN 冷却中或半开试探已被占用 */
    DENIED,
    GRANTED,
    /** 半开唯一一次试探, 只允许单次尝试 */
    TRIAL;

    public boolean isPermitted() {
        return this != DENIED;
    }
}
