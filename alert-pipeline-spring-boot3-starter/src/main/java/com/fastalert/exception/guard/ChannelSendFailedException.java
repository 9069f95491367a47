package com.fastalert.exception.guard;

/**
 * 渠道返回失败结果(未抛异常)时的包装, 参与重试判定
 */
public class ChannelSendFailedException extends RuntimeException {

    public ChannelSendFailedException(String channel, String error) {
        super("channel " + channel + " reported failure: " + error);
    }
}
