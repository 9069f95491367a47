package com.fastalert.exception.guard;

/**
 * 全局投递并发已满
 * 用于 FailureDecider/Backoff 识别 系统性拥塞
 */
public class ChannelBulkheadFullException extends RuntimeException {

    public ChannelBulkheadFullException(Throwable cause) {
        super("delivery bulkhead full", cause);
    }
}
