package com.cardhub.engine.replication;

/**
 * 收到的消息无法解析（外壳或载荷）。调用方记录后丢弃，不重试。
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
