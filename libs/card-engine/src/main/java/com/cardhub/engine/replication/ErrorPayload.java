package com.cardhub.engine.replication;

/**
 * ERROR 消息载荷。
 */
public record ErrorPayload(String code, String message) {

    public static final String REJECTED = "ACTION_REJECTED";
    public static final String NOT_YOUR_SEAT = "NOT_YOUR_SEAT";
    public static final String HOST_ONLY = "HOST_ONLY";
    public static final String BAD_MESSAGE = "BAD_MESSAGE";

    public static ErrorPayload of(String code, String message) {
        return new ErrorPayload(code, message);
    }
}
