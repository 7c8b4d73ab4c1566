package com.cardhub.engine.replication;

/**
 * 动作日志的一条：已被主机接受的动作。
 */
public record ActionLogEntry(long seq, String playerId, String action, long ts) {
}
