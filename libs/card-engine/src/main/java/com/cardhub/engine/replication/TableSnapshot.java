package com.cardhub.engine.replication;

import java.util.List;

/**
 * STATE 消息载荷：完整状态（含牌堆快照）+ 最近动作日志。
 */
public record TableSnapshot<S>(S state, List<ActionLogEntry> actionLog) {

    public TableSnapshot {
        actionLog = actionLog == null ? List.of() : List.copyOf(actionLog);
    }
}
