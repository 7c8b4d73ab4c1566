package com.cardhub.gameservice.table.domain.model;

import com.cardhub.engine.core.GameType;
import com.cardhub.engine.replication.ActionLogEntry;

import java.util.List;

/**
 * 牌桌只读视图（HTTP 查询用）。
 * state 为引擎 serialize() 的结果，含牌堆快照；onlinePeers 为当前在线的对端。
 */
public record TableView(String roomId,
                        GameType game,
                        String hostId,
                        long seq,
                        Object state,
                        List<ActionLogEntry> actionLog,
                        List<String> onlinePeers) {
}
