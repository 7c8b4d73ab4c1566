package com.cardhub.gameservice.table.service;

import com.cardhub.engine.core.GameType;
import com.cardhub.gameservice.table.domain.model.TableView;
import com.fasterxml.jackson.databind.JsonNode;

public interface TableSessionService {

    /** 开桌，创建者即主机并自动入座；返回房间号 */
    String createTable(GameType game, String hostId, String hostName);

    /** 当前快照视图；牌桌不存在抛 TableNotFoundException */
    TableView view(String roomId);

    /** 入座（只在两局之间），失败抛 IllegalStateException */
    TableView join(String roomId, String playerId, String displayName);

    TableView leave(String roomId, String playerId);

    /**
     * 同步提交一个动作（HTTP 入口），与 WS 走同一条主机校验路径。
     * 动作无法解析抛 IllegalArgumentException，被拒绝抛 IllegalStateException。
     */
    TableView submit(String roomId, String peerId, JsonNode action);

    /** WS 入站：原样的动作外壳，排队交给对应牌桌 */
    void deliver(String principalPeerId, String envelopeJson);

    /** 对端请求补发快照 */
    void resync(String roomId, String peerId);

    /** 对端订阅了某桌的私有队列：记为在线并补发快照；未知牌桌只记录日志 */
    void peerSubscribed(String roomId, String peerId);

    /** 对端的 WS 会话断开：从所有牌桌的在线集合中移除并通知对应主机 */
    void peerDisconnected(String peerId);

    void closeTable(String roomId);

    int tableCount();
}
