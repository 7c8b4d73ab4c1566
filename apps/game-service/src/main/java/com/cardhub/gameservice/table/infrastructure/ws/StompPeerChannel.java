package com.cardhub.gameservice.table.infrastructure.ws;

import com.cardhub.engine.replication.PeerChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;

/**
 * 基于 STOMP 的对端通道（一张牌桌一个）。
 * - broadcast → /topic/table.{roomId}
 * - send      → /user/{peerId}/queue/table.{roomId}
 * 入站方向由会话服务在牌桌线程上调用 deliver/connected/disconnected。
 */
@Slf4j
public class StompPeerChannel implements PeerChannel {

    private final SimpMessagingTemplate messaging;
    private final String roomId;
    private MessageHandler handler;
    private ConnectionListener listener = (peer, connected) -> { };

    public StompPeerChannel(SimpMessagingTemplate messaging, String roomId) {
        this.messaging = messaging;
        this.roomId = roomId;
        this.handler = (from, msg) -> log.warn("[{}] 通道尚未绑定接收者，丢弃来自 {} 的消息", this.roomId, from);
    }

    public static String topic(String roomId) {
        return "/topic/table." + roomId;
    }

    public static String userQueue(String roomId) {
        return "/queue/table." + roomId;
    }

    @Override
    public void send(String peerId, String message) {
        messaging.convertAndSendToUser(peerId, userQueue(roomId), message);
    }

    @Override
    public void broadcast(String message) {
        messaging.convertAndSend(topic(roomId), message);
    }

    @Override
    public void onReceive(MessageHandler handler) {
        this.handler = handler;
    }

    @Override
    public void onConnectionChange(ConnectionListener listener) {
        this.listener = listener;
    }

    /** 入站消息交给复制器 */
    public void deliver(String fromPeerId, String message) {
        handler.onMessage(fromPeerId, message);
    }

    public void connected(String peerId) {
        listener.onConnectionChange(peerId, true);
    }

    public void disconnected(String peerId) {
        listener.onConnectionChange(peerId, false);
    }
}
