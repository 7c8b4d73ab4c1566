package com.cardhub.engine.replication;

/**
 * 抽象消息通道（由会话层提供具体实现：WebSocket、内存管道……）。
 * 约定：可靠、有序、至少一次送达；消息体为 JSON 字符串。
 */
public interface PeerChannel {

    /** 点对点发送 */
    void send(String peerId, String message);

    /** 发给房间内所有对端（不含自己） */
    void broadcast(String message);

    /** 注册接收回调（一个通道只挂一个） */
    void onReceive(MessageHandler handler);

    /** 注册连接状态回调 */
    void onConnectionChange(ConnectionListener listener);

    @FunctionalInterface
    interface MessageHandler {
        void onMessage(String fromPeerId, String message);
    }

    @FunctionalInterface
    interface ConnectionListener {
        void onConnectionChange(String peerId, boolean connected);
    }
}
