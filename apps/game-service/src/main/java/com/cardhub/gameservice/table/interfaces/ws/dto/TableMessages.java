package com.cardhub.gameservice.table.interfaces.ws.dto;

import lombok.Data;

/**
 * WebSocket 消息对象（客户端 → 服务端）。
 * 动作本身直接以 Envelope JSON 发送，这里只定义辅助指令。
 */
public class TableMessages {

    /** 请求补发当前快照（进入房间、断线重连后） */
    @Data
    public static class SyncCmd {
        private String roomId;
        private String peerId;   // 未带 peerId 头连接时使用
    }
}
