package com.cardhub.gameservice.table.domain.constants;

/**
 * 牌桌服务对外提示消息常量
 *
 * 使用示例：
 *   throw new TableNotFoundException(GameMessages.formatTableNotFound(roomId));
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 牌桌 ==========

    public static final String TABLE_NOT_FOUND = "牌桌不存在: %s";

    public static final String TABLE_LIMIT_REACHED = "牌桌数量已达上限（%d）";

    public static final String TABLE_BUSY = "牌桌繁忙，请稍后重试";

    public static String formatTableNotFound(String roomId) {
        return String.format(TABLE_NOT_FOUND, roomId);
    }

    public static String formatTableLimit(int max) {
        return String.format(TABLE_LIMIT_REACHED, max);
    }

    // ========== 名单 ==========

    /** 牌局进行中、已满或重复加入 */
    public static final String JOIN_REJECTED = "无法加入：牌局进行中、座位已满或已在桌上";

    public static final String LEAVE_REJECTED = "无法离开：牌局进行中或不在桌上";

    // ========== 身份 ==========

    public static final String PEER_ID_REQUIRED = "缺少 peerId";
}
