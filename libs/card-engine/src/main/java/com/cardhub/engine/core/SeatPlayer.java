package com.cardhub.engine.core;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 座位上的玩家（各游戏玩家模型的公共部分）。
 * playerId 跨局不变，用于庄家轮换、名次计算。
 */
@Data
@NoArgsConstructor
public abstract class SeatPlayer {

    private String playerId;

    private String displayName;

    protected SeatPlayer(String playerId, String displayName) {
        this.playerId = playerId;
        this.displayName = displayName;
    }

    /** 开新一局前清空手牌与本局临时字段 */
    public abstract void resetForRound();
}
