package com.cardhub.engine.games.pokdeng.domain.enums;

public enum PokDengPhase {

    WAITING,    // 两局之间（可增删玩家）
    BETTING,    // 闲家下注
    DEALING,    // 发两张
    PLAYING,    // 依次补牌 / 停牌（庄家最后）
    REVEALING,  // 亮牌
    SETTLING,   // 结算
    FINISHED    // 本局结束，等待 endRound
}
