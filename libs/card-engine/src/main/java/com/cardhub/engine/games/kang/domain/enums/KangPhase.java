package com.cardhub.engine.games.kang.domain.enums;

public enum KangPhase {

    WAITING,     // 两局之间
    BETTING,     // 闲家下注
    DEALING,     // 每人五张
    DISCARDING,  // 依次换牌（庄家最后）
    SHOWDOWN,    // 亮牌
    SETTLING,    // 结算
    FINISHED     // 本局结束，等待 endRound
}
