package com.cardhub.engine.games.poker.domain.enums;

public enum PokerPhase {

    WAITING,   // 两局之间
    PREFLOP,   // 盲注后第一轮下注
    FLOP,      // 三张公共牌
    TURN,      // 第四张
    RIVER,     // 第五张
    SHOWDOWN,  // 摊牌比牌
    SETTLING,  // 分配底池
    FINISHED   // 本手结束，等待 endRound
}
