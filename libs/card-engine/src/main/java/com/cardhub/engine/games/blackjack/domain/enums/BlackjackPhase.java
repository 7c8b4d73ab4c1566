package com.cardhub.engine.games.blackjack.domain.enums;

public enum BlackjackPhase {

    WAITING,      // 两局之间
    BETTING,      // 下注
    DEALING,      // 每人两张，庄家两张（一张暗牌）
    PLAYER_TURN,  // 玩家逐手行动
    DEALER_TURN,  // 庄家补到 17
    SETTLING,     // 结算
    FINISHED      // 本局结束，等待 endRound
}
