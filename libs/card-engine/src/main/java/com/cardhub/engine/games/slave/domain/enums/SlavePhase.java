package com.cardhub.engine.games.slave.domain.enums;

public enum SlavePhase {

    WAITING,   // 两局之间
    DEALING,   // 整副牌轮流发完
    PLAYING,   // 出牌 / 过
    FINISHED   // 已排定名次
}
