package com.cardhub.engine.games.slave.domain.enums;

/** 出牌牌型 */
public enum PlayType {
    SINGLE,
    PAIR,
    TRIPLE,
    QUADRUPLE,
    STRAIGHT
}
