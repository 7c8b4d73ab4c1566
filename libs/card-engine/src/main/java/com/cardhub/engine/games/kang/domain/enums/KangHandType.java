package com.cardhub.engine.games.kang.domain.enums;

/**
 * 五张牌型，按强弱升序；四条并入 TONG。
 */
public enum KangHandType {

    HIGH_CARD(1),
    PAIR(1),
    TWO_PAIR(2),
    STRAIGHT(2),
    FLUSH(2),
    TONG(3),
    KANG(3),
    STRAIGHT_FLUSH(5);

    private final int multiplier;

    KangHandType(int multiplier) {
        this.multiplier = multiplier;
    }

    public int multiplier() {
        return multiplier;
    }
}
