package com.cardhub.engine.games.pokdeng.domain.enums;

/**
 * 牌型，按 priority 升序排列，multiplier 为赔率倍数。
 */
public enum PokDengHandType {

    NORMAL(0, 1),
    PAIR(1, 2),
    POK8(2, 2),
    POK9(3, 2),
    FLUSH(4, 3),
    STRAIGHT(5, 3),
    TONG(6, 5),
    STRAIGHT_FLUSH(7, 5);

    private final int priority;
    private final int multiplier;

    PokDengHandType(int priority, int multiplier) {
        this.priority = priority;
        this.multiplier = multiplier;
    }

    public int priority() {
        return priority;
    }

    public int multiplier() {
        return multiplier;
    }
}
