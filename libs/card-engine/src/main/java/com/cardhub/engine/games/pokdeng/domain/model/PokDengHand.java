package com.cardhub.engine.games.pokdeng.domain.model;

import com.cardhub.engine.games.pokdeng.domain.enums.PokDengHandType;

/**
 * 一手牌的判定结果（点数、牌型、是否博）。
 */
public record PokDengHand(int points, PokDengHandType type, boolean pok) {

    public int multiplier() {
        return type.multiplier();
    }
}
