package com.cardhub.engine.games.slave.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.games.slave.domain.enums.PlayType;

import java.util.List;

/**
 * 桌面上的一手牌。value 为这手牌中最大一张的比较值。
 */
public record SlavePlay(List<Card> cards, PlayType type, int value, String playerId) {

    public SlavePlay {
        cards = List.copyOf(cards);
    }
}
