package com.cardhub.engine.card;

import java.util.List;

/**
 * 牌堆的扁平快照，随状态一起传输。
 * cards 为未发牌序列（末尾是牌顶），dealtCards 为已发出的牌。
 */
public record DeckSnapshot(int decks, List<Card> cards, List<Card> dealtCards) {

    public DeckSnapshot {
        cards = cards == null ? List.of() : List.copyOf(cards);
        dealtCards = dealtCards == null ? List.of() : List.copyOf(dealtCards);
    }
}
