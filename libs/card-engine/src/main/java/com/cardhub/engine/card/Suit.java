package com.cardhub.engine.card;

/**
 * 花色。order 为比较用的花色大小：梅花 < 方块 < 红桃 < 黑桃。
 */
public enum Suit {

    CLUB(1, "♣"),
    DIAMOND(2, "♦"),
    HEART(3, "♥"),
    SPADE(4, "♠");

    private final int order;
    private final String symbol;

    Suit(int order, String symbol) {
        this.order = order;
        this.symbol = symbol;
    }

    public int order() {
        return order;
    }

    public String symbol() {
        return symbol;
    }
}
