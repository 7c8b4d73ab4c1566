package com.cardhub.engine.games.poker.domain.enums;

/**
 * 德州牌型，按强弱升序。
 */
public enum PokerHandRank {

    HIGH_CARD("High Card"),
    ONE_PAIR("One Pair"),
    TWO_PAIR("Two Pair"),
    THREE_OF_A_KIND("Three of a Kind"),
    STRAIGHT("Straight"),
    FLUSH("Flush"),
    FULL_HOUSE("Full House"),
    FOUR_OF_A_KIND("Four of a Kind"),
    STRAIGHT_FLUSH("Straight Flush"),
    ROYAL_FLUSH("Royal Flush");

    private final String title;

    PokerHandRank(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }
}
