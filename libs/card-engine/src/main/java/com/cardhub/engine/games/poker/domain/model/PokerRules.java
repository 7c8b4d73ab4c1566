package com.cardhub.engine.games.poker.domain.model;

/**
 * 德州桌规：盲注、起始筹码、人数。
 */
public record PokerRules(int smallBlind, int bigBlind, int startingChips, int minPlayers, int maxPlayers) {

    public PokerRules {
        if (smallBlind <= 0 || bigBlind < smallBlind) {
            throw new IllegalArgumentException("盲注非法: " + smallBlind + "/" + bigBlind);
        }
        if (startingChips < bigBlind) {
            throw new IllegalArgumentException("起始筹码不足一个大盲: " + startingChips);
        }
        if (minPlayers < 2 || maxPlayers < minPlayers) {
            throw new IllegalArgumentException("人数范围非法: " + minPlayers + ".." + maxPlayers);
        }
    }

    public static PokerRules defaults() {
        return new PokerRules(5, 10, 1000, 2, 9);
    }
}
