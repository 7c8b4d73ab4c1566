package com.cardhub.engine.games.kang.domain.model;

public record KangRules(int minBet, int maxBet, int startingChips, int minPlayers, int maxPlayers) {

    public KangRules {
        if (minBet <= 0 || maxBet < minBet) {
            throw new IllegalArgumentException("下注范围非法: " + minBet + ".." + maxBet);
        }
        if (minPlayers < 2 || maxPlayers < minPlayers) {
            throw new IllegalArgumentException("人数范围非法: " + minPlayers + ".." + maxPlayers);
        }
    }

    public static KangRules defaults() {
        return new KangRules(10, 100, 1000, 2, 6);
    }
}
