package com.cardhub.engine.games.pokdeng.domain.model;

/**
 * 博丁桌规：下注上下限、起始筹码、人数上限。
 */
public record PokDengRules(int minBet, int maxBet, int startingChips, int minPlayers, int maxPlayers) {

    public PokDengRules {
        if (minBet <= 0 || maxBet < minBet) {
            throw new IllegalArgumentException("下注范围非法: " + minBet + ".." + maxBet);
        }
        if (minPlayers < 2 || maxPlayers < minPlayers) {
            throw new IllegalArgumentException("人数范围非法: " + minPlayers + ".." + maxPlayers);
        }
    }

    public static PokDengRules defaults() {
        return new PokDengRules(10, 100, 1000, 2, 9);
    }
}
