package com.cardhub.engine.games.blackjack.domain.model;

/**
 * 21 点桌规：鞋中副数、洗牌线、下注范围、人数。
 */
public record BlackjackRules(int decks, int reshuffleThreshold, int minBet, int maxBet,
                             int startingChips, int maxPlayers, int maxHands) {

    public BlackjackRules {
        if (decks < 1 || reshuffleThreshold < 0) {
            throw new IllegalArgumentException("牌鞋配置非法: decks=" + decks + " threshold=" + reshuffleThreshold);
        }
        if (minBet <= 0 || maxBet < minBet) {
            throw new IllegalArgumentException("下注范围非法: " + minBet + ".." + maxBet);
        }
        if (maxPlayers < 1 || maxHands < 1) {
            throw new IllegalArgumentException("人数/分牌上限非法");
        }
    }

    public static BlackjackRules defaults() {
        return new BlackjackRules(6, 78, 10, 500, 1000, 7, 4);
    }
}
