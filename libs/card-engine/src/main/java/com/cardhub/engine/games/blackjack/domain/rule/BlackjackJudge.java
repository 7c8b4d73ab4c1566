package com.cardhub.engine.games.blackjack.domain.rule;

import com.cardhub.engine.card.Card;

import java.util.List;

/**
 * 21 点点数计算。A 先按 11 计，爆了再逐张降为 1。
 */
public final class BlackjackJudge {

    public static final int BLACKJACK = 21;
    public static final int DEALER_STANDS_ON = 17;

    private BlackjackJudge() {
    }

    public static int handValue(List<Card> cards) {
        int value = 0;
        int aces = 0;
        for (Card c : cards) {
            if (c.isAce()) {
                aces++;
                value += 11;
            } else {
                value += Math.min(c.rank(), 10);
            }
        }
        while (value > BLACKJACK && aces > 0) {
            value -= 10;
            aces--;
        }
        return value;
    }

    /** 软点：还有一张 A 按 11 计 */
    public static boolean isSoft(List<Card> cards) {
        int hard = 0;
        boolean hasAce = false;
        for (Card c : cards) {
            hard += c.isAce() ? 1 : Math.min(c.rank(), 10);
            hasAce |= c.isAce();
        }
        return hasAce && hard + 10 <= BLACKJACK;
    }

    public static boolean isBlackjack(List<Card> cards) {
        return cards.size() == 2 && handValue(cards) == BLACKJACK;
    }

    public static boolean isBust(List<Card> cards) {
        return handValue(cards) > BLACKJACK;
    }

    /** 庄家 17 点以下必须要牌（软 17 停） */
    public static boolean dealerShouldHit(List<Card> cards) {
        return handValue(cards) < DEALER_STANDS_ON;
    }

    public static boolean canSplit(List<Card> cards) {
        return cards.size() == 2 && cards.get(0).rank() == cards.get(1).rank();
    }
}
