package com.cardhub.engine.games.pokdeng.domain.rule;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.games.pokdeng.domain.enums.PokDengHandType;
import com.cardhub.engine.games.pokdeng.domain.model.PokDengHand;

import java.util.List;

/**
 * 博丁规则判定（纯函数）。
 * - 点数：A=1，2..9 按面值，10/J/Q/K=0，总和取个位；
 * - 博（pok）：恰好两张且 8 或 9 点；
 * - 比较：博 > 非博；否则比点数；同点比牌型优先级。
 */
public final class PokDengJudge {

    private PokDengJudge() {
    }

    public static int cardValue(Card c) {
        return c.rank() >= 10 ? 0 : c.rank();
    }

    public static int points(List<Card> cards) {
        int sum = 0;
        for (Card c : cards) sum += cardValue(c);
        return sum % 10;
    }

    public static boolean isPok(List<Card> cards) {
        return cards.size() == 2 && points(cards) >= 8;
    }

    public static PokDengHandType classify(List<Card> cards) {
        int pts = points(cards);
        if (cards.size() == 2) {
            if (pts == 9) return PokDengHandType.POK9;
            if (pts == 8) return PokDengHandType.POK8;
            if (cards.get(0).rank() == cards.get(1).rank()) return PokDengHandType.PAIR;
            return PokDengHandType.NORMAL;
        }
        if (cards.size() == 3) {
            Card a = cards.get(0), b = cards.get(1), c = cards.get(2);
            if (a.rank() == b.rank() && b.rank() == c.rank()) return PokDengHandType.TONG;
            boolean sameSuit = a.suit() == b.suit() && b.suit() == c.suit();
            boolean sequential = isSequential(a.rank(), b.rank(), c.rank());
            if (sequential && sameSuit) return PokDengHandType.STRAIGHT_FLUSH;
            if (sequential) return PokDengHandType.STRAIGHT;
            if (sameSuit) return PokDengHandType.FLUSH;
        }
        return PokDengHandType.NORMAL;
    }

    public static PokDengHand evaluate(List<Card> cards) {
        return new PokDengHand(points(cards), classify(cards), isPok(cards));
    }

    /**
     * 比较两手牌。
     * @return 正数 a 赢，负数 b 赢，0 平
     */
    public static int compare(PokDengHand a, PokDengHand b) {
        if (a.pok() != b.pok()) {
            return a.pok() ? 1 : -1;
        }
        if (a.points() != b.points()) {
            return Integer.compare(a.points(), b.points());
        }
        return Integer.compare(a.type().priority(), b.type().priority());
    }

    // 自然点数连续，不绕 A
    private static boolean isSequential(int r1, int r2, int r3) {
        int lo = Math.min(r1, Math.min(r2, r3));
        int hi = Math.max(r1, Math.max(r2, r3));
        return hi - lo == 2 && r1 != r2 && r2 != r3 && r1 != r3;
    }
}
