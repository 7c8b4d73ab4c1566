package com.cardhub.engine.games.poker.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.games.poker.domain.enums.PokerHandRank;

import java.util.List;

/**
 * 评估结果：牌型 + 比较序列 + 组成最佳牌的五张。
 * tiebreak 为按“同点张数降序、点数降序”排好的点数（A=14，轮子顺子的顶张记 5）。
 */
public record PokerHand(PokerHandRank rank, List<Integer> tiebreak, List<Card> cards)
        implements Comparable<PokerHand> {

    public PokerHand {
        tiebreak = List.copyOf(tiebreak);
        cards = List.copyOf(cards);
    }

    @Override
    public int compareTo(PokerHand o) {
        int c = Integer.compare(rank.ordinal(), o.rank.ordinal());
        if (c != 0) return c;
        int n = Math.min(tiebreak.size(), o.tiebreak.size());
        for (int i = 0; i < n; i++) {
            c = Integer.compare(tiebreak.get(i), o.tiebreak.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(tiebreak.size(), o.tiebreak.size());
    }
}
