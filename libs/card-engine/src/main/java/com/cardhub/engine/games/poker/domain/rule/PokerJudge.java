package com.cardhub.engine.games.poker.domain.rule;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Combinations;
import com.cardhub.engine.games.poker.domain.enums.PokerHandRank;
import com.cardhub.engine.games.poker.domain.model.PokerHand;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 德州扑克牌力评估（纯函数）。
 * 1) 枚举 2 张底牌 + 至多 5 张公共牌中的全部 5 张组合；
 * 2) 每个组合按 10 种牌型判定，A 可作 14 或在 A-2-3-4-5 中作 1；
 * 3) 取总序最大者：先比牌型，再逐个比较 tiebreak。
 * 不足 5 张（翻牌前）只按同点分组判定，不考虑顺子/同花。
 */
public final class PokerJudge {

    private PokerJudge() {
    }

    /** 点数：A = 14 */
    public static int value(Card c) {
        return c.isAce() ? 14 : c.rank();
    }

    /** 从 1..7 张牌里取最佳五张 */
    public static PokerHand best(List<Card> cards) {
        if (cards.isEmpty() || cards.size() > 7) {
            throw new IllegalArgumentException("评估牌数须为 1..7: " + cards.size());
        }
        if (cards.size() < 5) {
            return evaluateGroups(cards);
        }
        PokerHand best = null;
        for (List<Card> five : Combinations.of(cards, 5)) {
            PokerHand h = evaluateFive(five);
            if (best == null || h.compareTo(best) > 0) best = h;
        }
        return best;
    }

    public static PokerHand best(List<Card> hole, List<Card> community) {
        List<Card> all = new ArrayList<>(hole);
        all.addAll(community);
        return best(all);
    }

    /** 恰好五张的判定 */
    public static PokerHand evaluateFive(List<Card> five) {
        if (five.size() != 5) {
            throw new IllegalArgumentException("需要恰好 5 张: " + five.size());
        }
        boolean flush = five.stream().allMatch(c -> c.suit() == five.get(0).suit());
        int straightTop = straightTop(five);

        if (flush && straightTop > 0) {
            PokerHandRank r = straightTop == 14 ? PokerHandRank.ROYAL_FLUSH : PokerHandRank.STRAIGHT_FLUSH;
            return new PokerHand(r, List.of(straightTop), five);
        }
        PokerHand grouped = evaluateGroups(five);
        PokerHandRank g = grouped.rank();
        if (g == PokerHandRank.FOUR_OF_A_KIND || g == PokerHandRank.FULL_HOUSE) {
            return grouped;
        }
        if (flush) {
            return new PokerHand(PokerHandRank.FLUSH, grouped.tiebreak(), five);
        }
        if (straightTop > 0) {
            return new PokerHand(PokerHandRank.STRAIGHT, List.of(straightTop), five);
        }
        return grouped;
    }

    /** 人读描述，如 "Full House, Kings full of Aces" */
    public static String describe(PokerHand hand) {
        List<Integer> t = hand.tiebreak();
        return switch (hand.rank()) {
            case ROYAL_FLUSH -> "Royal Flush";
            case STRAIGHT_FLUSH -> "Straight Flush, " + name(t.get(0)) + " high";
            case FOUR_OF_A_KIND -> "Four of a Kind, " + plural(t.get(0));
            case FULL_HOUSE -> "Full House, " + plural(t.get(0)) + " full of " + plural(t.get(1));
            case FLUSH -> "Flush, " + name(t.get(0)) + " high";
            case STRAIGHT -> "Straight, " + name(t.get(0)) + " high";
            case THREE_OF_A_KIND -> "Three of a Kind, " + plural(t.get(0));
            case TWO_PAIR -> "Two Pair, " + plural(t.get(0)) + " and " + plural(t.get(1));
            case ONE_PAIR -> "Pair of " + plural(t.get(0));
            case HIGH_CARD -> "High Card, " + name(t.get(0));
        };
    }

    // ----------- private helpers -----------

    /**
     * 按同点张数分组判定（对子/两对/三条/葫芦/四条/高牌）。
     * tiebreak：张数降序，同张数点数降序，每个点数只出现一次。
     */
    private static PokerHand evaluateGroups(List<Card> cards) {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (Card c : cards) counts.merge(value(c), 1, Integer::sum);

        List<Map.Entry<Integer, Integer>> groups = new ArrayList<>(counts.entrySet());
        groups.sort((a, b) -> a.getValue().equals(b.getValue())
                ? Integer.compare(b.getKey(), a.getKey())
                : Integer.compare(b.getValue(), a.getValue()));

        List<Integer> tiebreak = new ArrayList<>();
        for (Map.Entry<Integer, Integer> e : groups) tiebreak.add(e.getKey());

        int top = groups.get(0).getValue();
        int second = groups.size() > 1 ? groups.get(1).getValue() : 0;
        PokerHandRank rank;
        if (top == 4) rank = PokerHandRank.FOUR_OF_A_KIND;
        else if (top == 3 && second >= 2) rank = PokerHandRank.FULL_HOUSE;
        else if (top == 3) rank = PokerHandRank.THREE_OF_A_KIND;
        else if (top == 2 && second == 2) rank = PokerHandRank.TWO_PAIR;
        else if (top == 2) rank = PokerHandRank.ONE_PAIR;
        else rank = PokerHandRank.HIGH_CARD;
        return new PokerHand(rank, tiebreak, cards);
    }

    /** 顺子顶张；A-2-3-4-5 记 5；不是顺子返回 0 */
    private static int straightTop(List<Card> five) {
        int[] v = five.stream().mapToInt(PokerJudge::value).sorted().distinct().toArray();
        if (v.length != 5) return 0;
        if (v[4] - v[0] == 4) return v[4];
        if (v[4] == 14 && v[0] == 2 && v[3] == 5) return 5;
        return 0;
    }

    private static String name(int v) {
        return switch (v) {
            case 14 -> "Ace";
            case 13 -> "King";
            case 12 -> "Queen";
            case 11 -> "Jack";
            case 10 -> "Ten";
            case 9 -> "Nine";
            case 8 -> "Eight";
            case 7 -> "Seven";
            case 6 -> "Six";
            case 5 -> "Five";
            case 4 -> "Four";
            case 3 -> "Three";
            default -> "Two";
        };
    }

    private static String plural(int v) {
        return v == 6 ? "Sixes" : name(v) + "s";
    }
}
