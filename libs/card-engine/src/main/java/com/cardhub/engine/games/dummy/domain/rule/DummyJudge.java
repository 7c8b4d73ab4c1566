package com.cardhub.engine.games.dummy.domain.rule;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Combinations;
import com.cardhub.engine.card.Suit;
import com.cardhub.engine.games.dummy.domain.enums.MeldType;
import com.cardhub.engine.games.dummy.domain.model.Meld;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 组牌（Dummy）规则判定。
 * 死木点数：A=15，2..9=5，10/J/Q/K=10。
 */
public final class DummyJudge {

    public static final int KNOCK_LIMIT = 10;
    public static final int UNDERCUT_PENALTY = 10;
    public static final int DUMMY_BONUS = 50;

    private DummyJudge() {
    }

    public static int cardPoints(Card c) {
        if (c.isAce()) return 15;
        return c.rank() >= 10 ? 10 : 5;
    }

    public static int deadwood(List<Card> hand) {
        int sum = 0;
        for (Card c : hand) sum += cardPoints(c);
        return sum;
    }

    /** 3-4 张同点且花色互不相同 */
    public static boolean isSet(List<Card> cards) {
        if (cards.size() < 3 || cards.size() > 4) return false;
        int rank = cards.get(0).rank();
        long suits = cards.stream().map(Card::suit).distinct().count();
        return cards.stream().allMatch(c -> c.rank() == rank) && suits == cards.size();
    }

    /** ≥3 张同花色连续点数，A 只能当 1 */
    public static boolean isRun(List<Card> cards) {
        if (cards.size() < 3) return false;
        Suit suit = cards.get(0).suit();
        if (cards.stream().anyMatch(c -> c.suit() != suit)) return false;
        int[] ranks = cards.stream().mapToInt(Card::rank).sorted().toArray();
        for (int i = 1; i < ranks.length; i++) {
            if (ranks[i] != ranks[i - 1] + 1) return false;
        }
        return true;
    }

    public static Optional<MeldType> meldType(List<Card> cards) {
        if (isSet(cards)) return Optional.of(MeldType.SET);
        if (isRun(cards)) return Optional.of(MeldType.RUN);
        return Optional.empty();
    }

    /** 单张能否贴到已有的组上：同点组补花色，顺子只能接两端 */
    public static boolean canLayOff(Card card, Meld meld) {
        List<Card> cards = meld.getCards();
        if (meld.getType() == MeldType.SET) {
            return cards.size() < 4
                    && card.rank() == cards.get(0).rank()
                    && cards.stream().noneMatch(c -> c.suit() == card.suit());
        }
        if (card.suit() != cards.get(0).suit()) return false;
        int min = cards.stream().mapToInt(Card::rank).min().orElse(0);
        int max = cards.stream().mapToInt(Card::rank).max().orElse(0);
        return card.rank() == min - 1 || card.rank() == max + 1;
    }

    /**
     * 手上所有可组的牌：每个点数的 3/4 张组合，每个花色的所有连续子段（≥3）。
     */
    public static List<List<Card>> possibleMelds(List<Card> hand) {
        List<List<Card>> out = new ArrayList<>();
        Map<Integer, List<Card>> byRank = new TreeMap<>();
        for (Card c : hand) byRank.computeIfAbsent(c.rank(), k -> new ArrayList<>()).add(c);
        for (List<Card> same : byRank.values()) {
            for (int k = 3; k <= 4; k++) {
                for (List<Card> combo : Combinations.of(same, k)) {
                    if (isSet(combo)) out.add(combo);
                }
            }
        }
        for (Suit suit : Suit.values()) {
            List<Card> suited = hand.stream()
                    .filter(c -> c.suit() == suit)
                    .sorted(Comparator.comparingInt(Card::rank))
                    .toList();
            for (int i = 0; i < suited.size(); i++) {
                List<Card> run = new ArrayList<>();
                run.add(suited.get(i));
                for (int j = i + 1; j < suited.size(); j++) {
                    if (suited.get(j).rank() != run.get(run.size() - 1).rank() + 1) break;
                    run.add(suited.get(j));
                    if (run.size() >= 3) out.add(new ArrayList<>(run));
                }
            }
        }
        return out;
    }

    /** 手牌排序：先花色后点数 */
    public static void sortHand(List<Card> hand) {
        hand.sort(Comparator.comparingInt((Card c) -> c.suit().order()).thenComparingInt(Card::rank));
    }
}
