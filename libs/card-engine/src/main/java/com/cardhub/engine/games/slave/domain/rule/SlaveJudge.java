package com.cardhub.engine.games.slave.domain.rule;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Combinations;
import com.cardhub.engine.games.slave.domain.enums.PlayType;
import com.cardhub.engine.games.slave.domain.enums.SlavePreset;
import com.cardhub.engine.games.slave.domain.model.SlavePlay;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 大富豪（奴隶）出牌判定（纯函数）。
 * 两种“大小”必须分开：
 * - rankValue：只看点数（3=1 … K=11，A=12，2=13），用于分组、判型、找顺子；
 * - cardValue：比较用，rankValue×10 + 花色（按桌规决定是否计花色）。
 */
public final class SlaveJudge {

    /** 2 的点数值，顺子里不允许出现 */
    public static final int TWO_VALUE = 13;

    public static final int MIN_STRAIGHT = 3;

    private SlaveJudge() {
    }

    public static int rankValue(Card c) {
        return switch (c.rank()) {
            case 1 -> 12;
            case 2 -> TWO_VALUE;
            default -> c.rank() - 2;
        };
    }

    public static int cardValue(Card c, SlavePreset preset) {
        return rankValue(c) * 10 + (preset.suitTieBreak() ? c.suit().order() : 0);
    }

    /** 一手牌的比较值：其中最大一张 */
    public static int playValue(List<Card> cards, SlavePreset preset) {
        int max = 0;
        for (Card c : cards) max = Math.max(max, cardValue(c, preset));
        return max;
    }

    /** 判型，不成型返回 empty */
    public static Optional<PlayType> playType(List<Card> cards) {
        int n = cards.size();
        if (n == 0) return Optional.empty();
        if (n == 1) return Optional.of(PlayType.SINGLE);

        int[] ranks = cards.stream().mapToInt(SlaveJudge::rankValue).sorted().toArray();
        boolean sameRank = ranks[0] == ranks[n - 1];
        if (sameRank) {
            return switch (n) {
                case 2 -> Optional.of(PlayType.PAIR);
                case 3 -> Optional.of(PlayType.TRIPLE);
                case 4 -> Optional.of(PlayType.QUADRUPLE);
                default -> Optional.empty();
            };
        }
        if (n >= MIN_STRAIGHT && ranks[n - 1] != TWO_VALUE) {
            for (int i = 1; i < n; i++) {
                if (ranks[i] - ranks[i - 1] != 1) return Optional.empty();
            }
            return Optional.of(PlayType.STRAIGHT);
        }
        return Optional.empty();
    }

    /** 组装成桌面牌；不成型返回 empty */
    public static Optional<SlavePlay> toPlay(List<Card> cards, String playerId, SlavePreset preset) {
        return playType(cards).map(t -> new SlavePlay(cards, t, playValue(cards, preset), playerId));
    }

    /**
     * candidate 能否压过桌面上的 table。
     * 1) 桌面为空：只要成型即可；
     * 2) 同型：顺子须等长，比较值必须严格更大；
     * 3) 异型：按桌规看三条/四条能否越级。
     */
    public static boolean beats(List<Card> candidate, SlavePlay table, SlavePreset preset) {
        Optional<PlayType> type = playType(candidate);
        if (type.isEmpty()) return false;
        if (table == null) return true;

        PlayType mine = type.get();
        PlayType theirs = table.type();
        int value = playValue(candidate, preset);
        if (mine == theirs) {
            if (mine == PlayType.STRAIGHT && candidate.size() != table.cards().size()) return false;
            return value > table.value();
        }
        if (mine == PlayType.QUADRUPLE) {
            if (preset.bombBeatsAnyType()) return true;
            return theirs == PlayType.SINGLE || theirs == PlayType.PAIR;
        }
        return mine == PlayType.TRIPLE && theirs == PlayType.SINGLE && preset.tripleBeatsSingle();
    }

    /** 同点数分组，每组取全部 size 张组合 */
    public static List<List<Card>> groups(List<Card> hand, int size) {
        List<List<Card>> out = new ArrayList<>();
        for (List<Card> sameRank : byRank(hand).values()) {
            out.addAll(Combinations.of(sameRank, size));
        }
        return out;
    }

    /**
     * 所有长度 ≥ minLength 的顺子（不含 2）。
     * 在每段连续点数上枚举全部子段，每个点数取比较值最大的那张。
     */
    public static List<List<Card>> straights(List<Card> hand, int minLength, SlavePreset preset) {
        TreeMap<Integer, Card> highest = new TreeMap<>();
        for (Card c : hand) {
            int r = rankValue(c);
            if (r == TWO_VALUE) continue;
            Card cur = highest.get(r);
            if (cur == null || cardValue(c, preset) > cardValue(cur, preset)) highest.put(r, c);
        }
        List<Integer> ranks = new ArrayList<>(highest.keySet());
        List<List<Card>> out = new ArrayList<>();
        int i = 0;
        while (i < ranks.size()) {
            int j = i;
            while (j + 1 < ranks.size() && ranks.get(j + 1) == ranks.get(j) + 1) j++;
            int runLen = j - i + 1;
            for (int len = minLength; len <= runLen; len++) {
                for (int start = i; start + len <= j + 1; start++) {
                    List<Card> straight = new ArrayList<>(len);
                    for (int k = start; k < start + len; k++) straight.add(highest.get(ranks.get(k)));
                    out.add(straight);
                }
            }
            i = j + 1;
        }
        return out;
    }

    /** 手上所有成型的出法：单张、对、三条、四条、顺子 */
    public static List<List<Card>> allGroupings(List<Card> hand, SlavePreset preset) {
        List<List<Card>> out = new ArrayList<>();
        for (Card c : hand) out.add(List.of(c));
        for (int size = 2; size <= 4; size++) out.addAll(groups(hand, size));
        out.addAll(straights(hand, MIN_STRAIGHT, preset));
        return out;
    }

    /** 能压过桌面的全部出法 */
    public static List<List<Card>> playableOptions(List<Card> hand, SlavePlay table, SlavePreset preset) {
        return allGroupings(hand, preset).stream()
                .filter(g -> beats(g, table, preset))
                .toList();
    }

    /** 手牌按比较值升序 */
    public static void sortHand(List<Card> hand, SlavePreset preset) {
        hand.sort(Comparator.comparingInt((Card c) -> cardValue(c, preset)).thenComparingInt(c -> c.suit().order()));
    }

    // ----------- private helpers -----------

    private static Map<Integer, List<Card>> byRank(List<Card> hand) {
        Map<Integer, List<Card>> m = new TreeMap<>();
        for (Card c : hand) m.computeIfAbsent(rankValue(c), k -> new ArrayList<>()).add(c);
        return m;
    }
}
