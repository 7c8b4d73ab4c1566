package com.cardhub.engine.card;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * 牌堆：未发牌序列 + 已发牌序列。
 * 不变式：undealt ∪ dealt 恒等于构造时的整副（或 k 副）牌。
 * - 牌顶为 undealt 的末尾；
 * - 洗牌只作用于 undealt（Fisher–Yates）；
 * - 随机源可注入，测试里用固定种子。
 */
public class Deck {

    public static final int CARDS_PER_DECK = 52;

    private final int decks;
    private final Random random;
    private final List<Card> undealt;
    private final List<Card> dealt;

    public Deck(int decks, Random random) {
        if (decks < 1) {
            throw new IllegalArgumentException("至少需要一副牌: " + decks);
        }
        this.decks = decks;
        this.random = random == null ? new Random() : random;
        this.undealt = new ArrayList<>(decks * CARDS_PER_DECK);
        this.dealt = new ArrayList<>();
        for (int d = 0; d < decks; d++) {
            for (Suit suit : Suit.values()) {
                for (int rank = Card.ACE; rank <= Card.KING; rank++) {
                    undealt.add(new Card(suit, rank, d));
                }
            }
        }
    }

    public Deck(int decks) {
        this(decks, new Random());
    }

    private Deck(DeckSnapshot snapshot, Random random) {
        this.decks = snapshot.decks();
        this.random = random == null ? new Random() : random;
        this.undealt = new ArrayList<>(snapshot.cards());
        this.dealt = new ArrayList<>(snapshot.dealtCards());
    }

    /** 从快照恢复（镜像同步、主机重建） */
    public static Deck restore(DeckSnapshot snapshot, Random random) {
        return new Deck(snapshot, random);
    }

    /** Fisher–Yates 洗未发的牌 */
    public void shuffle() {
        for (int i = undealt.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            Collections.swap(undealt, i, j);
        }
    }

    /** 发一张；牌堆空时返回 empty，不抛异常 */
    public Optional<Card> deal() {
        if (undealt.isEmpty()) {
            return Optional.empty();
        }
        Card card = undealt.remove(undealt.size() - 1);
        dealt.add(card);
        return Optional.of(card);
    }

    /** 发一张，空堆视为配置错误直接失败（引擎内部使用） */
    public Card draw() {
        return deal().orElseThrow(() -> new DeckExhaustedException("牌堆已空"));
    }

    /** 连续发 n 张，牌堆空了就提前结束 */
    public List<Card> dealMany(int n) {
        List<Card> out = new ArrayList<>(Math.max(n, 0));
        for (int i = 0; i < n; i++) {
            Optional<Card> c = deal();
            if (c.isEmpty()) break;
            out.add(c.get());
        }
        return out;
    }

    /** 已发的牌全部收回后重洗 */
    public void reset() {
        undealt.addAll(dealt);
        dealt.clear();
        shuffle();
    }

    /**
     * 把指定的已发牌收回牌堆并重洗未发部分（弃牌堆回收）。
     * 不在已发序列里的牌视为调用错误。
     */
    public void recycle(Collection<Card> cards) {
        for (Card c : cards) {
            if (!dealt.remove(c)) {
                throw new IllegalArgumentException("该牌不在已发序列中: " + c);
            }
            undealt.add(c);
        }
        shuffle();
    }

    public DeckSnapshot snapshot() {
        return new DeckSnapshot(decks, undealt, dealt);
    }

    public int remaining() {
        return undealt.size();
    }

    public int dealtCount() {
        return dealt.size();
    }

    public boolean isEmpty() {
        return undealt.isEmpty();
    }

    public int decks() {
        return decks;
    }

    /** 构造时的总张数 */
    public int size() {
        return decks * CARDS_PER_DECK;
    }
}
