package com.cardhub.engine.card;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeckTest {

    private static Set<Card> allCards(Deck deck) {
        DeckSnapshot s = deck.snapshot();
        Set<Card> all = new HashSet<>(s.cards());
        all.addAll(s.dealtCards());
        return all;
    }

    @Test
    @DisplayName("一副牌 52 张互不相同")
    void singleDeckHas52DistinctCards() {
        Deck deck = new Deck(1, new Random(1));
        assertThat(deck.remaining()).isEqualTo(52);
        assertThat(allCards(deck)).hasSize(52);
    }

    @Test
    @DisplayName("多副牌用 deckIndex 区分同花同点")
    void multiDeckDistinguishesCopies() {
        Deck deck = new Deck(6, new Random(1));
        assertThat(deck.size()).isEqualTo(312);
        assertThat(allCards(deck)).hasSize(312);
    }

    @Test
    @DisplayName("发牌、回收、重置前后牌的总集合不变")
    void conservationAcrossOperations() {
        Deck deck = new Deck(1, new Random(7));
        Set<Card> before = allCards(deck);
        deck.shuffle();
        List<Card> hand = deck.dealMany(10);
        assertThat(hand).hasSize(10);
        assertThat(deck.remaining()).isEqualTo(42);
        assertThat(deck.dealtCount()).isEqualTo(10);
        assertThat(allCards(deck)).isEqualTo(before);

        deck.recycle(hand.subList(0, 4));
        assertThat(deck.remaining()).isEqualTo(46);
        assertThat(allCards(deck)).isEqualTo(before);

        deck.reset();
        assertThat(deck.remaining()).isEqualTo(52);
        assertThat(deck.dealtCount()).isZero();
        assertThat(allCards(deck)).isEqualTo(before);
    }

    @Test
    @DisplayName("空牌堆 deal 返回 empty，draw 抛 DeckExhaustedException")
    void exhaustion() {
        Deck deck = new Deck(1, new Random(3));
        assertThat(deck.dealMany(60)).hasSize(52);
        assertThat(deck.isEmpty()).isTrue();
        assertThat(deck.deal()).isEmpty();
        assertThatThrownBy(deck::draw)
                .isInstanceOf(DeckExhaustedException.class)
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("回收未发出的牌视为调用错误")
    void recycleUndealtCardFails() {
        Deck deck = new Deck(1, new Random(3));
        assertThatThrownBy(() -> deck.recycle(List.of(Card.of(Suit.SPADE, Card.ACE))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("同一种子洗出相同顺序")
    void seededShuffleIsDeterministic() {
        Deck a = new Deck(1, new Random(42));
        Deck b = new Deck(1, new Random(42));
        a.shuffle();
        b.shuffle();
        assertThat(a.dealMany(52)).containsExactlyElementsOf(b.dealMany(52));
    }

    @Test
    @DisplayName("从快照恢复后继续发出同样的牌")
    void restoreFromSnapshot() {
        Deck deck = new Deck(1, new Random(5));
        deck.shuffle();
        deck.dealMany(5);
        Deck copy = Deck.restore(deck.snapshot(), new Random(99));
        assertThat(copy.remaining()).isEqualTo(47);
        assertThat(copy.dealtCount()).isEqualTo(5);
        List<Card> fromOriginal = new ArrayList<>(deck.dealMany(3));
        assertThat(copy.dealMany(3)).containsExactlyElementsOf(fromOriginal);
    }

    @Test
    @DisplayName("牌面展示")
    void labels() {
        assertThat(Card.of(Suit.SPADE, Card.ACE).label()).isEqualTo("A♠");
        assertThat(Card.of(Suit.HEART, 10).label()).isEqualTo("10♥");
        assertThatThrownBy(() -> Card.of(Suit.CLUB, 14)).isInstanceOf(IllegalArgumentException.class);
    }
}
