package com.cardhub.engine.games.poker.domain.rule;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Suit;
import com.cardhub.engine.games.poker.domain.enums.PokerHandRank;
import com.cardhub.engine.games.poker.domain.model.PokerHand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cardhub.engine.card.Suit.CLUB;
import static com.cardhub.engine.card.Suit.DIAMOND;
import static com.cardhub.engine.card.Suit.HEART;
import static com.cardhub.engine.card.Suit.SPADE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PokerJudgeTest {

    private static Card c(Suit s, int r) {
        return Card.of(s, r);
    }

    @Test
    @DisplayName("任意花色的 10-J-Q-K-A 同花都是皇家同花顺")
    void royalFlushForEverySuit() {
        for (Suit s : Suit.values()) {
            PokerHand h = PokerJudge.evaluateFive(List.of(c(s, 10), c(s, 11), c(s, 12), c(s, 13), c(s, 1)));
            assertThat(h.rank()).isEqualTo(PokerHandRank.ROYAL_FLUSH);
            assertThat(PokerJudge.describe(h)).isEqualTo("Royal Flush");
        }
    }

    @Test
    @DisplayName("A-2-3-4-5 为顺子，顶张记 5，小于 2-6 顺")
    void wheel() {
        PokerHand wheel = PokerJudge.evaluateFive(List.of(c(SPADE, 1), c(HEART, 2), c(CLUB, 3), c(DIAMOND, 4), c(SPADE, 5)));
        PokerHand six = PokerJudge.evaluateFive(List.of(c(SPADE, 6), c(HEART, 2), c(CLUB, 3), c(DIAMOND, 4), c(SPADE, 5)));
        assertThat(wheel.rank()).isEqualTo(PokerHandRank.STRAIGHT);
        assertThat(wheel.tiebreak()).containsExactly(5);
        assertThat(wheel).isLessThan(six);

        PokerHand steelWheel = PokerJudge.evaluateFive(List.of(c(HEART, 1), c(HEART, 2), c(HEART, 3), c(HEART, 4), c(HEART, 5)));
        assertThat(steelWheel.rank()).isEqualTo(PokerHandRank.STRAIGHT_FLUSH);
        assertThat(PokerJudge.describe(steelWheel)).isEqualTo("Straight Flush, Five high");
    }

    @Test
    @DisplayName("Q-K-A-2-3 不是顺子")
    void noWrapAround() {
        PokerHand h = PokerJudge.evaluateFive(List.of(c(SPADE, 12), c(HEART, 13), c(CLUB, 1), c(DIAMOND, 2), c(SPADE, 3)));
        assertThat(h.rank()).isEqualTo(PokerHandRank.HIGH_CARD);
    }

    @Test
    @DisplayName("七张取最佳五张：葫芦优先于同花")
    void bestOfSeven() {
        List<Card> hole = List.of(c(HEART, 13), c(SPADE, 13));
        List<Card> board = List.of(c(HEART, 2), c(HEART, 7), c(HEART, 9), c(CLUB, 13), c(DIAMOND, 9));
        PokerHand h = PokerJudge.best(hole, board);
        assertThat(h.rank()).isEqualTo(PokerHandRank.FULL_HOUSE);
        assertThat(h.tiebreak()).containsExactly(13, 9);
        assertThat(h.cards()).hasSize(5);
        assertThat(PokerJudge.describe(h)).isEqualTo("Full House, Kings full of Nines");
    }

    @Test
    @DisplayName("同牌型比踢脚")
    void kickers() {
        PokerHand aceKicker = PokerJudge.evaluateFive(List.of(c(SPADE, 8), c(HEART, 8), c(CLUB, 1), c(DIAMOND, 4), c(SPADE, 3)));
        PokerHand kingKicker = PokerJudge.evaluateFive(List.of(c(CLUB, 8), c(DIAMOND, 8), c(CLUB, 13), c(HEART, 4), c(HEART, 3)));
        assertThat(aceKicker.rank()).isEqualTo(PokerHandRank.ONE_PAIR);
        assertThat(aceKicker).isGreaterThan(kingKicker);
        assertThat(PokerJudge.describe(aceKicker)).isEqualTo("Pair of Eights");
    }

    @Test
    @DisplayName("两对、三条、四条的判定")
    void groupedRanks() {
        assertThat(PokerJudge.evaluateFive(List.of(c(SPADE, 6), c(HEART, 6), c(CLUB, 4), c(DIAMOND, 4), c(SPADE, 2))).rank())
                .isEqualTo(PokerHandRank.TWO_PAIR);
        assertThat(PokerJudge.evaluateFive(List.of(c(SPADE, 6), c(HEART, 6), c(CLUB, 6), c(DIAMOND, 4), c(SPADE, 2))).rank())
                .isEqualTo(PokerHandRank.THREE_OF_A_KIND);
        PokerHand quads = PokerJudge.evaluateFive(List.of(c(SPADE, 6), c(HEART, 6), c(CLUB, 6), c(DIAMOND, 6), c(SPADE, 2)));
        assertThat(quads.rank()).isEqualTo(PokerHandRank.FOUR_OF_A_KIND);
        assertThat(PokerJudge.describe(quads)).isEqualTo("Four of a Kind, Sixes");
    }

    @Test
    @DisplayName("翻牌前两张底牌只按对子/高牌判定")
    void preflop() {
        assertThat(PokerJudge.best(List.of(c(SPADE, 1), c(HEART, 1))).rank()).isEqualTo(PokerHandRank.ONE_PAIR);
        assertThat(PokerJudge.best(List.of(c(SPADE, 1), c(SPADE, 13))).rank()).isEqualTo(PokerHandRank.HIGH_CARD);
        assertThatThrownBy(() -> PokerJudge.best(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
