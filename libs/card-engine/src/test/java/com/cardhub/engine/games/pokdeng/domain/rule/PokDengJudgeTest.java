package com.cardhub.engine.games.pokdeng.domain.rule;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Suit;
import com.cardhub.engine.games.pokdeng.domain.enums.PokDengHandType;
import com.cardhub.engine.games.pokdeng.domain.model.PokDengHand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cardhub.engine.card.Suit.CLUB;
import static com.cardhub.engine.card.Suit.DIAMOND;
import static com.cardhub.engine.card.Suit.HEART;
import static com.cardhub.engine.card.Suit.SPADE;
import static org.assertj.core.api.Assertions.assertThat;

class PokDengJudgeTest {

    private static Card c(Suit s, int r) {
        return Card.of(s, r);
    }

    @Test
    @DisplayName("点数：10/J/Q/K 记 0，总和取个位")
    void points() {
        assertThat(PokDengJudge.points(List.of(c(SPADE, 9), c(HEART, 13)))).isEqualTo(9);
        assertThat(PokDengJudge.points(List.of(c(SPADE, 7), c(HEART, 6)))).isEqualTo(3);
        assertThat(PokDengJudge.points(List.of(c(SPADE, 1), c(HEART, 10), c(CLUB, 12)))).isEqualTo(1);
    }

    @Test
    @DisplayName("两张 8/9 点为博，优先于对子")
    void pok() {
        assertThat(PokDengJudge.classify(List.of(c(SPADE, 9), c(HEART, 10)))).isEqualTo(PokDengHandType.POK9);
        assertThat(PokDengJudge.classify(List.of(c(SPADE, 5), c(HEART, 3)))).isEqualTo(PokDengHandType.POK8);
        assertThat(PokDengJudge.classify(List.of(c(SPADE, 4), c(HEART, 4)))).isEqualTo(PokDengHandType.POK8);
        assertThat(PokDengJudge.isPok(List.of(c(SPADE, 4), c(HEART, 4), c(CLUB, 10)))).isFalse();
    }

    @Test
    @DisplayName("两张同点为对子")
    void pair() {
        assertThat(PokDengJudge.classify(List.of(c(SPADE, 3), c(HEART, 3)))).isEqualTo(PokDengHandType.PAIR);
        assertThat(PokDengJudge.classify(List.of(c(SPADE, 3), c(HEART, 2)))).isEqualTo(PokDengHandType.NORMAL);
    }

    @Test
    @DisplayName("三张牌型：三条、同花顺、顺子、同花")
    void threeCardTypes() {
        assertThat(PokDengJudge.classify(List.of(c(SPADE, 3), c(HEART, 3), c(CLUB, 3)))).isEqualTo(PokDengHandType.TONG);
        assertThat(PokDengJudge.classify(List.of(c(HEART, 4), c(HEART, 6), c(HEART, 5)))).isEqualTo(PokDengHandType.STRAIGHT_FLUSH);
        assertThat(PokDengJudge.classify(List.of(c(HEART, 11), c(SPADE, 12), c(CLUB, 13)))).isEqualTo(PokDengHandType.STRAIGHT);
        assertThat(PokDengJudge.classify(List.of(c(DIAMOND, 2), c(DIAMOND, 5), c(DIAMOND, 9)))).isEqualTo(PokDengHandType.FLUSH);
        // Q-K-A 不算顺
        assertThat(PokDengJudge.classify(List.of(c(HEART, 12), c(SPADE, 13), c(CLUB, 1)))).isEqualTo(PokDengHandType.NORMAL);
    }

    @Test
    @DisplayName("比较：博 > 非博 > 点数 > 牌型")
    void compare() {
        PokDengHand pok8 = PokDengJudge.evaluate(List.of(c(SPADE, 5), c(HEART, 3)));
        PokDengHand nine3 = PokDengJudge.evaluate(List.of(c(SPADE, 2), c(HEART, 3), c(CLUB, 4)));
        assertThat(nine3.points()).isEqualTo(9);
        assertThat(PokDengJudge.compare(pok8, nine3)).isPositive();

        PokDengHand flush6 = PokDengJudge.evaluate(List.of(c(HEART, 2), c(HEART, 5), c(HEART, 9)));
        PokDengHand normal6 = PokDengJudge.evaluate(List.of(c(SPADE, 2), c(HEART, 5), c(CLUB, 9)));
        assertThat(PokDengJudge.compare(flush6, normal6)).isPositive();
        assertThat(PokDengJudge.compare(normal6, flush6)).isNegative();
        assertThat(PokDengJudge.compare(normal6, normal6)).isZero();
        assertThat(PokDengJudge.compare(nine3, flush6)).isPositive();
    }

    @Test
    @DisplayName("倍数随牌型")
    void multipliers() {
        assertThat(PokDengJudge.evaluate(List.of(c(SPADE, 3), c(HEART, 3))).multiplier()).isEqualTo(2);
        assertThat(PokDengJudge.evaluate(List.of(c(SPADE, 3), c(HEART, 3), c(CLUB, 3))).multiplier()).isEqualTo(5);
        assertThat(PokDengJudge.evaluate(List.of(c(SPADE, 2), c(HEART, 7))).multiplier()).isEqualTo(2);
        assertThat(PokDengJudge.evaluate(List.of(c(SPADE, 2), c(HEART, 6))).multiplier()).isEqualTo(1);
    }
}
