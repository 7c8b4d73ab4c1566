package com.cardhub.engine.games.kang.domain.rule;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Suit;
import com.cardhub.engine.games.kang.domain.enums.KangHandType;
import com.cardhub.engine.games.kang.domain.model.KangHand;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cardhub.engine.card.Suit.CLUB;
import static com.cardhub.engine.card.Suit.DIAMOND;
import static com.cardhub.engine.card.Suit.HEART;
import static com.cardhub.engine.card.Suit.SPADE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KangJudgeTest {

    private static Card c(Suit s, int r) {
        return Card.of(s, r);
    }

    private static final List<Card> FULL_HOUSE = List.of(c(SPADE, 9), c(HEART, 9), c(CLUB, 9), c(SPADE, 4), c(HEART, 4));
    private static final List<Card> FLUSH = List.of(c(HEART, 2), c(HEART, 6), c(HEART, 9), c(HEART, 11), c(HEART, 13));
    private static final List<Card> PAIR_OF_TENS = List.of(c(SPADE, 10), c(HEART, 10), c(CLUB, 3), c(DIAMOND, 5), c(SPADE, 8));
    private static final List<Card> PAIR_OF_FIVES = List.of(c(SPADE, 5), c(HEART, 5), c(CLUB, 3), c(DIAMOND, 12), c(SPADE, 8));

    @Test
    @DisplayName("德州牌型折算：葫芦为 KANG，三条/四条为 TONG，皇家并入同花顺")
    void mapping() {
        assertThat(KangJudge.evaluate(FULL_HOUSE).type()).isEqualTo(KangHandType.KANG);
        assertThat(KangJudge.evaluate(List.of(c(SPADE, 9), c(HEART, 9), c(CLUB, 9), c(DIAMOND, 9), c(HEART, 4))).type())
                .isEqualTo(KangHandType.TONG);
        assertThat(KangJudge.evaluate(List.of(c(SPADE, 9), c(HEART, 9), c(CLUB, 9), c(DIAMOND, 2), c(HEART, 4))).type())
                .isEqualTo(KangHandType.TONG);
        assertThat(KangJudge.evaluate(List.of(c(SPADE, 10), c(SPADE, 11), c(SPADE, 12), c(SPADE, 13), c(SPADE, 1))).type())
                .isEqualTo(KangHandType.STRAIGHT_FLUSH);
        assertThat(KangJudge.evaluate(FLUSH).type()).isEqualTo(KangHandType.FLUSH);
        assertThat(KangJudge.evaluate(PAIR_OF_TENS).type()).isEqualTo(KangHandType.PAIR);
    }

    @Test
    @DisplayName("手牌必须恰好五张")
    void handSize() {
        assertThatThrownBy(() -> KangJudge.evaluate(FLUSH.subList(0, 4))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("牌型更大按闲家牌型倍数赔，同牌型比踢脚各 1 倍")
    void payout() {
        KangHand flush = KangJudge.evaluate(FLUSH);
        KangHand tens = KangJudge.evaluate(PAIR_OF_TENS);
        KangHand fives = KangJudge.evaluate(PAIR_OF_FIVES);
        KangHand kang = KangJudge.evaluate(FULL_HOUSE);

        assertThat(KangJudge.payout(flush, tens, 10)).isEqualTo(10 * KangHandType.FLUSH.multiplier());
        assertThat(KangJudge.payout(kang, flush, 10)).isEqualTo(30);
        assertThat(KangJudge.payout(tens, flush, 10)).isEqualTo(-10);
        assertThat(KangJudge.payout(tens, fives, 10)).isEqualTo(10);
        assertThat(KangJudge.payout(fives, tens, 10)).isEqualTo(-10);
        assertThat(KangJudge.payout(tens, tens, 10)).isZero();
    }
}
