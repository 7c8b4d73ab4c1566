package com.cardhub.engine.games.slave.domain.rule;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Suit;
import com.cardhub.engine.games.slave.domain.enums.PlayType;
import com.cardhub.engine.games.slave.domain.enums.SlavePreset;
import com.cardhub.engine.games.slave.domain.enums.SlaveRank;
import com.cardhub.engine.games.slave.domain.model.SlavePlay;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.cardhub.engine.card.Suit.CLUB;
import static com.cardhub.engine.card.Suit.DIAMOND;
import static com.cardhub.engine.card.Suit.HEART;
import static com.cardhub.engine.card.Suit.SPADE;
import static com.cardhub.engine.games.slave.domain.enums.SlavePreset.CLASSIC;
import static com.cardhub.engine.games.slave.domain.enums.SlavePreset.HOUSE_BOMB;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class SlaveJudgeTest {

    private static Card c(Suit s, int r) {
        return Card.of(s, r);
    }

    private static SlavePlay table(SlavePreset preset, Card... cards) {
        return SlaveJudge.toPlay(List.of(cards), "p0", preset).orElseThrow();
    }

    @Test
    @DisplayName("点数序：3 最小，2 最大")
    void rankOrder() {
        assertThat(SlaveJudge.rankValue(c(CLUB, 3))).isEqualTo(1);
        assertThat(SlaveJudge.rankValue(c(CLUB, 13))).isEqualTo(11);
        assertThat(SlaveJudge.rankValue(c(CLUB, 1))).isEqualTo(12);
        assertThat(SlaveJudge.rankValue(c(CLUB, 2))).isEqualTo(SlaveJudge.TWO_VALUE);
    }

    @Test
    @DisplayName("判型：同点组与不含 2 的顺子")
    void playTypes() {
        assertThat(SlaveJudge.playType(List.of(c(CLUB, 7), c(HEART, 7)))).contains(PlayType.PAIR);
        assertThat(SlaveJudge.playType(List.of(c(CLUB, 7), c(HEART, 7), c(SPADE, 7)))).contains(PlayType.TRIPLE);
        assertThat(SlaveJudge.playType(List.of(c(CLUB, 7), c(HEART, 7), c(SPADE, 7), c(DIAMOND, 7))))
                .contains(PlayType.QUADRUPLE);
        assertThat(SlaveJudge.playType(List.of(c(CLUB, 12), c(HEART, 13), c(SPADE, 1)))).contains(PlayType.STRAIGHT);
        assertThat(SlaveJudge.playType(List.of(c(CLUB, 13), c(HEART, 1), c(SPADE, 2)))).isEmpty();
        assertThat(SlaveJudge.playType(List.of(c(CLUB, 4), c(HEART, 9)))).isEmpty();
        assertThat(SlaveJudge.playType(List.of())).isEmpty();
    }

    @Test
    @DisplayName("经典桌规同点比花色，炸弹桌规只比点数")
    void suitTieBreak() {
        SlavePlay fiveHearts = table(CLASSIC, c(HEART, 5));
        assertThat(SlaveJudge.beats(List.of(c(SPADE, 5)), fiveHearts, CLASSIC)).isTrue();
        assertThat(SlaveJudge.beats(List.of(c(CLUB, 5)), fiveHearts, CLASSIC)).isFalse();
        SlavePlay bombFiveHearts = table(HOUSE_BOMB, c(HEART, 5));
        assertThat(SlaveJudge.beats(List.of(c(SPADE, 5)), bombFiveHearts, HOUSE_BOMB)).isFalse();
        assertThat(SlaveJudge.beats(List.of(c(SPADE, 6)), bombFiveHearts, HOUSE_BOMB)).isTrue();
    }

    @Test
    @DisplayName("同型须同张数，比较值严格更大")
    void sameType() {
        SlavePlay pairOfNines = table(CLASSIC, c(CLUB, 9), c(DIAMOND, 9));
        assertThat(SlaveJudge.beats(List.of(c(CLUB, 10), c(HEART, 10)), pairOfNines, CLASSIC)).isTrue();
        assertThat(SlaveJudge.beats(List.of(c(CLUB, 8), c(HEART, 8)), pairOfNines, CLASSIC)).isFalse();
        assertThat(SlaveJudge.beats(List.of(c(CLUB, 10)), pairOfNines, CLASSIC)).isFalse();

        SlavePlay run = table(CLASSIC, c(CLUB, 3), c(CLUB, 4), c(CLUB, 5));
        assertThat(SlaveJudge.beats(List.of(c(HEART, 4), c(HEART, 5), c(HEART, 6), c(HEART, 7)), run, CLASSIC))
                .isFalse();
        assertThat(SlaveJudge.beats(List.of(c(HEART, 4), c(HEART, 5), c(HEART, 6)), run, CLASSIC)).isTrue();
    }

    @Test
    @DisplayName("越级：经典桌规三条压单张、四条压单张和对子；炸弹桌规四条压一切")
    void crossType() {
        SlavePlay single = table(CLASSIC, c(SPADE, 2));
        SlavePlay pair = table(CLASSIC, c(SPADE, 2), c(HEART, 2));
        SlavePlay triple = table(CLASSIC, c(SPADE, 2), c(HEART, 2), c(CLUB, 2));
        List<Card> threes = List.of(c(CLUB, 3), c(HEART, 3), c(SPADE, 3));
        List<Card> quadFours = List.of(c(CLUB, 4), c(HEART, 4), c(SPADE, 4), c(DIAMOND, 4));

        assertThat(SlaveJudge.beats(threes, single, CLASSIC)).isTrue();
        assertThat(SlaveJudge.beats(threes, single, HOUSE_BOMB)).isFalse();
        assertThat(SlaveJudge.beats(quadFours, pair, CLASSIC)).isTrue();
        assertThat(SlaveJudge.beats(quadFours, triple, CLASSIC)).isFalse();

        SlavePlay straight = table(HOUSE_BOMB, c(CLUB, 9), c(CLUB, 10), c(CLUB, 11), c(CLUB, 12));
        assertThat(SlaveJudge.beats(quadFours, straight, HOUSE_BOMB)).isTrue();
        assertThat(SlaveJudge.beats(quadFours, straight, CLASSIC)).isFalse();
    }

    @Test
    @DisplayName("顺子枚举每段连续点数的全部子段")
    void straightEnumeration() {
        List<Card> hand = List.of(c(CLUB, 3), c(HEART, 4), c(SPADE, 5), c(CLUB, 6), c(DIAMOND, 6),
                c(HEART, 9), c(CLUB, 2));
        List<List<Card>> runs = SlaveJudge.straights(hand, SlaveJudge.MIN_STRAIGHT, CLASSIC);
        assertThat(runs).hasSize(3);
        // 同点取比较值大的那张
        assertThat(runs).allSatisfy(r -> assertThat(r).doesNotContain(c(CLUB, 6)));
    }

    @Test
    @DisplayName("出牌选项只包含能压过桌面的组合")
    void playableOptions() {
        List<Card> hand = List.of(c(CLUB, 7), c(HEART, 7), c(SPADE, 7), c(CLUB, 4));
        assertThat(SlaveJudge.groups(hand, 2)).hasSize(3);
        SlavePlay pairOfFives = table(CLASSIC, c(CLUB, 5), c(HEART, 5));
        List<List<Card>> options = SlaveJudge.playableOptions(hand, pairOfFives, CLASSIC);
        assertThat(options).hasSize(3).allSatisfy(o -> assertThat(o).hasSize(2));
        assertThat(SlaveJudge.playableOptions(hand, null, CLASSIC)).hasSize(4 + 3 + 1);
    }

    @Test
    @DisplayName("同点四张：1 个四条、4 个三条、6 个对子、4 个单张")
    void fourOfAKindGroupings() {
        List<Card> hand = List.of(c(CLUB, 9), c(DIAMOND, 9), c(HEART, 9), c(SPADE, 9));
        Map<Integer, Long> bySize = SlaveJudge.allGroupings(hand, CLASSIC).stream()
                .collect(Collectors.groupingBy(List::size, Collectors.counting()));
        assertThat(bySize).containsOnly(entry(1, 4L), entry(2, 6L), entry(3, 4L), entry(4, 1L));
    }

    @Test
    @DisplayName("名次称号按人数换算")
    void ranks() {
        assertThat(SlaveRank.of(1, 2)).isEqualTo(SlaveRank.PRESIDENT);
        assertThat(SlaveRank.of(2, 2)).isEqualTo(SlaveRank.SLAVE);
        assertThat(SlaveRank.of(2, 3)).isEqualTo(SlaveRank.CITIZEN);
        assertThat(SlaveRank.of(2, 4)).isEqualTo(SlaveRank.VICE_PRESIDENT);
        assertThat(SlaveRank.of(3, 4)).isEqualTo(SlaveRank.VICE_SLAVE);
        assertThat(SlaveRank.of(4, 4)).isEqualTo(SlaveRank.SLAVE);
    }
}
