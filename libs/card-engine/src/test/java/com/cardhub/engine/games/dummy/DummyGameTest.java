package com.cardhub.engine.games.dummy;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.DeckSnapshot;
import com.cardhub.engine.card.Suit;
import com.cardhub.engine.games.dummy.domain.command.DummyAction;
import com.cardhub.engine.games.dummy.domain.enums.DummyPhase;
import com.cardhub.engine.games.dummy.domain.enums.DummyWinType;
import com.cardhub.engine.games.dummy.domain.enums.MeldType;
import com.cardhub.engine.games.dummy.domain.model.DummyPlayer;
import com.cardhub.engine.games.dummy.domain.model.DummyState;
import com.cardhub.engine.games.dummy.domain.model.Meld;
import com.cardhub.engine.games.dummy.domain.rule.DummyJudge;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static com.cardhub.engine.card.Suit.CLUB;
import static com.cardhub.engine.card.Suit.DIAMOND;
import static com.cardhub.engine.card.Suit.HEART;
import static com.cardhub.engine.card.Suit.SPADE;
import static org.assertj.core.api.Assertions.assertThat;

class DummyGameTest {

    private static Card c(Suit s, int r) {
        return Card.of(s, r);
    }

    private static DummyGame started(int players) {
        DummyGame g = new DummyGame(new Random(5));
        for (int i = 1; i <= players; i++) {
            g.addPlayer("p" + i, null);
        }
        assertThat(g.apply(new DummyAction.StartRound("p1"))).isTrue();
        return g;
    }

    /** 两人开局后换成指定手牌与弃牌堆，p1 先行动 */
    private static DummyGame withHands(List<Card> p1, List<Card> p2, List<Card> discard) {
        DummyGame g = started(2);
        DummyState s = g.serialize();
        s.getPlayers().get(0).setHand(new ArrayList<>(p1));
        s.getPlayers().get(1).setHand(new ArrayList<>(p2));
        s.setDiscardPile(new ArrayList<>(discard));
        s.setCurrentPlayerIndex(0);
        g.setState(s);
        return g;
    }

    private static DummyPlayer player(DummyGame g, int i) {
        return g.getState().getPlayers().get(i);
    }

    @Test
    @DisplayName("两人每人 10 张、三人每人 7 张，翻开一张弃牌")
    void deal() {
        DummyGame two = started(2);
        assertThat(two.getState().getPlayers()).allSatisfy(p -> assertThat(p.getHand()).hasSize(10));
        assertThat(two.getState().getDiscardPile()).hasSize(1);
        assertThat(two.deck().remaining()).isEqualTo(52 - 21);
        assertThat(two.getState().getPhase()).isEqualTo(DummyPhase.PLAYING);

        DummyGame three = started(3);
        assertThat(three.getState().getPlayers()).allSatisfy(p -> assertThat(p.getHand()).hasSize(7));
    }

    @Test
    @DisplayName("每回合先摸一张，再弃一张交出回合")
    void drawThenDiscard() {
        DummyGame g = withHands(List.of(c(CLUB, 2), c(HEART, 9)), List.of(c(SPADE, 4)), List.of(c(DIAMOND, 13)));
        assertThat(g.apply(new DummyAction.Discard("p1", c(CLUB, 2)))).isFalse();
        assertThat(g.apply(new DummyAction.DrawFromDiscard("p1"))).isTrue();
        assertThat(g.apply(new DummyAction.DrawFromDeck("p1"))).isFalse();
        assertThat(player(g, 0).getHand()).contains(c(DIAMOND, 13)).hasSize(3);
        assertThat(g.getState().getDiscardPile()).isEmpty();

        assertThat(g.apply(new DummyAction.Discard("p1", c(SPADE, 4)))).isFalse();
        assertThat(g.apply(new DummyAction.Discard("p1", c(HEART, 9)))).isTrue();
        assertThat(g.getState().getCurrentPlayerIndex()).isEqualTo(1);
        assertThat(player(g, 0).isHasDrawn()).isFalse();
        assertThat(g.apply(new DummyAction.DrawFromDiscard("p2"))).isTrue();
        assertThat(player(g, 1).getHand()).contains(c(HEART, 9));
    }

    @Test
    @DisplayName("组牌与贴牌，别人也可以往已有的组上贴")
    void meldAndLayOff() {
        DummyGame g = withHands(
                List.of(c(CLUB, 5), c(CLUB, 6), c(CLUB, 7), c(HEART, 9), c(DIAMOND, 9), c(SPADE, 9),
                        c(DIAMOND, 13), c(HEART, 2)),
                List.of(c(CLUB, 8), c(SPADE, 12)),
                List.of(c(CLUB, 4)));
        List<Card> run = List.of(c(CLUB, 5), c(CLUB, 6), c(CLUB, 7));
        assertThat(g.apply(new DummyAction.MeldCards("p1", run))).isFalse();
        g.apply(new DummyAction.DrawFromDiscard("p1"));

        assertThat(g.meld("p1", List.of(c(CLUB, 5), c(CLUB, 6), c(CLUB, 8)))).isEmpty();
        assertThat(g.meld("p1", Arrays.asList(c(CLUB, 5), c(CLUB, 6), null))).isEmpty();
        Meld m1 = g.meld("p1", run).orElseThrow();
        assertThat(m1.getId()).isEqualTo("m1");
        assertThat(m1.getType()).isEqualTo(MeldType.RUN);
        assertThat(g.apply(new DummyAction.LayOff("p1", c(CLUB, 4), "m1"))).isTrue();
        assertThat(g.apply(new DummyAction.MeldCards("p1",
                List.of(c(HEART, 9), c(DIAMOND, 9), c(SPADE, 9))))).isTrue();
        assertThat(g.apply(new DummyAction.LayOff("p1", c(DIAMOND, 13), "m2"))).isFalse();
        assertThat(g.apply(new DummyAction.Discard("p1", c(DIAMOND, 13)))).isTrue();
        assertThat(player(g, 0).getHand()).containsExactly(c(HEART, 2));

        assertThat(g.apply(new DummyAction.DrawFromDeck("p2"))).isTrue();
        assertThat(g.apply(new DummyAction.LayOff("p2", c(CLUB, 8), "m1"))).isTrue();
        assertThat(g.getState().getMelds().get(0).getCards())
                .extracting(Card::rank).containsExactly(4, 5, 6, 7, 8);
    }

    @Test
    @DisplayName("组完全部手牌直接获胜，记 -50")
    void dummyWin() {
        DummyGame g = withHands(List.of(c(CLUB, 5), c(CLUB, 6), c(CLUB, 7)),
                List.of(c(SPADE, 13), c(HEART, 1)), List.of(c(CLUB, 8)));
        g.apply(new DummyAction.DrawFromDiscard("p1"));
        assertThat(g.apply(new DummyAction.MeldCards("p1",
                List.of(c(CLUB, 5), c(CLUB, 6), c(CLUB, 7), c(CLUB, 8))))).isTrue();
        assertThat(g.getState().getPhase()).isEqualTo(DummyPhase.FINISHED);
        assertThat(g.getState().getWinType()).isEqualTo(DummyWinType.DUMMY);
        assertThat(g.getState().getWinnerId()).isEqualTo("p1");
        assertThat(player(g, 0).getScore()).isEqualTo(-DummyJudge.DUMMY_BONUS);
        assertThat(player(g, 1).getScore()).isEqualTo(25);
    }

    @Test
    @DisplayName("死木不超过 10 可以敲门，最低者获胜")
    void knock() {
        DummyGame g = withHands(List.of(c(CLUB, 2)), List.of(c(SPADE, 13), c(SPADE, 12)), List.of(c(DIAMOND, 3)));
        assertThat(g.apply(new DummyAction.Knock("p1"))).isFalse();
        g.apply(new DummyAction.DrawFromDiscard("p1"));
        assertThat(g.apply(new DummyAction.Knock("p1"))).isTrue();
        assertThat(g.getState().getKnockerId()).isEqualTo("p1");
        assertThat(g.getState().getWinType()).isEqualTo(DummyWinType.KNOCK);
        assertThat(player(g, 0).getScore()).isEqualTo(10);
        assertThat(player(g, 1).getScore()).isEqualTo(20);

        assertThat(g.apply(new DummyAction.EndRound("p1"))).isTrue();
        assertThat(g.apply(new DummyAction.StartRound("p1"))).isTrue();
        // 起手位随局数轮转
        assertThat(g.getState().getCurrentPlayerIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("敲门被反超：最低者获胜并再减 10")
    void undercut() {
        DummyGame g = withHands(List.of(c(CLUB, 2)), List.of(c(HEART, 4)), List.of(c(DIAMOND, 3)));
        g.apply(new DummyAction.DrawFromDiscard("p1"));
        assertThat(g.apply(new DummyAction.Knock("p1"))).isTrue();
        assertThat(g.getState().getWinType()).isEqualTo(DummyWinType.UNDERCUT);
        assertThat(g.getState().getWinnerId()).isEqualTo("p2");
        assertThat(player(g, 1).getScore()).isEqualTo(-5);
    }

    @Test
    @DisplayName("死木超过 10 不能敲门")
    void knockOverLimit() {
        DummyGame g = withHands(List.of(c(CLUB, 13)), List.of(c(HEART, 4)), List.of(c(DIAMOND, 12)));
        g.apply(new DummyAction.DrawFromDiscard("p1"));
        assertThat(g.apply(new DummyAction.Knock("p1"))).isFalse();
        assertThat(g.getState().getPhase()).isEqualTo(DummyPhase.PLAYING);
    }

    @Test
    @DisplayName("牌堆摸空时把弃牌（保留顶牌）洗回；弃牌不够时摸牌失败")
    void recycleDiscards() {
        DummyGame g = started(2);
        DummyState s = g.serialize();
        DeckSnapshot d = s.getDeck();
        List<Card> undealt = d.cards();
        List<Card> dealt = new ArrayList<>(d.dealtCards());
        dealt.addAll(undealt);
        s.setDeck(new DeckSnapshot(d.decks(), List.of(), dealt));
        s.setDiscardPile(new ArrayList<>(undealt.subList(0, 3)));
        s.setCurrentPlayerIndex(0);
        g.setState(s);

        int before = player(g, 0).getHand().size();
        assertThat(g.apply(new DummyAction.DrawFromDeck("p1"))).isTrue();
        assertThat(player(g, 0).getHand()).hasSize(before + 1);
        assertThat(g.deck().remaining()).isEqualTo(1);
        assertThat(g.getState().getDiscardPile()).containsExactly(undealt.get(2));

        DummyState s2 = g.serialize();
        s2.setDeck(new DeckSnapshot(1, List.of(), dealt));
        s2.setCurrentPlayerIndex(1);
        g.setState(s2);
        assertThat(g.apply(new DummyAction.DrawFromDeck("p2"))).isFalse();
    }
}
