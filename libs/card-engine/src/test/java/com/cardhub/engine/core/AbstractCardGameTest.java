package com.cardhub.engine.core;

import com.cardhub.engine.games.pokdeng.PokDengGame;
import com.cardhub.engine.games.pokdeng.domain.command.PokDengAction;
import com.cardhub.engine.games.pokdeng.domain.model.PokDengRules;
import com.cardhub.engine.games.pokdeng.domain.model.PokDengState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AbstractCardGameTest {

    private static PokDengGame game(int maxPlayers) {
        return new PokDengGame(new PokDengRules(10, 100, 1000, 2, maxPlayers), new Random(3));
    }

    @Test
    @DisplayName("名单：空 id 抛异常，重复与超员返回 false")
    void roster() {
        PokDengGame g = game(3);
        assertThatThrownBy(() -> g.addPlayer(" ", "x")).isInstanceOf(IllegalArgumentException.class);
        assertThat(g.addPlayer("a", null)).isTrue();
        assertThat(g.getState().getPlayers().get(0).getDisplayName()).isEqualTo("a");
        assertThat(g.addPlayer("a", "again")).isFalse();
        assertThat(g.addPlayer("b", "B")).isTrue();
        assertThat(g.addPlayer("c", "C")).isTrue();
        assertThat(g.addPlayer("d", "D")).isFalse();
        assertThat(g.removePlayer("zz")).isFalse();
    }

    @Test
    @DisplayName("对局中不能增删玩家")
    void rosterLockedDuringRound() {
        PokDengGame g = game(4);
        g.addPlayer("a", "A");
        g.addPlayer("b", "B");
        assertThat(g.apply(new PokDengAction.StartRound("a"))).isTrue();
        assertThat(g.addPlayer("c", "C")).isFalse();
        assertThat(g.removePlayer("b")).isFalse();
    }

    @Test
    @DisplayName("serialize 返回独立副本，带牌堆快照；实盘状态不带")
    void serializeIsDetached() {
        PokDengGame g = game(4);
        g.addPlayer("a", "A");
        g.addPlayer("b", "B");
        PokDengState copy = g.serialize();
        copy.getPlayers().clear();
        assertThat(g.getState().getPlayers()).hasSize(2);
        assertThat(copy.getDeck()).isNotNull();
        assertThat(g.getState().getDeck()).isNull();
    }

    @Test
    @DisplayName("setState 整体替换状态并从快照恢复牌堆")
    void setStateRestoresDeck() {
        PokDengGame source = game(4);
        source.addPlayer("a", "A");
        source.addPlayer("b", "B");
        source.apply(new PokDengAction.StartRound("a"));
        source.apply(new PokDengAction.PlaceBet("b", 10));

        PokDengGame target = game(4);
        target.setState(source.serialize());
        assertThat(target.deck().remaining()).isEqualTo(source.deck().remaining());
        assertThat(target.deck().snapshot()).isEqualTo(source.deck().snapshot());
        assertThat(target.getState().getPhase()).isEqualTo(source.getState().getPhase());
        assertThatThrownBy(() -> target.setState(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    @DisplayName("游戏类型按 id 解析，忽略大小写")
    void gameTypeIds() {
        assertThat(GameType.fromId("PokDeng")).isEqualTo(GameType.POKDENG);
        assertThatThrownBy(() -> GameType.fromId("uno")).isInstanceOf(IllegalArgumentException.class);
    }
}
