package com.cardhub.engine.replication;

import com.cardhub.engine.games.poker.domain.command.PokerAction;
import com.cardhub.engine.games.slave.SlaveGame;
import com.cardhub.engine.games.slave.domain.model.SlaveState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotCodecTest {

    private final SnapshotCodec codec = new SnapshotCodec();

    @Test
    @DisplayName("动作载荷带 type 字段，按密封接口读回具体动作")
    void actionTypeTag() {
        JsonNode tree = codec.toTree(new PokerAction.Raise("p1", 40));
        assertThat(tree.get("type").asText()).isEqualTo("raise");
        assertThat(codec.readAction(tree, PokerAction.class)).isEqualTo(new PokerAction.Raise("p1", 40));
    }

    @Test
    @DisplayName("快照外壳解码后保留房间、序号，载荷可读回状态")
    void stateEnvelope() {
        SlaveGame game = new SlaveGame();
        game.addPlayer("p1", "一号");
        game.addPlayer("p2", "二号");
        game.startRound();
        TableSnapshot<SlaveState> snap = new TableSnapshot<>(game.serialize(),
                List.of(new ActionLogEntry(1, "p1", "start_round", 0)));

        Envelope<JsonNode> env = codec.decode(codec.encode(Envelope.state("slave", "r1", "p1", snap, 7)));
        assertThat(env.kind()).isEqualTo(Envelope.Kind.STATE);
        assertThat(env.roomId()).isEqualTo("r1");
        assertThat(env.seq()).isEqualTo(7);

        TableSnapshot<SlaveState> back = codec.readSnapshot(env.payload(), SlaveState.class);
        assertThat(back.state().getPlayers().get(0).getHand())
                .isEqualTo(game.getState().getPlayers().get(0).getHand());
        assertThat(back.state().getDeck().dealtCards()).hasSize(52);
        assertThat(back.actionLog()).hasSize(1);
    }

    @Test
    @DisplayName("损坏的外壳或载荷抛 MalformedMessageException")
    void malformed() {
        assertThatThrownBy(() -> codec.decode("[]")).isInstanceOf(MalformedMessageException.class);
        assertThatThrownBy(() -> codec.decode("{\"kind\":\"STATE\"}")).isInstanceOf(MalformedMessageException.class);
        assertThatThrownBy(() -> codec.readError(NullNode.getInstance())).isInstanceOf(MalformedMessageException.class);
        JsonNode bad = codec.toTree(new ErrorPayload("X", "y"));
        assertThatThrownBy(() -> codec.readAction(bad, PokerAction.class)).isInstanceOf(MalformedMessageException.class);
    }
}
