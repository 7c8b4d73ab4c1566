package com.cardhub.engine.games.slave.domain.command;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.core.Command;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SlaveAction.StartRound.class, name = "start_round"),
        @JsonSubTypes.Type(value = SlaveAction.Play.class, name = "play"),
        @JsonSubTypes.Type(value = SlaveAction.Pass.class, name = "pass"),
        @JsonSubTypes.Type(value = SlaveAction.EndRound.class, name = "end_round")
})
public sealed interface SlaveAction extends Command {

    enum Kind { START_ROUND, PLAY, PASS, END_ROUND }

    Kind kind();

    record StartRound(String playerId) implements SlaveAction {
        public Kind kind() { return Kind.START_ROUND; }
        public boolean hostOnly() { return true; }
    }

    record Play(String playerId, List<Card> cards) implements SlaveAction {
        public Kind kind() { return Kind.PLAY; }
    }

    record Pass(String playerId) implements SlaveAction {
        public Kind kind() { return Kind.PASS; }
    }

    record EndRound(String playerId) implements SlaveAction {
        public Kind kind() { return Kind.END_ROUND; }
        public boolean hostOnly() { return true; }
    }
}
