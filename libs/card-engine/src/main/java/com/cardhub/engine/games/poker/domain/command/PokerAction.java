package com.cardhub.engine.games.poker.domain.command;

import com.cardhub.engine.core.Command;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 德州动作集合（封闭）。Raise 的 amount 为“在当前最高注之上再加多少”。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PokerAction.StartRound.class, name = "start_round"),
        @JsonSubTypes.Type(value = PokerAction.Fold.class, name = "fold"),
        @JsonSubTypes.Type(value = PokerAction.Check.class, name = "check"),
        @JsonSubTypes.Type(value = PokerAction.Call.class, name = "call"),
        @JsonSubTypes.Type(value = PokerAction.Raise.class, name = "raise"),
        @JsonSubTypes.Type(value = PokerAction.AllIn.class, name = "all_in"),
        @JsonSubTypes.Type(value = PokerAction.EndRound.class, name = "end_round")
})
public sealed interface PokerAction extends Command {

    enum Kind { START_ROUND, FOLD, CHECK, CALL, RAISE, ALL_IN, END_ROUND }

    Kind kind();

    record StartRound(String playerId) implements PokerAction {
        public Kind kind() { return Kind.START_ROUND; }
        public boolean hostOnly() { return true; }
    }

    record Fold(String playerId) implements PokerAction {
        public Kind kind() { return Kind.FOLD; }
    }

    record Check(String playerId) implements PokerAction {
        public Kind kind() { return Kind.CHECK; }
    }

    record Call(String playerId) implements PokerAction {
        public Kind kind() { return Kind.CALL; }
    }

    record Raise(String playerId, int amount) implements PokerAction {
        public Kind kind() { return Kind.RAISE; }
    }

    record AllIn(String playerId) implements PokerAction {
        public Kind kind() { return Kind.ALL_IN; }
    }

    record EndRound(String playerId) implements PokerAction {
        public Kind kind() { return Kind.END_ROUND; }
        public boolean hostOnly() { return true; }
    }
}
