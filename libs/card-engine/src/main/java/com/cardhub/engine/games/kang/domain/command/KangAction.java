package com.cardhub.engine.games.kang.domain.command;

import com.cardhub.engine.core.Command;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = KangAction.StartRound.class, name = "start_round"),
        @JsonSubTypes.Type(value = KangAction.PlaceBet.class, name = "place_bet"),
        @JsonSubTypes.Type(value = KangAction.Discard.class, name = "discard"),
        @JsonSubTypes.Type(value = KangAction.KeepAll.class, name = "keep_all"),
        @JsonSubTypes.Type(value = KangAction.Fold.class, name = "fold"),
        @JsonSubTypes.Type(value = KangAction.EndRound.class, name = "end_round")
})
public sealed interface KangAction extends Command {

    enum Kind { START_ROUND, PLACE_BET, DISCARD, KEEP_ALL, FOLD, END_ROUND }

    Kind kind();

    record StartRound(String playerId) implements KangAction {
        public Kind kind() { return Kind.START_ROUND; }
        public boolean hostOnly() { return true; }
    }

    record PlaceBet(String playerId, int amount) implements KangAction {
        public Kind kind() { return Kind.PLACE_BET; }
    }

    /** 换掉手牌中这些下标的牌（0..4 张） */
    record Discard(String playerId, List<Integer> cardIndices) implements KangAction {
        public Kind kind() { return Kind.DISCARD; }
    }

    record KeepAll(String playerId) implements KangAction {
        public Kind kind() { return Kind.KEEP_ALL; }
    }

    record Fold(String playerId) implements KangAction {
        public Kind kind() { return Kind.FOLD; }
    }

    record EndRound(String playerId) implements KangAction {
        public Kind kind() { return Kind.END_ROUND; }
        public boolean hostOnly() { return true; }
    }
}
