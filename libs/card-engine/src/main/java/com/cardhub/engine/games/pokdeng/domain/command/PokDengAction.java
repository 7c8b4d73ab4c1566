package com.cardhub.engine.games.pokdeng.domain.command;

import com.cardhub.engine.core.Command;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 博丁动作集合（封闭）。引擎对 kind() 做穷举 switch，新增动作时编译器会报缺失分支。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = PokDengAction.StartRound.class, name = "start_round"),
        @JsonSubTypes.Type(value = PokDengAction.PlaceBet.class, name = "place_bet"),
        @JsonSubTypes.Type(value = PokDengAction.Draw.class, name = "draw"),
        @JsonSubTypes.Type(value = PokDengAction.Stay.class, name = "stay"),
        @JsonSubTypes.Type(value = PokDengAction.Fold.class, name = "fold"),
        @JsonSubTypes.Type(value = PokDengAction.EndRound.class, name = "end_round")
})
public sealed interface PokDengAction extends Command {

    enum Kind { START_ROUND, PLACE_BET, DRAW, STAY, FOLD, END_ROUND }

    Kind kind();

    record StartRound(String playerId) implements PokDengAction {
        public Kind kind() { return Kind.START_ROUND; }
        public boolean hostOnly() { return true; }
    }

    record PlaceBet(String playerId, int amount) implements PokDengAction {
        public Kind kind() { return Kind.PLACE_BET; }
    }

    /** 补第三张 */
    record Draw(String playerId) implements PokDengAction {
        public Kind kind() { return Kind.DRAW; }
    }

    record Stay(String playerId) implements PokDengAction {
        public Kind kind() { return Kind.STAY; }
    }

    record Fold(String playerId) implements PokDengAction {
        public Kind kind() { return Kind.FOLD; }
    }

    record EndRound(String playerId) implements PokDengAction {
        public Kind kind() { return Kind.END_ROUND; }
        public boolean hostOnly() { return true; }
    }
}
