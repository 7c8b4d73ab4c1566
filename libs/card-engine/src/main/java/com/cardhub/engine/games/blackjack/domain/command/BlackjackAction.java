package com.cardhub.engine.games.blackjack.domain.command;

import com.cardhub.engine.core.Command;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * 21 点动作集合（封闭）。要牌/停牌/加倍/分牌都作用于玩家当前那一手。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BlackjackAction.StartRound.class, name = "start_round"),
        @JsonSubTypes.Type(value = BlackjackAction.PlaceBet.class, name = "place_bet"),
        @JsonSubTypes.Type(value = BlackjackAction.Hit.class, name = "hit"),
        @JsonSubTypes.Type(value = BlackjackAction.Stand.class, name = "stand"),
        @JsonSubTypes.Type(value = BlackjackAction.DoubleDown.class, name = "double"),
        @JsonSubTypes.Type(value = BlackjackAction.Split.class, name = "split"),
        @JsonSubTypes.Type(value = BlackjackAction.Surrender.class, name = "surrender"),
        @JsonSubTypes.Type(value = BlackjackAction.Insurance.class, name = "insurance"),
        @JsonSubTypes.Type(value = BlackjackAction.EndRound.class, name = "end_round")
})
public sealed interface BlackjackAction extends Command {

    enum Kind { START_ROUND, PLACE_BET, HIT, STAND, DOUBLE, SPLIT, SURRENDER, INSURANCE, END_ROUND }

    Kind kind();

    record StartRound(String playerId) implements BlackjackAction {
        public Kind kind() { return Kind.START_ROUND; }
        public boolean hostOnly() { return true; }
    }

    record PlaceBet(String playerId, int amount) implements BlackjackAction {
        public Kind kind() { return Kind.PLACE_BET; }
    }

    record Hit(String playerId) implements BlackjackAction {
        public Kind kind() { return Kind.HIT; }
    }

    record Stand(String playerId) implements BlackjackAction {
        public Kind kind() { return Kind.STAND; }
    }

    record DoubleDown(String playerId) implements BlackjackAction {
        public Kind kind() { return Kind.DOUBLE; }
    }

    record Split(String playerId) implements BlackjackAction {
        public Kind kind() { return Kind.SPLIT; }
    }

    record Surrender(String playerId) implements BlackjackAction {
        public Kind kind() { return Kind.SURRENDER; }
    }

    record Insurance(String playerId) implements BlackjackAction {
        public Kind kind() { return Kind.INSURANCE; }
    }

    record EndRound(String playerId) implements BlackjackAction {
        public Kind kind() { return Kind.END_ROUND; }
        public boolean hostOnly() { return true; }
    }
}
