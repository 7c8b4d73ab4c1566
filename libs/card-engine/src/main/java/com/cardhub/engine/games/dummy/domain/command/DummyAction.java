package com.cardhub.engine.games.dummy.domain.command;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.core.Command;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DummyAction.StartRound.class, name = "start_round"),
        @JsonSubTypes.Type(value = DummyAction.DrawFromDeck.class, name = "draw_deck"),
        @JsonSubTypes.Type(value = DummyAction.DrawFromDiscard.class, name = "draw_discard"),
        @JsonSubTypes.Type(value = DummyAction.MeldCards.class, name = "meld"),
        @JsonSubTypes.Type(value = DummyAction.LayOff.class, name = "lay_off"),
        @JsonSubTypes.Type(value = DummyAction.Discard.class, name = "discard"),
        @JsonSubTypes.Type(value = DummyAction.Knock.class, name = "knock"),
        @JsonSubTypes.Type(value = DummyAction.EndRound.class, name = "end_round")
})
public sealed interface DummyAction extends Command {

    enum Kind { START_ROUND, DRAW_DECK, DRAW_DISCARD, MELD, LAY_OFF, DISCARD, KNOCK, END_ROUND }

    Kind kind();

    record StartRound(String playerId) implements DummyAction {
        public Kind kind() { return Kind.START_ROUND; }
        public boolean hostOnly() { return true; }
    }

    record DrawFromDeck(String playerId) implements DummyAction {
        public Kind kind() { return Kind.DRAW_DECK; }
    }

    record DrawFromDiscard(String playerId) implements DummyAction {
        public Kind kind() { return Kind.DRAW_DISCARD; }
    }

    record MeldCards(String playerId, List<Card> cards) implements DummyAction {
        public Kind kind() { return Kind.MELD; }
    }

    record LayOff(String playerId, Card card, String meldId) implements DummyAction {
        public Kind kind() { return Kind.LAY_OFF; }
    }

    record Discard(String playerId, Card card) implements DummyAction {
        public Kind kind() { return Kind.DISCARD; }
    }

    record Knock(String playerId) implements DummyAction {
        public Kind kind() { return Kind.KNOCK; }
    }

    record EndRound(String playerId) implements DummyAction {
        public Kind kind() { return Kind.END_ROUND; }
        public boolean hostOnly() { return true; }
    }
}
