package com.cardhub.engine.games.blackjack.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.core.TableState;
import com.cardhub.engine.games.blackjack.domain.enums.BlackjackPhase;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BlackjackState extends TableState<BlackjackPlayer> {

    private BlackjackPhase phase = BlackjackPhase.WAITING;

    /** 庄家（牌桌本身，不占座位） */
    private List<Card> dealerHand = new ArrayList<>();

    private boolean holeCardRevealed;

    private int dealerValue;

    @Override
    public String phaseName() {
        return phase.name();
    }
}
