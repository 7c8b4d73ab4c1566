package com.cardhub.engine.games.poker.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.core.TableState;
import com.cardhub.engine.games.poker.domain.enums.PokerPhase;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PokerState extends TableState<PokerPlayer> {

    private PokerPhase phase = PokerPhase.WAITING;

    private List<Card> communityCards = new ArrayList<>();

    private int pot;

    private List<SidePot> sidePots = new ArrayList<>();

    /** 本条街最高注 */
    private int currentBet;

    /** 最小加注额（上一次完整加注的幅度） */
    private int minRaise;

    private int dealerIndex = -1;

    private int smallBlind;

    private int bigBlind;

    @Override
    public String phaseName() {
        return phase.name();
    }
}
