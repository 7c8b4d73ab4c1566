package com.cardhub.engine.games.kang.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.core.RoundResult;
import com.cardhub.engine.core.SeatPlayer;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class KangPlayer extends SeatPlayer {

    private int chips;

    private List<Card> hand = new ArrayList<>();

    private List<Card> discardedCards = new ArrayList<>();

    private int bet;

    private boolean hasBet;

    private boolean hasDiscarded;

    private boolean folded;

    private KangHand handResult;

    private RoundResult result;

    private int payout;

    public KangPlayer(String playerId, String displayName, int chips) {
        super(playerId, displayName);
        this.chips = chips;
    }

    @Override
    public void resetForRound() {
        hand = new ArrayList<>();
        discardedCards = new ArrayList<>();
        bet = 0;
        hasBet = false;
        hasDiscarded = false;
        folded = false;
        handResult = null;
        result = null;
        payout = 0;
    }
}
