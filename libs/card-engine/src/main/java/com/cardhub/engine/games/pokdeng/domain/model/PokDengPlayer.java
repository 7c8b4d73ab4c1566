package com.cardhub.engine.games.pokdeng.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.core.SeatPlayer;
import com.cardhub.engine.core.RoundResult;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class PokDengPlayer extends SeatPlayer {

    private int chips;

    private List<Card> hand = new ArrayList<>();

    private int bet;

    private boolean hasBet;

    /** 本轮已补牌或停牌 */
    private boolean hasActed;

    private boolean folded;

    /** 筹码不足最低下注，本局不参与 */
    private boolean sittingOut;

    private PokDengHand handResult;

    private RoundResult result;

    private int payout;

    public PokDengPlayer(String playerId, String displayName, int chips) {
        super(playerId, displayName);
        this.chips = chips;
    }

    @Override
    public void resetForRound() {
        hand = new ArrayList<>();
        bet = 0;
        hasBet = false;
        hasActed = false;
        folded = false;
        sittingOut = false;
        handResult = null;
        result = null;
        payout = 0;
    }
}
