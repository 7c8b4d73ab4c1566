package com.cardhub.engine.games.poker.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.core.SeatPlayer;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class PokerPlayer extends SeatPlayer {

    private int chips;

    private List<Card> holeCards = new ArrayList<>();

    /** 本条街已投入 */
    private int currentBet;

    /** 本手累计投入（边池按它切分） */
    private int totalBet;

    private boolean folded;

    private boolean allIn;

    private boolean hasActed;

    /** 筹码为 0，本手不参与 */
    private boolean sittingOut;

    private PokerHand bestHand;

    private String handDescription;

    private int winAmount;

    public PokerPlayer(String playerId, String displayName, int chips) {
        super(playerId, displayName);
        this.chips = chips;
    }

    @Override
    public void resetForRound() {
        holeCards = new ArrayList<>();
        currentBet = 0;
        totalBet = 0;
        folded = false;
        allIn = false;
        hasActed = false;
        sittingOut = chips <= 0;
        bestHand = null;
        handDescription = null;
        winAmount = 0;
    }

    /** 仍在争夺底池 */
    public boolean inHand() {
        return !folded && !sittingOut;
    }
}
