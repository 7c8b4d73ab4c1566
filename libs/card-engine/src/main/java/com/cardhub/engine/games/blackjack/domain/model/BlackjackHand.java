package com.cardhub.engine.games.blackjack.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.games.blackjack.domain.enums.HandOutcome;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 玩家的一手牌（分牌后一名玩家可以有多手）。
 */
@Data
@NoArgsConstructor
public class BlackjackHand {

    private List<Card> cards = new ArrayList<>();

    private int bet;

    private boolean doubled;

    private boolean split;

    private boolean stood;

    private boolean bust;

    /** 首两张天然 21（分牌后的 21 不算） */
    private boolean blackjack;

    private boolean surrendered;

    private HandOutcome outcome;

    private int payout;

    public BlackjackHand(int bet) {
        this.bet = bet;
    }

    /** 这一手已经不能再行动 */
    public boolean finished() {
        return stood || bust || surrendered;
    }
}
