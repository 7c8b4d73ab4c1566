package com.cardhub.engine.games.dummy.domain.model;

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
public class DummyPlayer extends SeatPlayer {

    private List<Card> hand = new ArrayList<>();

    /** 本回合已摸牌 */
    private boolean hasDrawn;

    private boolean knocker;

    /** 结算分（死木点数，赢家按规则加减） */
    private int score;

    public DummyPlayer(String playerId, String displayName) {
        super(playerId, displayName);
    }

    @Override
    public void resetForRound() {
        hand = new ArrayList<>();
        hasDrawn = false;
        knocker = false;
        score = 0;
    }
}
