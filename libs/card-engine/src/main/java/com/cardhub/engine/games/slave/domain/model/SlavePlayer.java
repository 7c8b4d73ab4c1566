package com.cardhub.engine.games.slave.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.core.SeatPlayer;
import com.cardhub.engine.games.slave.domain.enums.SlaveRank;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class SlavePlayer extends SeatPlayer {

    private List<Card> hand = new ArrayList<>();

    /** 手牌出完 */
    private boolean out;

    private boolean passedThisRound;

    /** 出完的顺序，从 1 开始；0 表示还在打 */
    private int finishOrder;

    /** 上一局的称号，跨局保留（决定下一局谁先出） */
    private SlaveRank rank;

    public SlavePlayer(String playerId, String displayName) {
        super(playerId, displayName);
    }

    @Override
    public void resetForRound() {
        hand = new ArrayList<>();
        out = false;
        passedThisRound = false;
        finishOrder = 0;
    }
}
