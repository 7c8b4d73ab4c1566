package com.cardhub.engine.games.blackjack.domain.model;

import com.cardhub.engine.core.SeatPlayer;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
public class BlackjackPlayer extends SeatPlayer {

    private int chips;

    private List<BlackjackHand> hands = new ArrayList<>();

    private boolean hasBet;

    /** 本局是否已做过要牌/停牌/加倍/分牌（保险与投降只能在此之前） */
    private boolean hasActed;

    private int insuranceBet;

    /** 筹码不足最低下注，本局不参与 */
    private boolean sittingOut;

    private int totalPayout;

    public BlackjackPlayer(String playerId, String displayName, int chips) {
        super(playerId, displayName);
        this.chips = chips;
    }

    @Override
    public void resetForRound() {
        hands = new ArrayList<>();
        hasBet = false;
        hasActed = false;
        insuranceBet = 0;
        sittingOut = false;
        totalPayout = 0;
    }

    /** 当前要行动的那手，全部结束返回 null */
    public BlackjackHand activeHand() {
        return hands.stream().filter(h -> !h.finished()).findFirst().orElse(null);
    }

    /** 各手下注 + 保险的总额 */
    public int committed() {
        return hands.stream().mapToInt(BlackjackHand::getBet).sum() + insuranceBet;
    }
}
