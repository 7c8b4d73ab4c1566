package com.cardhub.engine.games.kang.domain.rule;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.games.kang.domain.enums.KangHandType;
import com.cardhub.engine.games.kang.domain.model.KangHand;
import com.cardhub.engine.games.poker.domain.model.PokerHand;
import com.cardhub.engine.games.poker.domain.rule.PokerJudge;

import java.util.List;

/**
 * 五张换牌玩法的牌型判定。
 * 分组与顺子判定复用德州评估器，再把十种牌型折算成本玩法的八种：
 * 同花顺/皇家同花顺 → 同花顺，葫芦 → KANG，四条/三条 → TONG。
 */
public final class KangJudge {

    public static final int HAND_SIZE = 5;
    public static final int MAX_DISCARD = 4;

    private KangJudge() {
    }

    public static KangHand evaluate(List<Card> hand) {
        if (hand.size() != HAND_SIZE) {
            throw new IllegalArgumentException("需要恰好 5 张: " + hand.size());
        }
        PokerHand ph = PokerJudge.evaluateFive(hand);
        KangHandType type = switch (ph.rank()) {
            case ROYAL_FLUSH, STRAIGHT_FLUSH -> KangHandType.STRAIGHT_FLUSH;
            case FULL_HOUSE -> KangHandType.KANG;
            case FOUR_OF_A_KIND, THREE_OF_A_KIND -> KangHandType.TONG;
            case FLUSH -> KangHandType.FLUSH;
            case STRAIGHT -> KangHandType.STRAIGHT;
            case TWO_PAIR -> KangHandType.TWO_PAIR;
            case ONE_PAIR -> KangHandType.PAIR;
            case HIGH_CARD -> KangHandType.HIGH_CARD;
        };
        return new KangHand(type, ph.tiebreak());
    }

    /**
     * 闲家对庄家的收付（正数闲家赢）。
     * 牌型更大按闲家牌型倍数赔；同牌型比 tiebreak，赢输各 1 倍；完全相同不输不赢。
     */
    public static int payout(KangHand player, KangHand dealer, int bet) {
        int typeCmp = Integer.compare(player.type().ordinal(), dealer.type().ordinal());
        if (typeCmp > 0) return bet * player.type().multiplier();
        if (typeCmp < 0) return -bet;
        int kick = player.compareKickers(dealer);
        return Integer.signum(kick) * bet;
    }
}
