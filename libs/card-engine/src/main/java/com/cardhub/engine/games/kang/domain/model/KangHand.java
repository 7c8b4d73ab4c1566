package com.cardhub.engine.games.kang.domain.model;

import com.cardhub.engine.games.kang.domain.enums.KangHandType;

import java.util.List;

/**
 * 换牌后的评估结果。tiebreak 与德州同一套规则（同点张数降序，再点数降序）。
 */
public record KangHand(KangHandType type, List<Integer> tiebreak) implements Comparable<KangHand> {

    public KangHand {
        tiebreak = List.copyOf(tiebreak);
    }

    @Override
    public int compareTo(KangHand o) {
        int c = Integer.compare(type.ordinal(), o.type.ordinal());
        if (c != 0) return c;
        return compareKickers(o);
    }

    /** 只比 tiebreak 序列 */
    public int compareKickers(KangHand o) {
        int n = Math.min(tiebreak.size(), o.tiebreak.size());
        for (int i = 0; i < n; i++) {
            int c = Integer.compare(tiebreak.get(i), o.tiebreak.get(i));
            if (c != 0) return c;
        }
        return 0;
    }
}
