package com.cardhub.engine.games.poker.domain.model;

import java.util.List;

/**
 * 一个（主/边）池：金额 + 有资格争夺的玩家。
 */
public record SidePot(int amount, List<String> eligiblePlayerIds) {

    public SidePot {
        eligiblePlayerIds = List.copyOf(eligiblePlayerIds);
    }
}
