package com.cardhub.engine.games.dummy.domain.enums;

public enum MeldType {
    SET,  // 3-4 张同点不同花
    RUN   // ≥3 张同花连续，A 只作最小
}
