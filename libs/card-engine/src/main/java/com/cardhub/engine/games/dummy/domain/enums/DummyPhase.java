package com.cardhub.engine.games.dummy.domain.enums;

public enum DummyPhase {

    WAITING,   // 两局之间
    DEALING,   // 发牌并翻开第一张弃牌
    PLAYING,   // 摸牌 → 组牌/贴牌 → 弃牌或敲门
    KNOCKED,   // 有人敲门，计算分数
    FINISHED   // 已决出胜者
}
