package com.cardhub.engine.games.dummy.domain.enums;

public enum DummyWinType {
    KNOCK,     // 敲门者死木最低
    UNDERCUT,  // 敲门者被反超
    DUMMY      // 手牌全部组完
}
