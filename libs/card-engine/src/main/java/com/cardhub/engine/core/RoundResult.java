package com.cardhub.engine.core;

/** 闲家对庄家的单局结果（庄家对局类游戏共用） */
public enum RoundResult {
    WIN,
    LOSE,
    TIE
}
