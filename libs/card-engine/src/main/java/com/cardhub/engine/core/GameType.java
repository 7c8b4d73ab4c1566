package com.cardhub.engine.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 支持的牌桌游戏。id 同时用于消息外壳的 game 字段。
 */
public enum GameType {

    POKDENG("pokdeng"),
    KANG("kang"),
    POKER("poker"),
    BLACKJACK("blackjack"),
    SLAVE("slave"),
    DUMMY("dummy");

    private final String id;

    GameType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static GameType fromId(String id) {
        return Arrays.stream(values())
                .filter(t -> t.id.equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("未知游戏类型: " + id));
    }
}
