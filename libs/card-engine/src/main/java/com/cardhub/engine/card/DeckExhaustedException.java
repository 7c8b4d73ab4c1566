package com.cardhub.engine.card;

/**
 * 发牌时牌堆耗尽。属于配置/逻辑错误（人数与副数不匹配），不应在正常对局中出现。
 */
public class DeckExhaustedException extends IllegalStateException {

    public DeckExhaustedException(String message) {
        super(message);
    }
}
