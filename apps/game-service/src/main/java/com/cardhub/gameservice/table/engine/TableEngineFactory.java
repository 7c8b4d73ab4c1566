package com.cardhub.gameservice.table.engine;

import com.cardhub.engine.core.CardGameEngine;
import com.cardhub.engine.core.GameType;
import com.cardhub.engine.games.blackjack.BlackjackGame;
import com.cardhub.engine.games.dummy.DummyGame;
import com.cardhub.engine.games.kang.KangGame;
import com.cardhub.engine.games.pokdeng.PokDengGame;
import com.cardhub.engine.games.poker.PokerGame;
import com.cardhub.engine.games.slave.SlaveGame;
import com.cardhub.gameservice.config.CardHubProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;

/**
 * 按游戏类型与配置创建引擎实例（每张牌桌一个）。
 */
@Component
@RequiredArgsConstructor
public class TableEngineFactory {

    private final CardHubProperties props;

    public CardGameEngine<?, ?> create(GameType type) {
        return create(type, new SecureRandom());
    }

    public CardGameEngine<?, ?> create(GameType type, Random random) {
        return switch (type) {
            case POKDENG -> new PokDengGame(props.getPokdeng().toRules(), random);
            case KANG -> new KangGame(props.getKang().toRules(), random);
            case POKER -> new PokerGame(props.getPoker().toRules(), random);
            case BLACKJACK -> new BlackjackGame(props.getBlackjack().toRules(), random);
            case SLAVE -> new SlaveGame(props.getSlave().getPreset(), random);
            case DUMMY -> new DummyGame(random);
        };
    }
}
