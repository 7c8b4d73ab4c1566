package com.cardhub.gameservice.config;

import com.cardhub.engine.games.blackjack.domain.model.BlackjackRules;
import com.cardhub.engine.games.kang.domain.model.KangRules;
import com.cardhub.engine.games.pokdeng.domain.model.PokDengRules;
import com.cardhub.engine.games.poker.domain.model.PokerRules;
import com.cardhub.engine.games.slave.domain.enums.SlavePreset;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 牌桌配置（application.yml 中 cardhub.*）。
 * 未配置的项使用各游戏桌规的默认值。
 */
@Data
@ConfigurationProperties(prefix = "cardhub")
public class CardHubProperties {

    private Table table = new Table();
    private PokDeng pokdeng = new PokDeng();
    private Kang kang = new Kang();
    private Poker poker = new Poker();
    private Blackjack blackjack = new Blackjack();
    private Slave slave = new Slave();

    @Data
    public static class Table {
        /** 同时存在的牌桌上限 */
        private int maxTables = 200;
        /** 等待牌桌线程处理一个请求的最长时间（毫秒） */
        private long callTimeoutMillis = 5000;
    }

    @Data
    public static class PokDeng {
        private int minBet = 10;
        private int maxBet = 100;
        private int startingChips = 1000;
        private int minPlayers = 2;
        private int maxPlayers = 9;

        public PokDengRules toRules() {
            return new PokDengRules(minBet, maxBet, startingChips, minPlayers, maxPlayers);
        }
    }

    @Data
    public static class Kang {
        private int minBet = 10;
        private int maxBet = 100;
        private int startingChips = 1000;
        private int minPlayers = 2;
        private int maxPlayers = 6;

        public KangRules toRules() {
            return new KangRules(minBet, maxBet, startingChips, minPlayers, maxPlayers);
        }
    }

    @Data
    public static class Poker {
        private int smallBlind = 5;
        private int bigBlind = 10;
        private int startingChips = 1000;
        private int minPlayers = 2;
        private int maxPlayers = 9;

        public PokerRules toRules() {
            return new PokerRules(smallBlind, bigBlind, startingChips, minPlayers, maxPlayers);
        }
    }

    @Data
    public static class Blackjack {
        private int decks = 6;
        private int reshuffleThreshold = 78;   // 剩余张数低于此值时开局前重洗
        private int minBet = 10;
        private int maxBet = 500;
        private int startingChips = 1000;
        private int maxPlayers = 7;
        private int maxHands = 4;

        public BlackjackRules toRules() {
            return new BlackjackRules(decks, reshuffleThreshold, minBet, maxBet, startingChips, maxPlayers, maxHands);
        }
    }

    @Data
    public static class Slave {
        private SlavePreset preset = SlavePreset.CLASSIC;
    }
}
