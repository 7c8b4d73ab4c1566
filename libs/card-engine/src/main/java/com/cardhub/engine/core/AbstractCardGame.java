package com.cardhub.engine.core;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Deck;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.function.Predicate;

/**
 * 引擎骨架：名单管理、轮转、牌堆持有、状态替换与序列化。
 * 子类只负责：
 * 1) 自己的阶段判定（是否处于两局之间）；
 * 2) 谁还能行动（canAct）；
 * 3) 动作分派（dispatch，对密封动作做穷举 switch）。
 */
@Slf4j
public abstract class AbstractCardGame<S extends TableState<P>, P extends SeatPlayer, A extends Command>
        implements CardGameEngine<S, A> {

    protected final Random random;
    protected final int maxPlayers;
    protected S state;
    protected Deck deck;

    protected AbstractCardGame(S initialState, int decks, int maxPlayers, Random random) {
        this.random = random == null ? new Random() : random;
        this.maxPlayers = maxPlayers;
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.deck = new Deck(decks, this.random);
    }

    // ---------------- 子类钩子 ----------------

    /** 是否处于两局之间（允许增删玩家、允许开局） */
    protected abstract boolean isBetweenRounds();

    /** 该玩家本轮是否还能行动（轮转时跳过不能行动的人） */
    protected abstract boolean canAct(P player);

    /** 新建一名本游戏的玩家 */
    protected abstract P newPlayer(String playerId, String displayName);

    /** 动作分派，违规返回 false */
    protected abstract boolean dispatch(A action);

    /** 删除玩家后修正庄位等索引，默认无操作 */
    protected void onPlayerRemoved(int removedIndex) {
    }

    // ---------------- 对外接口 ----------------

    @Override
    public S getState() {
        return state;
    }

    @Override
    public void setState(S incoming) {
        Objects.requireNonNull(incoming, "state");
        this.state = stateType().cast(incoming.copy());
        if (state.getDeck() != null) {
            this.deck = Deck.restore(state.getDeck(), random);
        }
    }

    @Override
    public S serialize() {
        state.setDeck(deck.snapshot());
        S copy = stateType().cast(state.copy());
        state.setDeck(null);
        return copy;
    }

    @Override
    public boolean addPlayer(String playerId, String displayName) {
        if (StringUtils.isBlank(playerId)) {
            throw new IllegalArgumentException("playerId 不能为空");
        }
        if (!isBetweenRounds()) {
            log.debug("[{}] 对局进行中，拒绝加入: {}", gameType().id(), playerId);
            return false;
        }
        if (state.getPlayers().size() >= maxPlayers || findPlayer(playerId).isPresent()) {
            return false;
        }
        state.getPlayers().add(newPlayer(playerId, StringUtils.defaultIfBlank(displayName, playerId)));
        return true;
    }

    @Override
    public boolean removePlayer(String playerId) {
        if (!isBetweenRounds()) {
            return false;
        }
        int idx = indexOf(playerId);
        if (idx < 0) {
            return false;
        }
        state.getPlayers().remove(idx);
        if (state.getCurrentPlayerIndex() >= state.getPlayers().size()) {
            state.setCurrentPlayerIndex(0);
        }
        onPlayerRemoved(idx);
        return true;
    }

    @Override
    public boolean apply(A action) {
        Objects.requireNonNull(action, "action");
        boolean ok = dispatch(action);
        if (!ok) {
            log.debug("[{}] 动作被拒绝: {} phase={}", gameType().id(), action, state.phaseName());
        }
        return ok;
    }

    /**
     * 从当前行动位向后找下一位能行动的玩家（取模回绕）。
     * 没有任何人能行动时位置不变，返回 false。
     */
    public boolean advanceToNextPlayer() {
        int next = nextIndex(state.getCurrentPlayerIndex(), this::canAct);
        if (next < 0) {
            return false;
        }
        state.setCurrentPlayerIndex(next);
        return true;
    }

    // ---------------- 子类工具 ----------------

    protected List<P> players() {
        return state.getPlayers();
    }

    protected int indexOf(String playerId) {
        List<P> ps = players();
        for (int i = 0; i < ps.size(); i++) {
            if (ps.get(i).getPlayerId().equals(playerId)) return i;
        }
        return -1;
    }

    protected Optional<P> findPlayer(String playerId) {
        int i = indexOf(playerId);
        return i < 0 ? Optional.empty() : Optional.of(players().get(i));
    }

    protected P currentPlayer() {
        return players().get(state.getCurrentPlayerIndex());
    }

    protected boolean isTurnOf(String playerId) {
        return !players().isEmpty() && currentPlayer().getPlayerId().equals(playerId);
    }

    /** from 之后第一个满足条件的位置（不含 from 本身，除非绕一圈回到它），没有则 -1 */
    protected int nextIndex(int from, Predicate<P> eligible) {
        int n = players().size();
        for (int step = 1; step <= n; step++) {
            int i = Math.floorMod(from + step, n);
            if (eligible.test(players().get(i))) return i;
        }
        return -1;
    }

    /** 发一张，牌堆耗尽直接失败 */
    protected Card draw() {
        return deck.draw();
    }

    /** 开局前的通用复位：牌全部收回重洗、所有玩家清空本局字段、局数 +1 */
    protected void resetTable() {
        deck.reset();
        players().forEach(SeatPlayer::resetForRound);
        state.setRoundNumber(state.getRoundNumber() + 1);
    }

    /** 构造期校验：最多人数 × 每人张数必须装得下 */
    protected static void requireDeckFits(int maxPlayers, int cardsPerPlayer, int extraCards, int deckSize) {
        if (maxPlayers * cardsPerPlayer + extraCards > deckSize) {
            throw new IllegalArgumentException(String.format(
                    "牌数不足：%d 人 × %d 张 + %d > %d", maxPlayers, cardsPerPlayer, extraCards, deckSize));
        }
    }

    public Deck deck() {
        return deck;
    }
}
