package com.cardhub.engine.games.slave;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Suit;
import com.cardhub.engine.core.AbstractCardGame;
import com.cardhub.engine.core.GameType;
import com.cardhub.engine.games.slave.domain.command.SlaveAction;
import com.cardhub.engine.games.slave.domain.enums.SlavePhase;
import com.cardhub.engine.games.slave.domain.enums.SlavePreset;
import com.cardhub.engine.games.slave.domain.enums.SlaveRank;
import com.cardhub.engine.games.slave.domain.model.SlavePlay;
import com.cardhub.engine.games.slave.domain.model.SlavePlayer;
import com.cardhub.engine.games.slave.domain.model.SlaveState;
import com.cardhub.engine.games.slave.domain.rule.SlaveJudge;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * 大富豪（奴隶）引擎。
 * 1) 整副牌轮流发完，按桌规决定先手；
 * 2) 轮到的人出牌压过桌面，或者过（桌面为空时不能过）；
 * 3) 其余人都过了，最后出牌的人开新一轮（他已出完则顺延下一位）；
 * 4) 手牌出完即退出并记录顺序，只剩一人时结束并按人数分配称号。
 */
@Slf4j
public class SlaveGame extends AbstractCardGame<SlaveState, SlavePlayer, SlaveAction> {

    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 4;

    public SlaveGame(SlavePreset preset, Random random) {
        super(new SlaveState(), 1, MAX_PLAYERS, random);
        state.setPreset(preset == null ? SlavePreset.CLASSIC : preset);
    }

    public SlaveGame() {
        this(SlavePreset.CLASSIC, new Random());
    }

    @Override
    public GameType gameType() {
        return GameType.SLAVE;
    }

    @Override
    public Class<SlaveState> stateType() {
        return SlaveState.class;
    }

    @Override
    public Class<SlaveAction> actionType() {
        return SlaveAction.class;
    }

    @Override
    protected boolean isBetweenRounds() {
        return state.getPhase() == SlavePhase.WAITING;
    }

    @Override
    protected boolean canAct(SlavePlayer p) {
        return !p.isOut();
    }

    @Override
    protected SlavePlayer newPlayer(String playerId, String displayName) {
        return new SlavePlayer(playerId, displayName);
    }

    @Override
    protected boolean dispatch(SlaveAction action) {
        return switch (action.kind()) {
            case START_ROUND -> startRound();
            case PLAY -> play(action.playerId(), ((SlaveAction.Play) action).cards());
            case PASS -> pass(action.playerId());
            case END_ROUND -> endRound();
        };
    }

    // ---------------- 动作 ----------------

    public boolean startRound() {
        if (state.getPhase() != SlavePhase.WAITING || players().size() < MIN_PLAYERS) return false;
        resetTable();
        state.setPhase(SlavePhase.DEALING);
        state.setCurrentPlay(null);
        state.setLastPlayerId(null);
        state.setPassCount(0);
        state.setFinishCount(0);

        int n = players().size();
        int i = 0;
        while (!deck.isEmpty()) {
            players().get(i % n).getHand().add(draw());
            i++;
        }
        SlavePreset preset = state.getPreset();
        players().forEach(p -> SlaveJudge.sortHand(p.getHand(), preset));

        int starter = startingIndex();
        state.setCurrentPlayerIndex(starter);
        state.setRoundStarterIndex(starter);
        state.setPhase(SlavePhase.PLAYING);
        log.info("[slave] 第 {} 局开始（{}），{} 先出", state.getRoundNumber(), preset,
                players().get(starter).getPlayerId());
        return true;
    }

    public boolean play(String playerId, List<Card> cards) {
        if (!canTakeTurn(playerId) || cards == null || cards.isEmpty()) return false;
        SlavePlayer p = currentPlayer();
        if (!holdsAll(p.getHand(), cards)) return false;
        if (!SlaveJudge.beats(cards, state.getCurrentPlay(), state.getPreset())) return false;

        SlavePlay play = SlaveJudge.toPlay(cards, playerId, state.getPreset()).orElseThrow();
        p.getHand().removeAll(cards);
        state.setCurrentPlay(play);
        state.setLastPlayerId(playerId);
        state.setPassCount(0);
        players().forEach(x -> x.setPassedThisRound(false));

        if (p.getHand().isEmpty()) {
            markOut(p);
            long remaining = players().stream().filter(this::canAct).count();
            if (remaining <= 1) {
                endGame();
                return true;
            }
        }
        advanceToNextPlayer();
        return true;
    }

    /** 过：桌面为空（新一轮）时不能过 */
    public boolean pass(String playerId) {
        if (!canTakeTurn(playerId) || state.getCurrentPlay() == null) return false;
        currentPlayer().setPassedThisRound(true);
        state.setPassCount(state.getPassCount() + 1);

        boolean allPassed = players().stream()
                .filter(this::canAct)
                .allMatch(x -> x.isPassedThisRound() || x.getPlayerId().equals(state.getLastPlayerId()));
        if (allPassed) {
            startNewTrick();
        } else {
            advanceToNextPlayer();
        }
        return true;
    }

    public boolean endRound() {
        if (state.getPhase() != SlavePhase.FINISHED) return false;
        state.setPhase(SlavePhase.WAITING);
        return true;
    }

    // ---------------- 推进 ----------------

    private void startNewTrick() {
        state.setCurrentPlay(null);
        state.setPassCount(0);
        players().forEach(x -> x.setPassedThisRound(false));
        int last = indexOf(state.getLastPlayerId());
        state.setCurrentPlayerIndex(last);
        if (!canAct(players().get(last))) {
            advanceToNextPlayer();
        }
        state.setRoundStarterIndex(state.getCurrentPlayerIndex());
    }

    private void markOut(SlavePlayer p) {
        state.setFinishCount(state.getFinishCount() + 1);
        p.setFinishOrder(state.getFinishCount());
        p.setOut(true);
        log.debug("[slave] {} 出完，第 {} 名", p.getPlayerId(), p.getFinishOrder());
    }

    private void endGame() {
        players().stream().filter(this::canAct).forEach(this::markOut);
        int n = players().size();
        for (SlavePlayer p : players()) {
            p.setRank(SlaveRank.of(p.getFinishOrder(), n));
        }
        state.setPhase(SlavePhase.FINISHED);
        log.info("[slave] 第 {} 局结束", state.getRoundNumber());
    }

    /** 首局或 HOUSE_BOMB：梅花 3 持有者；CLASSIC 的后续局：上局奴隶 */
    private int startingIndex() {
        if (state.getPreset().previousSlaveStarts() && state.getRoundNumber() > 1) {
            for (int i = 0; i < players().size(); i++) {
                if (players().get(i).getRank() == SlaveRank.SLAVE) return i;
            }
        }
        for (int i = 0; i < players().size(); i++) {
            boolean hasThreeOfClubs = players().get(i).getHand().stream()
                    .anyMatch(c -> c.rank() == 3 && c.suit() == Suit.CLUB);
            if (hasThreeOfClubs) return i;
        }
        return 0;
    }

    // ---------------- 工具 ----------------

    private boolean canTakeTurn(String playerId) {
        return state.getPhase() == SlavePhase.PLAYING && isTurnOf(playerId) && canAct(currentPlayer());
    }

    private static boolean holdsAll(List<Card> hand, List<Card> cards) {
        Set<Card> unique = new HashSet<>(cards);
        return unique.size() == cards.size() && hand.containsAll(unique);
    }
}
