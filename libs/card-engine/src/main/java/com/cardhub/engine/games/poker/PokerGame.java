package com.cardhub.engine.games.poker;

import com.cardhub.engine.card.Deck;
import com.cardhub.engine.core.AbstractCardGame;
import com.cardhub.engine.core.GameType;
import com.cardhub.engine.games.poker.domain.command.PokerAction;
import com.cardhub.engine.games.poker.domain.enums.PokerPhase;
import com.cardhub.engine.games.poker.domain.model.PokerHand;
import com.cardhub.engine.games.poker.domain.model.PokerPlayer;
import com.cardhub.engine.games.poker.domain.model.PokerRules;
import com.cardhub.engine.games.poker.domain.model.PokerState;
import com.cardhub.engine.games.poker.domain.model.SidePot;
import com.cardhub.engine.games.poker.domain.rule.PokerJudge;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;

/**
 * 德州扑克引擎。
 * 1) 开局：庄位后移，小盲/大盲下注，每人两张底牌，大盲之后的人先行动；
 * 2) 每条街：fold / check / call / raise / all-in，完整加注会重新打开行动；
 * 3) 没人还需要行动时进入下一条街；能行动的人 ≤ 1 时直接发完公共牌摊牌；
 * 4) 只剩一人未弃牌则直接拿走底池；否则按边池分配，平分余数给庄位左侧第一位赢家。
 */
@Slf4j
public class PokerGame extends AbstractCardGame<PokerState, PokerPlayer, PokerAction> {

    private final PokerRules rules;

    public PokerGame(PokerRules rules, Random random) {
        super(new PokerState(), 1, rules.maxPlayers(), random);
        requireDeckFits(rules.maxPlayers(), 2, 5, Deck.CARDS_PER_DECK);
        this.rules = rules;
        state.setSmallBlind(rules.smallBlind());
        state.setBigBlind(rules.bigBlind());
    }

    public PokerGame() {
        this(PokerRules.defaults(), new Random());
    }

    @Override
    public GameType gameType() {
        return GameType.POKER;
    }

    @Override
    public Class<PokerState> stateType() {
        return PokerState.class;
    }

    @Override
    public Class<PokerAction> actionType() {
        return PokerAction.class;
    }

    @Override
    protected boolean isBetweenRounds() {
        return state.getPhase() == PokerPhase.WAITING;
    }

    @Override
    protected boolean canAct(PokerPlayer p) {
        return p.inHand() && !p.isAllIn();
    }

    @Override
    protected PokerPlayer newPlayer(String playerId, String displayName) {
        return new PokerPlayer(playerId, displayName, rules.startingChips());
    }

    @Override
    protected void onPlayerRemoved(int removedIndex) {
        if (removedIndex <= state.getDealerIndex()) {
            state.setDealerIndex(state.getDealerIndex() - 1);
        }
    }

    @Override
    protected boolean dispatch(PokerAction action) {
        String id = action.playerId();
        return switch (action.kind()) {
            case START_ROUND -> startHand();
            case FOLD -> fold(id);
            case CHECK -> check(id);
            case CALL -> call(id);
            case RAISE -> raise(id, ((PokerAction.Raise) action).amount());
            case ALL_IN -> allIn(id);
            case END_ROUND -> endRound();
        };
    }

    // ---------------- 开局 ----------------

    public boolean startHand() {
        if (state.getPhase() != PokerPhase.WAITING) return false;
        long seated = players().stream().filter(p -> p.getChips() > 0).count();
        if (players().size() < rules.minPlayers() || seated < 2) return false;

        resetTable();
        state.getCommunityCards().clear();
        state.getSidePots().clear();
        state.setPot(0);
        state.setCurrentBet(0);
        state.setMinRaise(rules.bigBlind());

        // 庄位移到下一位有筹码的玩家
        state.setDealerIndex(nextIndex(state.getDealerIndex(), PokerPlayer::inHand));
        int sb = nextIndex(state.getDealerIndex(), PokerPlayer::inHand);
        int bb = nextIndex(sb, PokerPlayer::inHand);
        postBlind(players().get(sb), rules.smallBlind());
        postBlind(players().get(bb), rules.bigBlind());
        state.setCurrentBet(Math.max(players().get(sb).getCurrentBet(), players().get(bb).getCurrentBet()));

        for (int round = 0; round < 2; round++) {
            for (int step = 1; step <= players().size(); step++) {
                PokerPlayer p = players().get(Math.floorMod(state.getDealerIndex() + step, players().size()));
                if (p.inHand()) p.getHoleCards().add(draw());
            }
        }
        state.setPhase(PokerPhase.PREFLOP);
        state.setCurrentPlayerIndex(bb);
        log.info("[poker] 第 {} 手开始，庄位 {}，盲注 {}/{}", state.getRoundNumber(),
                players().get(state.getDealerIndex()).getPlayerId(), rules.smallBlind(), rules.bigBlind());
        moveToNextOrCloseStreet();
        return true;
    }

    // ---------------- 玩家动作 ----------------

    public boolean fold(String playerId) {
        if (!canTakeTurn(playerId)) return false;
        PokerPlayer p = currentPlayer();
        p.setFolded(true);
        p.setHasActed(true);
        afterAction();
        return true;
    }

    public boolean check(String playerId) {
        if (!canTakeTurn(playerId)) return false;
        PokerPlayer p = currentPlayer();
        if (p.getCurrentBet() != state.getCurrentBet()) return false;
        p.setHasActed(true);
        afterAction();
        return true;
    }

    public boolean call(String playerId) {
        if (!canTakeTurn(playerId)) return false;
        PokerPlayer p = currentPlayer();
        int toCall = state.getCurrentBet() - p.getCurrentBet();
        if (toCall <= 0) return false;
        commit(p, Math.min(toCall, p.getChips()));
        p.setHasActed(true);
        afterAction();
        return true;
    }

    /**
     * 加注：amount 为在当前最高注之上再加的数额，至少为最小加注额。
     * 本街已行动、之后只遇到不足额全下的玩家不能再加注。
     */
    public boolean raise(String playerId, int amount) {
        if (!canTakeTurn(playerId)) return false;
        PokerPlayer p = currentPlayer();
        if (raiseClosed(p) || amount < state.getMinRaise()) return false;
        int target = state.getCurrentBet() + amount;
        int need = target - p.getCurrentBet();
        if (need > p.getChips()) return false;
        commit(p, need);
        state.setMinRaise(amount);
        state.setCurrentBet(target);
        reopenAction(p);
        p.setHasActed(true);
        afterAction();
        return true;
    }

    /**
     * 全下：不足最小加注额的全下不重新打开行动。
     * 加注权已关闭的玩家只能以全下跟注（筹码不超过跟注额）。
     */
    public boolean allIn(String playerId) {
        if (!canTakeTurn(playerId)) return false;
        PokerPlayer p = currentPlayer();
        if (p.getChips() <= 0) return false;
        if (raiseClosed(p) && p.getChips() > state.getCurrentBet() - p.getCurrentBet()) return false;
        commit(p, p.getChips());
        int newBet = p.getCurrentBet();
        if (newBet > state.getCurrentBet()) {
            int raiseBy = newBet - state.getCurrentBet();
            if (raiseBy >= state.getMinRaise()) {
                state.setMinRaise(raiseBy);
                reopenAction(p);
            }
            state.setCurrentBet(newBet);
        }
        p.setHasActed(true);
        afterAction();
        return true;
    }

    public boolean endRound() {
        if (state.getPhase() != PokerPhase.FINISHED) return false;
        state.setPhase(PokerPhase.WAITING);
        return true;
    }

    // ---------------- 推进 ----------------

    private void afterAction() {
        List<PokerPlayer> alive = players().stream().filter(PokerPlayer::inHand).toList();
        if (alive.size() == 1) {
            awardUncontested(alive.get(0));
            return;
        }
        moveToNextOrCloseStreet();
    }

    private void moveToNextOrCloseStreet() {
        int next = nextIndex(state.getCurrentPlayerIndex(), this::needsToAct);
        if (next >= 0) {
            state.setCurrentPlayerIndex(next);
            return;
        }
        closeStreet();
    }

    /** 收街：清空本街下注，发下一条街；能行动的人不足两人时一路发到河牌 */
    private void closeStreet() {
        for (PokerPlayer p : players()) {
            p.setCurrentBet(0);
            p.setHasActed(false);
        }
        state.setCurrentBet(0);
        state.setMinRaise(rules.bigBlind());

        long canStillAct = players().stream().filter(this::canAct).count();
        if (canStillAct <= 1) {
            while (state.getPhase() != PokerPhase.RIVER) {
                dealNextStreet();
            }
            showdown();
            return;
        }
        if (state.getPhase() == PokerPhase.RIVER) {
            showdown();
            return;
        }
        dealNextStreet();
        state.setCurrentPlayerIndex(state.getDealerIndex());
        int first = nextIndex(state.getDealerIndex(), this::needsToAct);
        state.setCurrentPlayerIndex(first);
    }

    private void dealNextStreet() {
        switch (state.getPhase()) {
            case PREFLOP -> {
                for (int i = 0; i < 3; i++) state.getCommunityCards().add(draw());
                state.setPhase(PokerPhase.FLOP);
            }
            case FLOP -> {
                state.getCommunityCards().add(draw());
                state.setPhase(PokerPhase.TURN);
            }
            case TURN -> {
                state.getCommunityCards().add(draw());
                state.setPhase(PokerPhase.RIVER);
            }
            default -> throw new IllegalStateException("无法从 " + state.getPhase() + " 发下一条街");
        }
    }

    private void showdown() {
        state.setPhase(PokerPhase.SHOWDOWN);
        for (PokerPlayer p : players()) {
            if (p.inHand()) {
                PokerHand hand = PokerJudge.best(p.getHoleCards(), state.getCommunityCards());
                p.setBestHand(hand);
                p.setHandDescription(PokerJudge.describe(hand));
            }
        }
        state.setPhase(PokerPhase.SETTLING);
        state.setSidePots(buildPots());
        for (SidePot pot : state.getSidePots()) {
            distribute(pot);
        }
        finish();
    }

    private void awardUncontested(PokerPlayer winner) {
        state.setPhase(PokerPhase.SETTLING);
        winner.setWinAmount(state.getPot());
        winner.setChips(winner.getChips() + state.getPot());
        log.debug("[poker] 其余玩家弃牌，{} 赢得 {}", winner.getPlayerId(), state.getPot());
        finish();
    }

    private void finish() {
        state.setPot(0);
        state.setPhase(PokerPhase.FINISHED);
        log.info("[poker] 第 {} 手结束", state.getRoundNumber());
    }

    /**
     * 按各玩家本手累计投入切分边池。
     * 每个层级取仍在局中玩家的投入额；弃牌者的投入按层级计入，超出最高层级的部分并入最后一个池。
     */
    List<SidePot> buildPots() {
        TreeSet<Integer> levels = new TreeSet<>();
        for (PokerPlayer p : players()) {
            if (p.inHand() && p.getTotalBet() > 0) levels.add(p.getTotalBet());
        }
        List<SidePot> pots = new ArrayList<>();
        int prev = 0;
        int allocated = 0;
        for (int level : levels) {
            int amount = 0;
            List<String> eligible = new ArrayList<>();
            for (PokerPlayer p : players()) {
                amount += Math.max(0, Math.min(p.getTotalBet(), level) - prev);
                if (p.inHand() && p.getTotalBet() >= level) eligible.add(p.getPlayerId());
            }
            if (amount > 0) pots.add(new SidePot(amount, eligible));
            allocated += amount;
            prev = level;
        }
        int leftover = state.getPot() - allocated;
        if (leftover > 0 && !pots.isEmpty()) {
            SidePot last = pots.remove(pots.size() - 1);
            pots.add(new SidePot(last.amount() + leftover, last.eligiblePlayerIds()));
        }
        return pots;
    }

    private void distribute(SidePot pot) {
        PokerHand best = null;
        List<PokerPlayer> winners = new ArrayList<>();
        // 从庄位左侧开始遍历，余数自然给第一位赢家
        int n = players().size();
        for (int step = 1; step <= n; step++) {
            PokerPlayer p = players().get(Math.floorMod(state.getDealerIndex() + step, n));
            if (!pot.eligiblePlayerIds().contains(p.getPlayerId())) continue;
            int cmp = best == null ? 1 : p.getBestHand().compareTo(best);
            if (cmp > 0) {
                best = p.getBestHand();
                winners.clear();
                winners.add(p);
            } else if (cmp == 0) {
                winners.add(p);
            }
        }
        if (winners.isEmpty()) return;
        int share = pot.amount() / winners.size();
        int remainder = pot.amount() % winners.size();
        for (int i = 0; i < winners.size(); i++) {
            PokerPlayer w = winners.get(i);
            int won = share + (i == 0 ? remainder : 0);
            w.setWinAmount(w.getWinAmount() + won);
            w.setChips(w.getChips() + won);
        }
    }

    // ---------------- 工具 ----------------

    private boolean needsToAct(PokerPlayer p) {
        return canAct(p) && (!p.isHasActed() || p.getCurrentBet() < state.getCurrentBet());
    }

    /** 已行动过且只面对不足额加注：完整加注会清掉 hasActed，所以两者同时成立即加注权关闭 */
    private boolean raiseClosed(PokerPlayer p) {
        return p.isHasActed() && p.getCurrentBet() < state.getCurrentBet();
    }

    private void reopenAction(PokerPlayer raiser) {
        for (PokerPlayer p : players()) {
            if (p != raiser && canAct(p)) p.setHasActed(false);
        }
    }

    private void postBlind(PokerPlayer p, int blind) {
        commit(p, Math.min(blind, p.getChips()));
    }

    private void commit(PokerPlayer p, int amount) {
        p.setChips(p.getChips() - amount);
        p.setCurrentBet(p.getCurrentBet() + amount);
        p.setTotalBet(p.getTotalBet() + amount);
        state.setPot(state.getPot() + amount);
        if (p.getChips() == 0) p.setAllIn(true);
    }

    private boolean canTakeTurn(String playerId) {
        PokerPhase ph = state.getPhase();
        boolean betting = ph == PokerPhase.PREFLOP || ph == PokerPhase.FLOP
                || ph == PokerPhase.TURN || ph == PokerPhase.RIVER;
        return betting && isTurnOf(playerId) && needsToAct(currentPlayer());
    }

    public PokerRules rules() {
        return rules;
    }
}
