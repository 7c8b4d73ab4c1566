package com.cardhub.engine.games.pokdeng;

import com.cardhub.engine.card.Deck;
import com.cardhub.engine.core.AbstractCardGame;
import com.cardhub.engine.core.GameType;
import com.cardhub.engine.games.pokdeng.domain.command.PokDengAction;
import com.cardhub.engine.games.pokdeng.domain.enums.PokDengPhase;
import com.cardhub.engine.core.RoundResult;
import com.cardhub.engine.games.pokdeng.domain.model.PokDengHand;
import com.cardhub.engine.games.pokdeng.domain.model.PokDengPlayer;
import com.cardhub.engine.games.pokdeng.domain.model.PokDengRules;
import com.cardhub.engine.games.pokdeng.domain.model.PokDengState;
import com.cardhub.engine.games.pokdeng.domain.rule.PokDengJudge;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Random;

/**
 * 博丁引擎（闲家对庄家比点）。
 * 流程：WAITING → BETTING → DEALING →（有人博则直接亮牌）PLAYING → REVEALING → SETTLING → FINISHED。
 * 结算对庄家零和：闲家赢得 下注×牌型倍数，输掉下注，平局不动；庄家收付为闲家总和取反。
 */
@Slf4j
public class PokDengGame extends AbstractCardGame<PokDengState, PokDengPlayer, PokDengAction> {

    private final PokDengRules rules;

    public PokDengGame(PokDengRules rules, Random random) {
        super(new PokDengState(), 1, rules.maxPlayers(), random);
        requireDeckFits(rules.maxPlayers(), 3, 0, Deck.CARDS_PER_DECK);
        this.rules = rules;
    }

    public PokDengGame() {
        this(PokDengRules.defaults(), new Random());
    }

    @Override
    public GameType gameType() {
        return GameType.POKDENG;
    }

    @Override
    public Class<PokDengState> stateType() {
        return PokDengState.class;
    }

    @Override
    public Class<PokDengAction> actionType() {
        return PokDengAction.class;
    }

    @Override
    protected boolean isBetweenRounds() {
        return state.getPhase() == PokDengPhase.WAITING;
    }

    @Override
    protected boolean canAct(PokDengPlayer p) {
        return !p.isFolded() && !p.isSittingOut() && !p.isHasActed() && (isDealer(p) || p.isHasBet());
    }

    @Override
    protected PokDengPlayer newPlayer(String playerId, String displayName) {
        return new PokDengPlayer(playerId, displayName, rules.startingChips());
    }

    @Override
    protected void onPlayerRemoved(int removedIndex) {
        int size = players().size();
        if (removedIndex < state.getDealerIndex()) {
            state.setDealerIndex(state.getDealerIndex() - 1);
        }
        if (size == 0 || state.getDealerIndex() >= size) {
            state.setDealerIndex(0);
        }
    }

    @Override
    protected boolean dispatch(PokDengAction action) {
        return switch (action.kind()) {
            case START_ROUND -> startRound();
            case PLACE_BET -> placeBet(action.playerId(), ((PokDengAction.PlaceBet) action).amount());
            case DRAW -> draw(action.playerId());
            case STAY -> stay(action.playerId());
            case FOLD -> fold(action.playerId());
            case END_ROUND -> endRound();
        };
    }

    // ---------------- 动作 ----------------

    /**
     * 开局。筹码不够最低下注的闲家本局坐下观战；一个能下注的闲家都没有时拒绝开局。
     */
    public boolean startRound() {
        if (state.getPhase() != PokDengPhase.WAITING || players().size() < rules.minPlayers()) {
            return false;
        }
        boolean anyCanBet = players().stream().anyMatch(p -> !isDealer(p) && p.getChips() >= rules.minBet());
        if (!anyCanBet) return false;
        resetTable();
        for (PokDengPlayer p : players()) {
            if (!isDealer(p) && p.getChips() < rules.minBet()) {
                p.setSittingOut(true);
                log.info("[pokdeng] {} 筹码 {} 不足最低下注，本局不参与", p.getPlayerId(), p.getChips());
            }
        }
        state.setPhase(PokDengPhase.BETTING);
        state.setCurrentPlayerIndex(Math.floorMod(state.getDealerIndex() + 1, players().size()));
        log.info("[pokdeng] 第 {} 局开始，庄家 {}", state.getRoundNumber(), dealer().getPlayerId());
        return true;
    }

    public boolean placeBet(String playerId, int amount) {
        if (state.getPhase() != PokDengPhase.BETTING) return false;
        PokDengPlayer p = findPlayer(playerId).orElse(null);
        if (p == null || isDealer(p) || p.isHasBet() || p.isFolded() || p.isSittingOut()) return false;
        if (amount < rules.minBet() || amount > rules.maxBet() || amount > p.getChips()) return false;

        p.setBet(amount);
        p.setHasBet(true);
        checkBettingComplete();
        return true;
    }

    public boolean draw(String playerId) {
        if (!canTakeTurn(playerId)) return false;
        PokDengPlayer p = currentPlayer();
        if (p.getHand().size() != 2) return false;
        p.getHand().add(draw());
        p.setHasActed(true);
        afterTurn();
        return true;
    }

    public boolean stay(String playerId) {
        if (!canTakeTurn(playerId)) return false;
        currentPlayer().setHasActed(true);
        afterTurn();
        return true;
    }

    /**
     * 闲家弃牌，输掉已下的注。
     * 下注期随时可弃（不受轮次限制），补牌期只能在自己的回合弃。
     */
    public boolean fold(String playerId) {
        if (state.getPhase() == PokDengPhase.BETTING) {
            PokDengPlayer p = findPlayer(playerId).orElse(null);
            if (p == null || isDealer(p) || p.isFolded() || p.isSittingOut()) return false;
            p.setFolded(true);
            checkBettingComplete();
            return true;
        }
        if (!canTakeTurn(playerId)) return false;
        PokDengPlayer p = currentPlayer();
        if (isDealer(p)) return false;
        p.setFolded(true);
        afterTurn();
        return true;
    }

    /** 收尾：庄家轮转到下一位，回到 WAITING */
    public boolean endRound() {
        if (state.getPhase() != PokDengPhase.FINISHED) return false;
        state.setDealerIndex(Math.floorMod(state.getDealerIndex() + 1, players().size()));
        state.setPhase(PokDengPhase.WAITING);
        return true;
    }

    // ---------------- 阶段推进 ----------------

    /** 参与本局的闲家都已下注或弃牌时发牌；全部弃牌则直接结算 */
    private void checkBettingComplete() {
        List<PokDengPlayer> seated = players().stream()
                .filter(x -> !isDealer(x) && !x.isSittingOut())
                .toList();
        if (!seated.stream().allMatch(x -> x.isHasBet() || x.isFolded())) return;
        if (seated.stream().allMatch(PokDengPlayer::isFolded)) {
            log.debug("[pokdeng] 闲家全部弃牌，直接结算");
            settle();
            return;
        }
        dealCards();
    }

    private void dealCards() {
        state.setPhase(PokDengPhase.DEALING);
        int n = players().size();
        for (int round = 0; round < 2; round++) {
            for (int step = 1; step <= n; step++) {
                PokDengPlayer p = players().get(Math.floorMod(state.getDealerIndex() + step, n));
                if (!p.isFolded() && !p.isSittingOut()) p.getHand().add(draw());
            }
        }
        boolean anyPok = players().stream().anyMatch(p -> PokDengJudge.isPok(p.getHand()));
        if (anyPok) {
            log.debug("[pokdeng] 有人博，直接亮牌");
            reveal();
            return;
        }
        state.setPhase(PokDengPhase.PLAYING);
        state.setCurrentPlayerIndex(state.getDealerIndex());
        if (!advanceToNextPlayer()) {
            reveal();
        }
    }

    private void afterTurn() {
        if (!advanceToNextPlayer()) {
            reveal();
        }
    }

    private void reveal() {
        state.setPhase(PokDengPhase.REVEALING);
        for (PokDengPlayer p : players()) {
            if (!p.isFolded() && !p.isSittingOut()) {
                p.setHandResult(PokDengJudge.evaluate(p.getHand()));
            }
        }
        settle();
    }

    private void settle() {
        state.setPhase(PokDengPhase.SETTLING);
        PokDengPlayer dealer = dealer();
        PokDengHand dealerHand = dealer.getHandResult();
        int dealerTotal = 0;
        for (PokDengPlayer p : players()) {
            if (p == dealer || p.isSittingOut()) continue;
            int payout;
            if (p.isFolded()) {
                p.setResult(RoundResult.LOSE);
                payout = -p.getBet();
            } else {
                int cmp = PokDengJudge.compare(p.getHandResult(), dealerHand);
                if (cmp > 0) {
                    p.setResult(RoundResult.WIN);
                    payout = p.getBet() * p.getHandResult().multiplier();
                } else if (cmp < 0) {
                    p.setResult(RoundResult.LOSE);
                    payout = -p.getBet();
                } else {
                    p.setResult(RoundResult.TIE);
                    payout = 0;
                }
            }
            p.setPayout(payout);
            p.setChips(p.getChips() + payout);
            dealerTotal -= payout;
        }
        dealer.setPayout(dealerTotal);
        dealer.setChips(dealer.getChips() + dealerTotal);
        state.setPhase(PokDengPhase.FINISHED);
        log.info("[pokdeng] 第 {} 局结算完成，庄家收付 {}", state.getRoundNumber(), dealerTotal);
    }

    // ---------------- 工具 ----------------

    private boolean canTakeTurn(String playerId) {
        return state.getPhase() == PokDengPhase.PLAYING && isTurnOf(playerId) && canAct(currentPlayer());
    }

    private PokDengPlayer dealer() {
        return players().get(state.getDealerIndex());
    }

    private boolean isDealer(PokDengPlayer p) {
        return p.getPlayerId().equals(dealer().getPlayerId());
    }

    public PokDengRules rules() {
        return rules;
    }
}
