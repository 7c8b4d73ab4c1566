package com.cardhub.engine.games.kang;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Deck;
import com.cardhub.engine.core.AbstractCardGame;
import com.cardhub.engine.core.GameType;
import com.cardhub.engine.core.RoundResult;
import com.cardhub.engine.games.kang.domain.command.KangAction;
import com.cardhub.engine.games.kang.domain.enums.KangPhase;
import com.cardhub.engine.games.kang.domain.model.KangHand;
import com.cardhub.engine.games.kang.domain.model.KangPlayer;
import com.cardhub.engine.games.kang.domain.model.KangRules;
import com.cardhub.engine.games.kang.domain.model.KangState;
import com.cardhub.engine.games.kang.domain.rule.KangJudge;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.TreeSet;

/**
 * 五张换牌（Kang）引擎，闲家对庄家。
 * 流程：WAITING → BETTING → DEALING → DISCARDING（庄家最后换）→ SHOWDOWN → SETTLING → FINISHED。
 * 闲家可在亮牌前随时弃牌，输掉下注；庄家收付为闲家总和取反。
 */
@Slf4j
public class KangGame extends AbstractCardGame<KangState, KangPlayer, KangAction> {

    private final KangRules rules;

    public KangGame(KangRules rules, Random random) {
        super(new KangState(), 1, rules.maxPlayers(), random);
        requireDeckFits(rules.maxPlayers(), KangJudge.HAND_SIZE, 0, Deck.CARDS_PER_DECK);
        this.rules = rules;
    }

    public KangGame() {
        this(KangRules.defaults(), new Random());
    }

    @Override
    public GameType gameType() {
        return GameType.KANG;
    }

    @Override
    public Class<KangState> stateType() {
        return KangState.class;
    }

    @Override
    public Class<KangAction> actionType() {
        return KangAction.class;
    }

    @Override
    protected boolean isBetweenRounds() {
        return state.getPhase() == KangPhase.WAITING;
    }

    @Override
    protected boolean canAct(KangPlayer p) {
        return !p.isFolded() && !p.isHasDiscarded();
    }

    @Override
    protected KangPlayer newPlayer(String playerId, String displayName) {
        return new KangPlayer(playerId, displayName, rules.startingChips());
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
    protected boolean dispatch(KangAction action) {
        String id = action.playerId();
        return switch (action.kind()) {
            case START_ROUND -> startRound();
            case PLACE_BET -> placeBet(id, ((KangAction.PlaceBet) action).amount());
            case DISCARD -> discard(id, ((KangAction.Discard) action).cardIndices());
            case KEEP_ALL -> keepAll(id);
            case FOLD -> fold(id);
            case END_ROUND -> endRound();
        };
    }

    // ---------------- 动作 ----------------

    public boolean startRound() {
        if (state.getPhase() != KangPhase.WAITING || players().size() < rules.minPlayers()) return false;
        resetTable();
        state.setPhase(KangPhase.BETTING);
        log.info("[kang] 第 {} 局开始，庄家 {}", state.getRoundNumber(), dealer().getPlayerId());
        return true;
    }

    public boolean placeBet(String playerId, int amount) {
        if (state.getPhase() != KangPhase.BETTING) return false;
        KangPlayer p = findPlayer(playerId).orElse(null);
        if (p == null || isDealer(p) || p.isHasBet() || p.isFolded()) return false;
        if (amount < rules.minBet() || amount > rules.maxBet() || amount > p.getChips()) return false;
        p.setBet(amount);
        p.setHasBet(true);
        checkBettingComplete();
        return true;
    }

    /**
     * 换牌：下标去重后 0..4 个，全部在手牌范围内，不能含 null。
     * 空列表等同于 keepAll。
     */
    public boolean discard(String playerId, List<Integer> cardIndices) {
        if (!canTakeTurn(playerId) || cardIndices == null) return false;
        if (cardIndices.stream().anyMatch(Objects::isNull)) return false;
        KangPlayer p = currentPlayer();
        TreeSet<Integer> idx = new TreeSet<>(cardIndices);
        if (idx.size() != cardIndices.size() || idx.size() > KangJudge.MAX_DISCARD) return false;
        if (!idx.isEmpty() && (idx.first() < 0 || idx.last() >= p.getHand().size())) return false;

        List<Card> kept = new ArrayList<>();
        List<Card> thrown = new ArrayList<>();
        for (int i = 0; i < p.getHand().size(); i++) {
            (idx.contains(i) ? thrown : kept).add(p.getHand().get(i));
        }
        for (int i = 0; i < thrown.size(); i++) kept.add(drawOrRecycle());
        p.setHand(kept);
        p.setDiscardedCards(thrown);
        p.setHasDiscarded(true);
        afterTurn();
        return true;
    }

    public boolean keepAll(String playerId) {
        if (!canTakeTurn(playerId)) return false;
        currentPlayer().setHasDiscarded(true);
        afterTurn();
        return true;
    }

    /** 闲家弃牌：下注期或换牌期都可以，不受轮次限制 */
    public boolean fold(String playerId) {
        KangPhase ph = state.getPhase();
        if (ph != KangPhase.BETTING && ph != KangPhase.DISCARDING) return false;
        KangPlayer p = findPlayer(playerId).orElse(null);
        if (p == null || isDealer(p) || p.isFolded()) return false;
        p.setFolded(true);
        if (ph == KangPhase.BETTING) {
            checkBettingComplete();
        } else if (isTurnOf(playerId)) {
            afterTurn();
        } else if (players().stream().noneMatch(this::canAct)) {
            showdown();
        }
        return true;
    }

    public boolean endRound() {
        if (state.getPhase() != KangPhase.FINISHED) return false;
        state.setDealerIndex(Math.floorMod(state.getDealerIndex() + 1, players().size()));
        state.setPhase(KangPhase.WAITING);
        return true;
    }

    // ---------------- 推进 ----------------

    private void checkBettingComplete() {
        boolean done = players().stream()
                .filter(x -> !isDealer(x))
                .allMatch(x -> x.isHasBet() || x.isFolded());
        if (done) dealCards();
    }

    private void dealCards() {
        state.setPhase(KangPhase.DEALING);
        int n = players().size();
        for (int round = 0; round < KangJudge.HAND_SIZE; round++) {
            for (int step = 1; step <= n; step++) {
                KangPlayer p = players().get(Math.floorMod(state.getDealerIndex() + step, n));
                if (!p.isFolded()) p.getHand().add(draw());
            }
        }
        state.setPhase(KangPhase.DISCARDING);
        state.setCurrentPlayerIndex(state.getDealerIndex());
        if (!advanceToNextPlayer()) showdown();
    }

    private void afterTurn() {
        if (!advanceToNextPlayer()) showdown();
    }

    private void showdown() {
        state.setPhase(KangPhase.SHOWDOWN);
        for (KangPlayer p : players()) {
            if (!p.isFolded()) p.setHandResult(KangJudge.evaluate(p.getHand()));
        }
        settle();
    }

    private void settle() {
        state.setPhase(KangPhase.SETTLING);
        KangPlayer dealer = dealer();
        KangHand dealerHand = dealer.getHandResult();
        int dealerTotal = 0;
        for (KangPlayer p : players()) {
            if (p == dealer) continue;
            int payout = p.isFolded() ? -p.getBet() : KangJudge.payout(p.getHandResult(), dealerHand, p.getBet());
            p.setPayout(payout);
            p.setResult(payout > 0 ? RoundResult.WIN : payout < 0 ? RoundResult.LOSE : RoundResult.TIE);
            p.setChips(p.getChips() + payout);
            dealerTotal -= payout;
        }
        dealer.setPayout(dealerTotal);
        dealer.setChips(dealer.getChips() + dealerTotal);
        state.setPhase(KangPhase.FINISHED);
        log.info("[kang] 第 {} 局结算完成，庄家收付 {}", state.getRoundNumber(), dealerTotal);
    }

    // ---------------- 工具 ----------------

    /** 牌堆空了就把前面玩家换下的牌洗回去再发 */
    private Card drawOrRecycle() {
        if (deck.isEmpty()) {
            List<Card> pile = new ArrayList<>();
            for (KangPlayer x : players()) {
                pile.addAll(x.getDiscardedCards());
                x.setDiscardedCards(new ArrayList<>());
            }
            log.debug("[kang] 牌堆用尽，回收 {} 张弃牌", pile.size());
            deck.recycle(pile);
        }
        return draw();
    }

    private boolean canTakeTurn(String playerId) {
        return state.getPhase() == KangPhase.DISCARDING && isTurnOf(playerId) && canAct(currentPlayer());
    }

    private KangPlayer dealer() {
        return players().get(state.getDealerIndex());
    }

    private boolean isDealer(KangPlayer p) {
        return p.getPlayerId().equals(dealer().getPlayerId());
    }

    public KangRules rules() {
        return rules;
    }
}
