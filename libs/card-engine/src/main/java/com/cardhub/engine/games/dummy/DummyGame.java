package com.cardhub.engine.games.dummy;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.card.Deck;
import com.cardhub.engine.core.AbstractCardGame;
import com.cardhub.engine.core.GameType;
import com.cardhub.engine.games.dummy.domain.command.DummyAction;
import com.cardhub.engine.games.dummy.domain.enums.DummyPhase;
import com.cardhub.engine.games.dummy.domain.enums.DummyWinType;
import com.cardhub.engine.games.dummy.domain.enums.MeldType;
import com.cardhub.engine.games.dummy.domain.model.DummyPlayer;
import com.cardhub.engine.games.dummy.domain.model.DummyState;
import com.cardhub.engine.games.dummy.domain.model.Meld;
import com.cardhub.engine.games.dummy.domain.rule.DummyJudge;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * 组牌（Dummy）引擎。
 * 每回合：摸牌（牌堆或弃牌堆顶）→ 可选组牌 / 贴牌 → 弃一张结束回合，或死木 ≤ 10 时敲门。
 * 牌堆摸空时把弃牌堆（保留顶牌）洗回牌堆；组牌后手牌为空直接获胜。
 */
@Slf4j
public class DummyGame extends AbstractCardGame<DummyState, DummyPlayer, DummyAction> {

    public static final int MIN_PLAYERS = 2;
    public static final int MAX_PLAYERS = 4;

    public DummyGame(Random random) {
        super(new DummyState(), 1, MAX_PLAYERS, random);
        requireDeckFits(MAX_PLAYERS, handSize(MAX_PLAYERS), 1, Deck.CARDS_PER_DECK);
        requireDeckFits(MIN_PLAYERS, handSize(MIN_PLAYERS), 1, Deck.CARDS_PER_DECK);
    }

    public DummyGame() {
        this(new Random());
    }

    /** 两人每人 10 张，三四人每人 7 张 */
    public static int handSize(int playerCount) {
        return playerCount == 2 ? 10 : 7;
    }

    @Override
    public GameType gameType() {
        return GameType.DUMMY;
    }

    @Override
    public Class<DummyState> stateType() {
        return DummyState.class;
    }

    @Override
    public Class<DummyAction> actionType() {
        return DummyAction.class;
    }

    @Override
    protected boolean isBetweenRounds() {
        return state.getPhase() == DummyPhase.WAITING;
    }

    @Override
    protected boolean canAct(DummyPlayer p) {
        return true;
    }

    @Override
    protected DummyPlayer newPlayer(String playerId, String displayName) {
        return new DummyPlayer(playerId, displayName);
    }

    @Override
    protected boolean dispatch(DummyAction action) {
        String id = action.playerId();
        return switch (action.kind()) {
            case START_ROUND -> startRound();
            case DRAW_DECK -> drawFromDeck(id);
            case DRAW_DISCARD -> drawFromDiscard(id);
            case MELD -> meld(id, ((DummyAction.MeldCards) action).cards()).isPresent();
            case LAY_OFF -> {
                DummyAction.LayOff lay = (DummyAction.LayOff) action;
                yield layOff(id, lay.card(), lay.meldId());
            }
            case DISCARD -> discard(id, ((DummyAction.Discard) action).card());
            case KNOCK -> knock(id);
            case END_ROUND -> endRound();
        };
    }

    // ---------------- 开局 ----------------

    public boolean startRound() {
        if (state.getPhase() != DummyPhase.WAITING || players().size() < MIN_PLAYERS) return false;
        resetTable();
        state.setPhase(DummyPhase.DEALING);
        state.getDiscardPile().clear();
        state.getMelds().clear();
        state.setMeldSeq(0);
        state.setKnockerId(null);
        state.setWinnerId(null);
        state.setWinType(null);

        int size = handSize(players().size());
        for (int i = 0; i < size; i++) {
            for (DummyPlayer p : players()) p.getHand().add(draw());
        }
        players().forEach(p -> DummyJudge.sortHand(p.getHand()));
        state.getDiscardPile().add(draw());

        // 起手位随局数轮转
        state.setCurrentPlayerIndex(Math.floorMod(state.getRoundNumber() - 1, players().size()));
        state.setPhase(DummyPhase.PLAYING);
        log.info("[dummy] 第 {} 局开始，每人 {} 张", state.getRoundNumber(), size);
        return true;
    }

    // ---------------- 摸牌 ----------------

    public boolean drawFromDeck(String playerId) {
        DummyPlayer p = turnPlayer(playerId);
        if (p == null || p.isHasDrawn()) return false;
        if (deck.isEmpty() && !recycleDiscards()) return false;
        p.getHand().add(draw());
        DummyJudge.sortHand(p.getHand());
        p.setHasDrawn(true);
        return true;
    }

    public boolean drawFromDiscard(String playerId) {
        DummyPlayer p = turnPlayer(playerId);
        List<Card> pile = state.getDiscardPile();
        if (p == null || p.isHasDrawn() || pile.isEmpty()) return false;
        p.getHand().add(pile.remove(pile.size() - 1));
        DummyJudge.sortHand(p.getHand());
        p.setHasDrawn(true);
        return true;
    }

    // ---------------- 组牌 / 贴牌 ----------------

    /** 组一组新牌，成功返回它；手牌因此清空则直接获胜 */
    public Optional<Meld> meld(String playerId, List<Card> cards) {
        DummyPlayer p = turnPlayer(playerId);
        if (p == null || !p.isHasDrawn() || cards == null || !holdsAll(p.getHand(), cards)) return Optional.empty();
        Optional<MeldType> type = DummyJudge.meldType(cards);
        if (type.isEmpty()) return Optional.empty();

        state.setMeldSeq(state.getMeldSeq() + 1);
        Meld meld = new Meld("m" + state.getMeldSeq(), type.get(), new ArrayList<>(cards), playerId);
        meld.getCards().sort((a, b) -> Integer.compare(a.rank(), b.rank()));
        p.getHand().removeAll(cards);
        state.getMelds().add(meld);
        checkDummy(p);
        return Optional.of(meld);
    }

    public boolean layOff(String playerId, Card card, String meldId) {
        DummyPlayer p = turnPlayer(playerId);
        if (p == null || !p.isHasDrawn() || card == null || !p.getHand().contains(card)) return false;
        Meld meld = state.getMelds().stream().filter(m -> m.getId().equals(meldId)).findFirst().orElse(null);
        if (meld == null || !DummyJudge.canLayOff(card, meld)) return false;
        p.getHand().remove(card);
        meld.getCards().add(card);
        meld.getCards().sort((a, b) -> Integer.compare(a.rank(), b.rank()));
        checkDummy(p);
        return true;
    }

    // ---------------- 结束回合 ----------------

    public boolean discard(String playerId, Card card) {
        DummyPlayer p = turnPlayer(playerId);
        if (p == null || !p.isHasDrawn() || card == null || !p.getHand().remove(card)) return false;
        state.getDiscardPile().add(card);
        p.setHasDrawn(false);
        advanceToNextPlayer();
        return true;
    }

    /** 敲门：已摸牌且死木不超过 10 点 */
    public boolean knock(String playerId) {
        DummyPlayer p = turnPlayer(playerId);
        if (p == null || !p.isHasDrawn()) return false;
        if (DummyJudge.deadwood(p.getHand()) > DummyJudge.KNOCK_LIMIT) return false;
        p.setKnocker(true);
        state.setKnockerId(playerId);
        state.setPhase(DummyPhase.KNOCKED);
        scoreKnock(p);
        return true;
    }

    public boolean endRound() {
        if (state.getPhase() != DummyPhase.FINISHED) return false;
        state.setPhase(DummyPhase.WAITING);
        return true;
    }

    // ---------------- 计分 ----------------

    /**
     * 敲门结算：所有人分数 = 死木点数。
     * 敲门者不高于其他人最低分则获胜；否则最低者反超获胜并再减 10 分。
     */
    private void scoreKnock(DummyPlayer knocker) {
        DummyPlayer lowestOther = null;
        for (DummyPlayer x : players()) {
            x.setScore(DummyJudge.deadwood(x.getHand()));
            if (x != knocker && (lowestOther == null || x.getScore() < lowestOther.getScore())) {
                lowestOther = x;
            }
        }
        if (lowestOther == null || knocker.getScore() <= lowestOther.getScore()) {
            finish(knocker, DummyWinType.KNOCK);
        } else {
            lowestOther.setScore(lowestOther.getScore() - DummyJudge.UNDERCUT_PENALTY);
            finish(lowestOther, DummyWinType.UNDERCUT);
        }
    }

    private void checkDummy(DummyPlayer p) {
        if (!p.getHand().isEmpty()) return;
        for (DummyPlayer x : players()) x.setScore(DummyJudge.deadwood(x.getHand()));
        p.setScore(-DummyJudge.DUMMY_BONUS);
        finish(p, DummyWinType.DUMMY);
    }

    private void finish(DummyPlayer winner, DummyWinType type) {
        state.setWinnerId(winner.getPlayerId());
        state.setWinType(type);
        state.setPhase(DummyPhase.FINISHED);
        log.info("[dummy] 第 {} 局结束，{} 获胜（{}）", state.getRoundNumber(), winner.getPlayerId(), type);
    }

    // ---------------- 工具 ----------------

    /** 弃牌堆除顶牌外洗回牌堆；不足两张时无法回收 */
    private boolean recycleDiscards() {
        List<Card> pile = state.getDiscardPile();
        if (pile.size() <= 1) return false;
        Card top = pile.remove(pile.size() - 1);
        deck.recycle(pile);
        log.debug("[dummy] 牌堆摸空，回收 {} 张弃牌", pile.size());
        pile.clear();
        pile.add(top);
        return true;
    }

    private DummyPlayer turnPlayer(String playerId) {
        if (state.getPhase() != DummyPhase.PLAYING || !isTurnOf(playerId)) return null;
        return currentPlayer();
    }

    private static boolean holdsAll(List<Card> hand, List<Card> cards) {
        Set<Card> unique = new HashSet<>(cards);
        return unique.size() == cards.size() && hand.containsAll(unique);
    }
}
