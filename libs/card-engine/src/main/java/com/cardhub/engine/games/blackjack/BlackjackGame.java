package com.cardhub.engine.games.blackjack;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.core.AbstractCardGame;
import com.cardhub.engine.core.GameType;
import com.cardhub.engine.games.blackjack.domain.command.BlackjackAction;
import com.cardhub.engine.games.blackjack.domain.enums.BlackjackPhase;
import com.cardhub.engine.games.blackjack.domain.enums.HandOutcome;
import com.cardhub.engine.games.blackjack.domain.model.BlackjackHand;
import com.cardhub.engine.games.blackjack.domain.model.BlackjackPlayer;
import com.cardhub.engine.games.blackjack.domain.model.BlackjackRules;
import com.cardhub.engine.games.blackjack.domain.model.BlackjackState;
import com.cardhub.engine.games.blackjack.domain.rule.BlackjackJudge;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Random;

/**
 * 21 点引擎（玩家对牌桌庄家）。
 * - 多副牌鞋，剩余低于洗牌线时开局前重洗；
 * - 状态按“手”记录：分牌后每手独立下注、独立结算；
 * - 庄家不提前看暗牌，玩家全部结束后才翻开并补到 17；
 * - 天然 21 赔 3:2（取整），投降输一半（取整），保险赔 2:1。
 */
@Slf4j
public class BlackjackGame extends AbstractCardGame<BlackjackState, BlackjackPlayer, BlackjackAction> {

    private final BlackjackRules rules;

    public BlackjackGame(BlackjackRules rules, Random random) {
        super(new BlackjackState(), rules.decks(), rules.maxPlayers(), random);
        if (rules.reshuffleThreshold() > deck.size()) {
            throw new IllegalArgumentException("洗牌线超过牌鞋总数: " + rules.reshuffleThreshold());
        }
        // 洗牌线以上至少要够首轮发牌
        requireDeckFits(rules.maxPlayers(), 2, 2, rules.reshuffleThreshold());
        this.rules = rules;
        deck.shuffle();
    }

    public BlackjackGame() {
        this(BlackjackRules.defaults(), new Random());
    }

    @Override
    public GameType gameType() {
        return GameType.BLACKJACK;
    }

    @Override
    public Class<BlackjackState> stateType() {
        return BlackjackState.class;
    }

    @Override
    public Class<BlackjackAction> actionType() {
        return BlackjackAction.class;
    }

    @Override
    protected boolean isBetweenRounds() {
        return state.getPhase() == BlackjackPhase.WAITING;
    }

    @Override
    protected boolean canAct(BlackjackPlayer p) {
        return p.isHasBet() && p.activeHand() != null;
    }

    @Override
    protected BlackjackPlayer newPlayer(String playerId, String displayName) {
        return new BlackjackPlayer(playerId, displayName, rules.startingChips());
    }

    @Override
    protected boolean dispatch(BlackjackAction action) {
        String id = action.playerId();
        return switch (action.kind()) {
            case START_ROUND -> startRound();
            case PLACE_BET -> placeBet(id, ((BlackjackAction.PlaceBet) action).amount());
            case HIT -> hit(id);
            case STAND -> stand(id);
            case DOUBLE -> doubleDown(id);
            case SPLIT -> split(id);
            case SURRENDER -> surrender(id);
            case INSURANCE -> insurance(id);
            case END_ROUND -> endRound();
        };
    }

    // ---------------- 开局与下注 ----------------

    /**
     * 开局。筹码不够最低下注的玩家本局不参与；没人能下注时拒绝开局。
     */
    public boolean startRound() {
        if (state.getPhase() != BlackjackPhase.WAITING || players().isEmpty()) return false;
        if (players().stream().noneMatch(p -> p.getChips() >= rules.minBet())) return false;
        if (deck.remaining() < rules.reshuffleThreshold()) {
            log.info("[blackjack] 牌鞋剩余 {} 张，重新洗牌", deck.remaining());
            deck.reset();
        }
        for (BlackjackPlayer p : players()) {
            p.resetForRound();
            if (p.getChips() < rules.minBet()) {
                p.setSittingOut(true);
                log.info("[blackjack] {} 筹码 {} 不足最低下注，本局不参与", p.getPlayerId(), p.getChips());
            }
        }
        state.setRoundNumber(state.getRoundNumber() + 1);
        state.getDealerHand().clear();
        state.setHoleCardRevealed(false);
        state.setDealerValue(0);
        state.setPhase(BlackjackPhase.BETTING);
        return true;
    }

    public boolean placeBet(String playerId, int amount) {
        if (state.getPhase() != BlackjackPhase.BETTING) return false;
        BlackjackPlayer p = findPlayer(playerId).orElse(null);
        if (p == null || p.isHasBet() || p.isSittingOut()) return false;
        if (amount < rules.minBet() || amount > rules.maxBet() || amount > p.getChips()) return false;
        p.getHands().add(new BlackjackHand(amount));
        p.setHasBet(true);
        if (players().stream().allMatch(x -> x.isHasBet() || x.isSittingOut())) {
            dealInitialCards();
        }
        return true;
    }

    private void dealInitialCards() {
        state.setPhase(BlackjackPhase.DEALING);
        for (int round = 0; round < 2; round++) {
            for (BlackjackPlayer p : players()) {
                if (p.isHasBet()) p.getHands().get(0).getCards().add(draw());
            }
            state.getDealerHand().add(draw());
        }
        for (BlackjackPlayer p : players()) {
            if (!p.isHasBet()) continue;
            BlackjackHand h = p.getHands().get(0);
            if (BlackjackJudge.isBlackjack(h.getCards())) {
                h.setBlackjack(true);
                h.setStood(true);
            }
        }
        state.setPhase(BlackjackPhase.PLAYER_TURN);
        state.setCurrentPlayerIndex(players().size() - 1);
        if (!advanceToNextPlayer()) dealerTurn();
    }

    // ---------------- 玩家动作 ----------------

    public boolean hit(String playerId) {
        BlackjackHand h = actingHand(playerId);
        if (h == null) return false;
        h.getCards().add(draw());
        int value = BlackjackJudge.handValue(h.getCards());
        if (value > BlackjackJudge.BLACKJACK) {
            h.setBust(true);
        } else if (value == BlackjackJudge.BLACKJACK) {
            h.setStood(true);
        }
        afterAction();
        return true;
    }

    public boolean stand(String playerId) {
        BlackjackHand h = actingHand(playerId);
        if (h == null) return false;
        h.setStood(true);
        afterAction();
        return true;
    }

    /** 加倍：只在两张时，下注翻倍，只再拿一张 */
    public boolean doubleDown(String playerId) {
        BlackjackHand h = actingHand(playerId);
        if (h == null || h.getCards().size() != 2) return false;
        BlackjackPlayer p = currentPlayer();
        if (p.committed() + h.getBet() > p.getChips()) return false;
        h.setBet(h.getBet() * 2);
        h.setDoubled(true);
        h.getCards().add(draw());
        if (BlackjackJudge.isBust(h.getCards())) {
            h.setBust(true);
        } else {
            h.setStood(true);
        }
        afterAction();
        return true;
    }

    /** 分牌：两张同点，最多分到 maxHands 手，每手各补一张 */
    public boolean split(String playerId) {
        BlackjackHand h = actingHand(playerId);
        if (h == null || !BlackjackJudge.canSplit(h.getCards())) return false;
        BlackjackPlayer p = currentPlayer();
        if (p.getHands().size() >= rules.maxHands()) return false;
        if (p.committed() + h.getBet() > p.getChips()) return false;

        BlackjackHand second = new BlackjackHand(h.getBet());
        second.setSplit(true);
        second.getCards().add(h.getCards().remove(1));
        h.setSplit(true);
        h.getCards().add(draw());
        second.getCards().add(draw());
        int at = 0;
        while (p.getHands().get(at) != h) at++;
        p.getHands().add(at + 1, second);
        for (BlackjackHand x : List.of(h, second)) {
            if (BlackjackJudge.handValue(x.getCards()) == BlackjackJudge.BLACKJACK) x.setStood(true);
        }
        afterAction();
        return true;
    }

    /** 投降：只在第一个动作之前、单手两张时 */
    public boolean surrender(String playerId) {
        BlackjackHand h = actingHand(playerId);
        if (h == null) return false;
        BlackjackPlayer p = currentPlayer();
        if (p.isHasActed() || p.getHands().size() != 1 || h.getCards().size() != 2) return false;
        h.setSurrendered(true);
        afterAction();
        return true;
    }

    /** 保险：庄家明牌是 A，第一个动作之前，金额为下注一半 */
    public boolean insurance(String playerId) {
        BlackjackHand h = actingHand(playerId);
        if (h == null) return false;
        BlackjackPlayer p = currentPlayer();
        if (p.isHasActed() || p.getInsuranceBet() > 0 || !state.getDealerHand().get(0).isAce()) return false;
        int ins = Math.max(1, h.getBet() / 2);
        if (p.committed() + ins > p.getChips()) return false;
        p.setInsuranceBet(ins);
        return true;
    }

    public boolean endRound() {
        if (state.getPhase() != BlackjackPhase.FINISHED) return false;
        state.setPhase(BlackjackPhase.WAITING);
        return true;
    }

    // ---------------- 推进 ----------------

    private void afterAction() {
        currentPlayer().setHasActed(true);
        if (canAct(currentPlayer())) return;
        if (!advanceToNextPlayer()) dealerTurn();
    }

    private void dealerTurn() {
        state.setPhase(BlackjackPhase.DEALER_TURN);
        state.setHoleCardRevealed(true);
        boolean anyLive = players().stream()
                .flatMap(p -> p.getHands().stream())
                .anyMatch(h -> !h.isBust() && !h.isSurrendered());
        if (anyLive) {
            while (BlackjackJudge.dealerShouldHit(state.getDealerHand())) {
                state.getDealerHand().add(draw());
            }
        }
        state.setDealerValue(BlackjackJudge.handValue(state.getDealerHand()));
        settle();
    }

    private void settle() {
        state.setPhase(BlackjackPhase.SETTLING);
        List<Card> dealer = state.getDealerHand();
        int dealerValue = BlackjackJudge.handValue(dealer);
        boolean dealerBlackjack = BlackjackJudge.isBlackjack(dealer);
        boolean dealerBust = dealerValue > BlackjackJudge.BLACKJACK;

        for (BlackjackPlayer p : players()) {
            int total = 0;
            for (BlackjackHand h : p.getHands()) {
                settleHand(h, dealerValue, dealerBlackjack, dealerBust);
                total += h.getPayout();
            }
            if (p.getInsuranceBet() > 0) {
                total += dealerBlackjack ? p.getInsuranceBet() * 2 : -p.getInsuranceBet();
            }
            p.setTotalPayout(total);
            p.setChips(p.getChips() + total);
        }
        state.setPhase(BlackjackPhase.FINISHED);
        log.info("[blackjack] 第 {} 局结算，庄家 {} 点", state.getRoundNumber(), dealerValue);
    }

    private static void settleHand(BlackjackHand h, int dealerValue, boolean dealerBlackjack, boolean dealerBust) {
        int bet = h.getBet();
        int value = BlackjackJudge.handValue(h.getCards());
        if (h.isSurrendered()) {
            outcome(h, HandOutcome.SURRENDER, -(bet / 2));
        } else if (h.isBust()) {
            outcome(h, HandOutcome.BUST, -bet);
        } else if (h.isBlackjack() && !h.isSplit()) {
            if (dealerBlackjack) outcome(h, HandOutcome.PUSH, 0);
            else outcome(h, HandOutcome.BLACKJACK, bet * 3 / 2);
        } else if (dealerBlackjack) {
            outcome(h, HandOutcome.LOSE, -bet);
        } else if (dealerBust || value > dealerValue) {
            outcome(h, HandOutcome.WIN, bet);
        } else if (value < dealerValue) {
            outcome(h, HandOutcome.LOSE, -bet);
        } else {
            outcome(h, HandOutcome.PUSH, 0);
        }
    }

    private static void outcome(BlackjackHand h, HandOutcome o, int payout) {
        h.setOutcome(o);
        h.setPayout(payout);
    }

    // ---------------- 工具 ----------------

    /** 轮到该玩家且有未结束的一手，返回那一手，否则 null */
    private BlackjackHand actingHand(String playerId) {
        if (state.getPhase() != BlackjackPhase.PLAYER_TURN || !isTurnOf(playerId)) return null;
        return currentPlayer().activeHand();
    }

    public BlackjackRules rules() {
        return rules;
    }
}
