package com.cardhub.engine.core;

import com.cardhub.engine.card.DeckSnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 牌桌状态公共部分：玩家列表、当前行动位、局数、牌堆快照。
 * - 由引擎独占，外部只能通过动作修改；
 * - deck 只在 serialize() 时填充，随状态一起传输。
 *
 * @param <P> 具体游戏的玩家类型
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class TableState<P extends SeatPlayer> implements GameState {

    private List<P> players = new ArrayList<>();

    private int currentPlayerIndex;

    private int roundNumber;

    private DeckSnapshot deck;

    /** 当前阶段名（各游戏自己的阶段枚举） */
    public abstract String phaseName();

    @Override
    @SuppressWarnings("unchecked")
    public TableState<P> copy() {
        return (TableState<P>) EngineJson.MAPPER.convertValue(EngineJson.MAPPER.valueToTree(this), getClass());
    }
}
