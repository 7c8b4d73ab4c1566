package com.cardhub.engine.games.pokdeng.domain.model;

import com.cardhub.engine.core.TableState;
import com.cardhub.engine.games.pokdeng.domain.enums.PokDengPhase;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 博丁对局状态：庄家位 + 阶段，其余在玩家身上。
 */
@Data
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PokDengState extends TableState<PokDengPlayer> {

    private PokDengPhase phase = PokDengPhase.WAITING;

    private int dealerIndex;

    @Override
    public String phaseName() {
        return phase.name();
    }
}
