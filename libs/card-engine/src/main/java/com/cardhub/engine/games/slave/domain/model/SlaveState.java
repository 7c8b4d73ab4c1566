package com.cardhub.engine.games.slave.domain.model;

import com.cardhub.engine.core.TableState;
import com.cardhub.engine.games.slave.domain.enums.SlavePhase;
import com.cardhub.engine.games.slave.domain.enums.SlavePreset;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SlaveState extends TableState<SlavePlayer> {

    private SlavePhase phase = SlavePhase.WAITING;

    private SlavePreset preset = SlavePreset.CLASSIC;

    /** 桌面当前最大的一手；null 表示新一轮，可以任意出 */
    private SlavePlay currentPlay;

    private String lastPlayerId;

    private int passCount;

    private int finishCount;

    /** 本轮首个出牌人 */
    private int roundStarterIndex;

    @Override
    public String phaseName() {
        return phase.name();
    }
}
