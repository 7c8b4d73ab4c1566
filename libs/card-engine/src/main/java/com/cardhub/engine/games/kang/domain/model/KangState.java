package com.cardhub.engine.games.kang.domain.model;

import com.cardhub.engine.core.TableState;
import com.cardhub.engine.games.kang.domain.enums.KangPhase;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.EqualsAndHashCode;

@Data
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KangState extends TableState<KangPlayer> {

    private KangPhase phase = KangPhase.WAITING;

    private int dealerIndex;

    @Override
    public String phaseName() {
        return phase.name();
    }
}
