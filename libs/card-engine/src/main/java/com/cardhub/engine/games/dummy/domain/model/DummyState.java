package com.cardhub.engine.games.dummy.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.core.TableState;
import com.cardhub.engine.games.dummy.domain.enums.DummyPhase;
import com.cardhub.engine.games.dummy.domain.enums.DummyWinType;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@Data
@EqualsAndHashCode(callSuper = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DummyState extends TableState<DummyPlayer> {

    private DummyPhase phase = DummyPhase.WAITING;

    /** 弃牌堆，末尾为可摸的那张 */
    private List<Card> discardPile = new ArrayList<>();

    private List<Meld> melds = new ArrayList<>();

    private int meldSeq;

    private String knockerId;

    private String winnerId;

    private DummyWinType winType;

    @Override
    public String phaseName() {
        return phase.name();
    }
}
