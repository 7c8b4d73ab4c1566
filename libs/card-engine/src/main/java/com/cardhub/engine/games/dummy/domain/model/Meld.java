package com.cardhub.engine.games.dummy.domain.model;

import com.cardhub.engine.card.Card;
import com.cardhub.engine.games.dummy.domain.enums.MeldType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 桌面上的一组牌。贴牌（lay off）会往里追加，所以是可变对象。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Meld {

    private String id;

    private MeldType type;

    private List<Card> cards = new ArrayList<>();

    private String ownerId;
}
