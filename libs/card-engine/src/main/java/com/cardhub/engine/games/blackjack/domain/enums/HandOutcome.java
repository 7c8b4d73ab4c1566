package com.cardhub.engine.games.blackjack.domain.enums;

public enum HandOutcome {
    WIN,
    BLACKJACK,
    PUSH,
    LOSE,
    BUST,
    SURRENDER
}
