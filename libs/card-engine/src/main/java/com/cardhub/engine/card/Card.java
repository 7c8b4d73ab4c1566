package com.cardhub.engine.card;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * 一张牌（不可变）。
 * - rank：1..13，1 = A，11/12/13 = J/Q/K；
 * - deckIndex：第几副牌，多副牌时区分同花同点的两张牌。
 * 三元组即身份，record 自带的 equals/hashCode 正好满足。
 */
public record Card(Suit suit, int rank, int deckIndex) {

    public static final int ACE = 1;
    public static final int JACK = 11;
    public static final int QUEEN = 12;
    public static final int KING = 13;

    public Card {
        Objects.requireNonNull(suit, "suit");
        if (rank < ACE || rank > KING) {
            throw new IllegalArgumentException("rank 超出范围: " + rank);
        }
    }

    /** 单副牌场景的便捷构造 */
    public static Card of(Suit suit, int rank) {
        return new Card(suit, rank, 0);
    }

    @JsonIgnore
    public boolean isAce() {
        return rank == ACE;
    }

    @JsonIgnore
    public boolean isFace() {
        return rank >= JACK;
    }

    /** 展示用，如 "A♠"、"10♥" */
    public String label() {
        String r = switch (rank) {
            case ACE -> "A";
            case JACK -> "J";
            case QUEEN -> "Q";
            case KING -> "K";
            default -> String.valueOf(rank);
        };
        return r + suit.symbol();
    }

    @Override
    public String toString() {
        return label();
    }
}
