package com.gunzi.model;

/**
 * 规则花色：所有主牌归入 MAIN，副牌按自然花色
 */
public enum EffectiveSuit {
    MAIN,
    SPADE,
    HEART,
    CLUB,
    DIAMOND;

    public static EffectiveSuit of(Suit suit) {
        switch (suit) {
            case SPADE:
                return SPADE;
            case HEART:
                return HEART;
            case CLUB:
                return CLUB;
            case DIAMOND:
                return DIAMOND;
            default:
                // 王永远是主牌
                return MAIN;
        }
    }
}
