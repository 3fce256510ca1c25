package com.gunzi.model;

/**
 * 花色
 */
public enum Suit {
    SPADE("♠"),     // 黑桃
    HEART("♥"),     // 红桃
    CLUB("♣"),      // 梅花
    DIAMOND("♦"),   // 方块
    JOKER("王");    // 大小王

    private final String symbol;

    Suit(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 是否为红色花色（红桃、方块）
     */
    public boolean isRed() {
        return this == HEART || this == DIAMOND;
    }

    /**
     * 四种普通花色（不含王）
     */
    public static Suit[] plainSuits() {
        return new Suit[]{SPADE, HEART, CLUB, DIAMOND};
    }
}
