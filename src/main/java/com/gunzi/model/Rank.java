package com.gunzi.model;

/**
 * 点数
 */
public enum Rank {
    TWO(2, "2"),
    THREE(3, "3"),
    FOUR(4, "4"),
    FIVE(5, "5"),
    SIX(6, "6"),
    SEVEN(7, "7"),
    EIGHT(8, "8"),
    NINE(9, "9"),
    TEN(10, "10"),
    JACK(11, "J"),
    QUEEN(12, "Q"),
    KING(13, "K"),
    ACE(14, "A"),
    SMALL_JOKER(15, "小王"),
    BIG_JOKER(16, "大王");

    private final int value;
    private final String label;

    Rank(int value, String label) {
        this.value = value;
        this.label = label;
    }

    public int getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public boolean isJoker() {
        return this == SMALL_JOKER || this == BIG_JOKER;
    }

    /**
     * 分牌分值：5 为 5 分，10 和 K 为 10 分
     */
    public int getPoints() {
        switch (this) {
            case FIVE:
                return 5;
            case TEN:
            case KING:
                return 10;
            default:
                return 0;
        }
    }

    /**
     * 根据数值查找点数（级牌用 2-14 表示）
     */
    public static Rank fromValue(int value) {
        for (Rank rank : values()) {
            if (rank.value == value) {
                return rank;
            }
        }
        throw new IllegalArgumentException("未知点数：" + value);
    }
}
