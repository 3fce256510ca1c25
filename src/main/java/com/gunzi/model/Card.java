package com.gunzi.model;

/**
 * 扑克牌
 * 四副牌中同花色同点数的牌有四张，id 只用于区分实体牌（选牌、移除），不参与任何规则比较
 * 牌一旦创建不可修改
 */
public class Card implements Comparable<Card> {
    private final Suit suit;          // 花色
    private final Rank rank;          // 点数
    private final String id;          // 唯一标识（用于区分同样的牌）

    public Card(Suit suit, Rank rank, String id) {
        this.suit = suit;
        this.rank = rank;
        this.id = id;
    }

    public Suit getSuit() {
        return suit;
    }

    public Rank getRank() {
        return rank;
    }

    public String getId() {
        return id;
    }

    public boolean isJoker() {
        return rank != null && rank.isJoker();
    }

    /**
     * 分值（5/10/K）
     */
    public int getPoints() {
        return rank.getPoints();
    }

    /**
     * 显示名称
     */
    public String getDisplayName() {
        if (isJoker()) {
            return rank.getLabel();
        }
        return suit.getSymbol() + rank.getLabel();
    }

    /**
     * 排序：先按花色，再按点数
     */
    @Override
    public int compareTo(Card other) {
        if (this.suit != other.suit) {
            return this.suit.ordinal() - other.suit.ordinal();
        }
        return this.rank.getValue() - other.rank.getValue();
    }

    @Override
    public String toString() {
        return getDisplayName();
    }

    /**
     * 判断两张牌是否相同（不考虑ID）
     */
    public boolean isSameAs(Card other) {
        return this.suit == other.suit && this.rank == other.rank;
    }

    /**
     * 花色+点数组成的分组键
     */
    public String faceKey() {
        return suit.name() + "_" + rank.name();
    }
}
