package com.gunzi.model;

import java.util.Collections;
import java.util.List;

/**
 * 亮主/反主记录
 */
public class Declaration {
    private final int seat;             // 亮主座位
    private final List<String> cardIds; // 亮出的牌
    private final Suit suit;            // 叫的主花色（null 表示无主）
    private final int strength;         // 强度（越大越强）

    public Declaration(int seat, List<String> cardIds, Suit suit, int strength) {
        this.seat = seat;
        this.cardIds = Collections.unmodifiableList(cardIds);
        this.suit = suit;
        this.strength = strength;
    }

    public int getSeat() {
        return seat;
    }

    public List<String> getCardIds() {
        return cardIds;
    }

    public Suit getSuit() {
        return suit;
    }

    public int getStrength() {
        return strength;
    }
}
