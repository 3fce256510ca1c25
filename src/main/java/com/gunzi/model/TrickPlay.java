package com.gunzi.model;

import java.util.Collections;
import java.util.List;

/**
 * 一墩中某个座位打出的牌
 */
public class TrickPlay {
    private final int seat;
    private final List<Card> cards;

    public TrickPlay(int seat, List<Card> cards) {
        this.seat = seat;
        this.cards = Collections.unmodifiableList(cards);
    }

    public int getSeat() {
        return seat;
    }

    public List<Card> getCards() {
        return cards;
    }

    public int getPoints() {
        int points = 0;
        for (Card card : cards) {
            points += card.getPoints();
        }
        return points;
    }
}
