package com.gunzi.model;

import java.util.Collections;
import java.util.List;

/**
 * 某个座位的私有视图：公开快照 + 自己的手牌
 */
public class SeatView {
    private final int seat;
    private final RoomSnapshot room;
    private final List<Card> hand;

    public SeatView(int seat, RoomSnapshot room, List<Card> hand) {
        this.seat = seat;
        this.room = room;
        this.hand = Collections.unmodifiableList(hand);
    }

    public int getSeat() {
        return seat;
    }

    public RoomSnapshot getRoom() {
        return room;
    }

    public List<Card> getHand() {
        return hand;
    }
}
