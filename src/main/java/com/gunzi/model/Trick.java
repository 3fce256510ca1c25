package com.gunzi.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一墩牌：按出牌顺序记录，第一手为首家
 */
public class Trick {
    private final int capacity;
    private final List<TrickPlay> plays = new ArrayList<>();

    public Trick(int capacity) {
        this.capacity = capacity;
    }

    public boolean isEmpty() {
        return plays.isEmpty();
    }

    public boolean isComplete() {
        return plays.size() >= capacity;
    }

    public int size() {
        return plays.size();
    }

    public TrickPlay getLead() {
        return plays.isEmpty() ? null : plays.get(0);
    }

    public List<TrickPlay> getPlays() {
        return Collections.unmodifiableList(plays);
    }

    public void add(TrickPlay play) {
        if (isComplete()) {
            throw new IllegalStateException("本墩已满：" + capacity);
        }
        plays.add(play);
    }

    public int getPoints() {
        int points = 0;
        for (TrickPlay play : plays) {
            points += play.getPoints();
        }
        return points;
    }

    public void clear() {
        plays.clear();
    }
}
