package com.gunzi.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 玩家（座位）
 * 六人分三组，对家为同组：座位 i 的组号为 i % 3
 */
public class Player {
    private final String id;                    // 玩家ID
    private String name;                        // 玩家名称
    private final int seat;                     // 座位（0-5）
    private final int team;                     // 组号（0-2）
    private final Map<String, Card> hand;       // 手牌（id -> 牌），保持摸牌顺序

    public Player(String id, String name, int seat) {
        this.id = id;
        this.name = name;
        this.seat = seat;
        this.team = seat % 3;
        this.hand = new LinkedHashMap<>();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getSeat() {
        return seat;
    }

    public int getTeam() {
        return team;
    }

    /**
     * 手牌快照（按摸牌顺序）
     */
    public List<Card> getHandCards() {
        return new ArrayList<>(hand.values());
    }

    public int getHandSize() {
        return hand.size();
    }

    public boolean hasCard(String cardId) {
        return hand.containsKey(cardId);
    }

    public Card getCard(String cardId) {
        return hand.get(cardId);
    }

    /**
     * 添加手牌
     */
    public void addCard(Card card) {
        hand.put(card.getId(), card);
    }

    public void addCards(Collection<Card> cards) {
        for (Card card : cards) {
            addCard(card);
        }
    }

    /**
     * 移除手牌，调用前必须已校验所有 id 都在手中
     */
    public List<Card> removeCards(List<String> cardIds) {
        List<Card> removed = new ArrayList<>(cardIds.size());
        for (String cardId : cardIds) {
            Card card = hand.remove(cardId);
            if (card == null) {
                throw new IllegalStateException("手牌中没有牌：" + cardId);
            }
            removed.add(card);
        }
        return removed;
    }

    /**
     * 开始新一局前清空手牌（座位/组号不变）
     */
    public void resetForNewRound() {
        hand.clear();
    }
}
