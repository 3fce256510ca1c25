package com.gunzi.engine;

import com.gunzi.model.Card;
import com.gunzi.model.Rank;
import com.gunzi.model.Suit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 扑克牌工厂 - 创建、校验和洗牌
 */
public class DeckFactory {

    /** 一副牌：52 张 + 大小王 */
    public static final int CARDS_PER_DECK = 54;

    /**
     * 创建 deckCount 副完整的牌（四副共216张）
     * 黑红梅方各 2-A 共 52 张
     * 大王、小王各一张
     */
    public static List<Card> createFullDeck(int deckCount) {
        List<Card> cards = new ArrayList<>(deckCount * CARDS_PER_DECK);

        for (int deck = 0; deck < deckCount; deck++) {
            // 四种花色，2-A
            for (Suit suit : Suit.plainSuits()) {
                for (Rank rank : Rank.values()) {
                    if (!rank.isJoker()) {
                        cards.add(new Card(suit, rank, cardId(deck, suit, rank)));
                    }
                }
            }

            // 大小王
            cards.add(new Card(Suit.JOKER, Rank.SMALL_JOKER, cardId(deck, Suit.JOKER, Rank.SMALL_JOKER)));
            cards.add(new Card(Suit.JOKER, Rank.BIG_JOKER, cardId(deck, Suit.JOKER, Rank.BIG_JOKER)));
        }

        return cards;
    }

    /**
     * 校验牌数：总数 = deckCount * 54，每种牌恰好 deckCount 张，id 不重复
     * 牌数不对属于结构性错误，直接抛出，不允许带着错误的牌继续开局
     */
    public static void verify(List<Card> cards, int deckCount) {
        if (cards.size() != deckCount * CARDS_PER_DECK) {
            throw new IllegalStateException("牌数错误：期望 " + deckCount * CARDS_PER_DECK + " 张，实际 " + cards.size());
        }
        Map<String, Integer> faceCount = new HashMap<>();
        Map<String, Boolean> ids = new HashMap<>();
        for (Card card : cards) {
            faceCount.merge(card.faceKey(), 1, Integer::sum);
            if (ids.put(card.getId(), Boolean.TRUE) != null) {
                throw new IllegalStateException("牌ID重复：" + card.getId());
            }
        }
        if (faceCount.size() != CARDS_PER_DECK) {
            throw new IllegalStateException("牌种类错误：期望 " + CARDS_PER_DECK + " 种，实际 " + faceCount.size());
        }
        for (Map.Entry<String, Integer> entry : faceCount.entrySet()) {
            if (entry.getValue() != deckCount) {
                throw new IllegalStateException("牌 " + entry.getKey() + " 数量错误：" + entry.getValue());
            }
        }
    }

    /**
     * 洗牌
     */
    public static void shuffle(List<Card> cards, Random random) {
        Collections.shuffle(cards, random);
    }

    /**
     * 创建、校验并洗好的牌堆
     */
    public static List<Card> createAndShuffleDeck(int deckCount, Random random) {
        List<Card> cards = createFullDeck(deckCount);
        verify(cards, deckCount);
        shuffle(cards, random);
        return cards;
    }

    private static String cardId(int deck, Suit suit, Rank rank) {
        return "d" + deck + "_" + suit.name() + "_" + rank.name();
    }
}
