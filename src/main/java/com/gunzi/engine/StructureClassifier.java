package com.gunzi.engine;

import com.gunzi.model.Card;
import com.gunzi.model.MoveType;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 牌型识别：只有花色和点数完全相同的 1-4 张牌才成牌型
 */
public class StructureClassifier {

    /**
     * 识别牌型
     */
    public static MoveType classify(List<Card> cards) {
        if (cards == null || cards.isEmpty() || cards.size() > 4) {
            return MoveType.INVALID;
        }
        Card first = cards.get(0);
        for (Card card : cards) {
            if (!card.isSameAs(first)) {
                return MoveType.INVALID;
            }
        }
        return MoveType.ofSize(cards.size());
    }

    /**
     * 按花色+点数分组计数
     */
    public static Map<String, Integer> groupByFace(Collection<Card> cards) {
        Map<String, Integer> counts = new HashMap<>();
        for (Card card : cards) {
            counts.merge(card.faceKey(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * 最大的相同牌组张数（空集合为 0）
     */
    public static int largestGroup(Collection<Card> cards) {
        int max = 0;
        for (int count : groupByFace(cards).values()) {
            max = Math.max(max, count);
        }
        return max;
    }
}
