package com.gunzi.engine;

import com.gunzi.config.DeclarationPriority;
import com.gunzi.model.Card;
import com.gunzi.model.Rank;
import java.util.List;

/**
 * 亮主/反主强度
 *
 * 亮主只能用级牌（1-4 张相同）或足够张数的同种王。
 * 强度是一个全序：后来者必须严格更强才能反主，强度相同不能反。
 */
public class DeclarationRules {

    // 种类：红色级牌 > 黑色级牌 > 大王 > 小王
    private static final int KIND_RED_LEVEL = 4;
    private static final int KIND_BLACK_LEVEL = 3;
    private static final int KIND_BIG_JOKER = 2;
    private static final int KIND_SMALL_JOKER = 1;

    /**
     * 计算亮主强度，不合法返回 0
     */
    public static int strength(List<Card> cards, int level, int minJokers, DeclarationPriority priority) {
        if (cards == null || cards.isEmpty() || cards.size() > 4) {
            return 0;
        }
        Card first = cards.get(0);
        for (Card card : cards) {
            if (!card.isSameAs(first)) {
                return 0;
            }
        }

        int count = cards.size();
        int kind;
        if (first.getRank() == Rank.BIG_JOKER) {
            kind = KIND_BIG_JOKER;
        } else if (first.getRank() == Rank.SMALL_JOKER) {
            kind = KIND_SMALL_JOKER;
        } else if (first.getRank().getValue() == level) {
            kind = first.getSuit().isRed() ? KIND_RED_LEVEL : KIND_BLACK_LEVEL;
        } else {
            return 0;
        }

        if (first.isJoker() && count < minJokers) {
            return 0;
        }

        if (priority == DeclarationPriority.KIND_FIRST) {
            return kind * 10 + count;
        }
        return count * 10 + kind;
    }
}
