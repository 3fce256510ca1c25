package com.gunzi.engine;

import com.gunzi.model.Card;
import com.gunzi.model.EffectiveSuit;
import com.gunzi.model.Rank;
import com.gunzi.model.Suit;

/**
 * 主牌判定
 * 主牌：大小王、级牌、所有的 2、主花色的牌
 * 所有跟花色的判断（手牌分析、首家出牌、跟牌校验、比大小）都必须经过这里
 */
public class TrumpResolver {

    /**
     * 是否为主牌
     * @param mainSuit 主花色，未亮主/无主时为 null
     * @param level 当前级数（2-14）
     */
    public static boolean isMain(Card card, Suit mainSuit, int level) {
        if (card.isJoker()) {
            return true;
        }
        Rank rank = card.getRank();
        if (rank.getValue() == level || rank == Rank.TWO) {
            return true;
        }
        return mainSuit != null && card.getSuit() == mainSuit;
    }

    /**
     * 规则花色：主牌统一为 MAIN，副牌为自然花色
     */
    public static EffectiveSuit effectiveSuit(Card card, Suit mainSuit, int level) {
        if (isMain(card, mainSuit, level)) {
            return EffectiveSuit.MAIN;
        }
        return EffectiveSuit.of(card.getSuit());
    }

    /**
     * 牌力（越大越强）
     * 大王 > 小王 > 主级牌 > 副级牌 > 主2 > 副2 > 主花色 > 副牌
     */
    public static int power(Card card, Suit mainSuit, int level) {
        Rank rank = card.getRank();
        if (rank == Rank.BIG_JOKER) {
            return 900;
        }
        if (rank == Rank.SMALL_JOKER) {
            return 800;
        }
        boolean mainColored = mainSuit != null && card.getSuit() == mainSuit;
        if (rank.getValue() == level) {
            return mainColored ? 700 : 600;
        }
        if (rank == Rank.TWO) {
            return mainColored ? 500 : 400;
        }
        if (mainColored) {
            return 200 + rank.getValue();
        }
        return rank.getValue();
    }
}
