package com.gunzi.engine;

import com.gunzi.model.Card;
import com.gunzi.model.EffectiveSuit;
import com.gunzi.model.MoveType;
import com.gunzi.model.RejectReason;
import com.gunzi.model.Suit;
import java.util.ArrayList;
import java.util.List;

/**
 * 跟牌校验器 - 检查非首家的出牌是否合法
 *
 * 1. 张数必须与首家相同
 * 2. 首家第一张牌的规则花色为本墩花色
 * 3. 手里该花色够数必须全跟该花色；不够则必须把该花色全部跟出
 * 4. 死棒：完全跟花色时，首家出炸子/滚子/对子，手里有同样或次一级的牌组就必须跟出
 */
public class FollowRuleValidator {

    /**
     * 校验跟牌
     * @param leaderCards 首家出的牌
     * @param played 跟牌者提交的牌
     * @param hand 跟牌者出牌前的全部手牌（包含 played）
     * @return 不合法的原因，合法返回 null
     */
    public static RejectReason validate(List<Card> leaderCards, List<Card> played, List<Card> hand,
                                        Suit mainSuit, int level) {
        int leaderCount = leaderCards.size();

        // 1. 张数
        if (played.size() != leaderCount) {
            return RejectReason.WRONG_CARD_COUNT;
        }

        // 2. 本墩花色
        EffectiveSuit targetSuit = TrumpResolver.effectiveSuit(leaderCards.get(0), mainSuit, level);

        // 3. 跟花色 / 出尽该花色
        List<Card> handSuitCards = filterSuit(hand, targetSuit, mainSuit, level);
        int handSuitCount = handSuitCards.size();
        int playedSuitCount = filterSuit(played, targetSuit, mainSuit, level).size();

        if (handSuitCount >= leaderCount) {
            if (playedSuitCount < leaderCount) {
                return RejectReason.MUST_FOLLOW_SUIT;
            }
        } else if (playedSuitCount < handSuitCount) {
            return RejectReason.MUST_EXHAUST_SUIT;
        }

        // 4. 死棒（只在完全跟花色时检查）
        if (playedSuitCount == leaderCount) {
            MoveType leaderType = StructureClassifier.classify(leaderCards);
            int required = requiredStructureSize(leaderType, handSuitCards);
            if (StructureClassifier.largestGroup(played) < required) {
                return RejectReason.DEAD_STICK;
            }
        }

        return null;
    }

    /**
     * 死棒要求：从首家牌型大小往下（炸子→滚子→对子）找手里第一个有的牌组大小
     * 单张或手里没有任何牌组时为 1（无要求）
     */
    public static int requiredStructureSize(MoveType leaderType, List<Card> handSuitCards) {
        int largestInHand = StructureClassifier.largestGroup(handSuitCards);
        for (int size = leaderType.getSize(); size >= 2; size--) {
            if (largestInHand >= size) {
                return size;
            }
        }
        return 1;
    }

    /**
     * 过滤出规则花色为 targetSuit 的牌
     */
    public static List<Card> filterSuit(List<Card> cards, EffectiveSuit targetSuit, Suit mainSuit, int level) {
        List<Card> result = new ArrayList<>();
        for (Card card : cards) {
            if (TrumpResolver.effectiveSuit(card, mainSuit, level) == targetSuit) {
                result.add(card);
            }
        }
        return result;
    }
}
