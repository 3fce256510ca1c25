package com.gunzi.engine;

import com.gunzi.model.Card;
import com.gunzi.model.EffectiveSuit;
import com.gunzi.model.MoveType;
import com.gunzi.model.Suit;
import com.gunzi.model.Trick;
import com.gunzi.model.TrickPlay;
import java.util.List;

/**
 * 一墩结算：判定赢家与分数
 */
public class TrickResolver {

    /**
     * 判定一墩的赢家座位
     * 只有牌型与首家相同、且跟的是首家花色或主牌的出牌才有资格赢；
     * 牌力高者胜，牌力相同先出者胜（按离首家的座位距离判断，与存储顺序无关）
     */
    public static int resolveWinner(List<TrickPlay> plays, int leaderSeat, int playerCount,
                                    Suit mainSuit, int level) {
        TrickPlay lead = null;
        for (TrickPlay play : plays) {
            if (play.getSeat() == leaderSeat) {
                lead = play;
                break;
            }
        }
        if (lead == null) {
            throw new IllegalArgumentException("本墩没有首家出牌：" + leaderSeat);
        }

        MoveType leadType = StructureClassifier.classify(lead.getCards());
        EffectiveSuit leadSuit = TrumpResolver.effectiveSuit(lead.getCards().get(0), mainSuit, level);

        TrickPlay best = lead;
        int bestPower = TrumpResolver.power(lead.getCards().get(0), mainSuit, level);

        for (TrickPlay challenger : plays) {
            if (challenger == lead || !canWin(challenger, leadType, leadSuit, mainSuit, level)) {
                continue;
            }
            int power = TrumpResolver.power(challenger.getCards().get(0), mainSuit, level);
            boolean stronger = power > bestPower;
            boolean earlierTie = power == bestPower
                && playOrder(challenger.getSeat(), leaderSeat, playerCount)
                    < playOrder(best.getSeat(), leaderSeat, playerCount);
            if (stronger || earlierTie) {
                best = challenger;
                bestPower = power;
            }
        }
        return best.getSeat();
    }

    public static int resolveWinner(Trick trick, Suit mainSuit, int level, int playerCount) {
        return resolveWinner(trick.getPlays(), trick.getLead().getSeat(), playerCount, mainSuit, level);
    }

    /**
     * 是否有资格赢：牌型相同，并且跟的是首家花色或者用主牌杀
     */
    private static boolean canWin(TrickPlay challenger, MoveType leadType, EffectiveSuit leadSuit,
                                  Suit mainSuit, int level) {
        List<Card> cards = challenger.getCards();
        if (StructureClassifier.classify(cards) != leadType) {
            return false;
        }
        EffectiveSuit suit = TrumpResolver.effectiveSuit(cards.get(0), mainSuit, level);
        return suit == leadSuit || suit == EffectiveSuit.MAIN;
    }

    /**
     * 出牌先后：首家为 0，依次加一
     */
    private static int playOrder(int seat, int leaderSeat, int playerCount) {
        return (seat - leaderSeat + playerCount) % playerCount;
    }
}
