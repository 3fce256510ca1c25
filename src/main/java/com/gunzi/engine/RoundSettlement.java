package com.gunzi.engine;

import com.gunzi.config.GameProperties;
import com.gunzi.model.GameState;
import com.gunzi.model.Rank;
import com.gunzi.model.RoundResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 一局结算：扣底、判定庄家是否守住、升级、决定下一局庄家
 */
public class RoundSettlement {

    private static final Logger log = LoggerFactory.getLogger(RoundSettlement.class);

    /**
     * 结算本局（最后一墩已计分后调用）
     * 会把扣底分计入 state 的组分，返回冻结的结算结果；级数与庄家要等开下一局时才生效
     */
    public static RoundResult settle(GameState state, GameProperties props) {
        int dealer = state.getDealerIndex();
        int dealerTeam = state.getDealerTeam();
        int lastWinner = state.getLastTrickWinner();
        int lastTeam = state.teamOf(lastWinner);

        // 1. 扣底：抓分方赢最后一墩则底分翻倍归该组；庄家组赢则底分归庄家组，抓分方拿不到
        int bottomPoints = state.getBottomPoints();
        int kouDiPoints = 0;
        if (state.isCatchingTeam(lastTeam)) {
            kouDiPoints = bottomPoints * props.getKouDiMultiplier();
            state.addTeamScore(lastTeam, kouDiPoints);
            log.info("扣底！组 {} 获得底分 {} x {} = {}", lastTeam, bottomPoints, props.getKouDiMultiplier(), kouDiPoints);
        } else {
            state.addTeamScore(dealerTeam, bottomPoints);
            log.info("庄家组赢得最后一墩，底分 {} 不计入抓分方", bottomPoints);
        }

        // 2. 抓分方最高分
        int bestTeam = -1;
        int bestScore = 0;
        for (int i = 1; i < state.getPlayerCount(); i++) {
            int seat = (dealer + i) % state.getPlayerCount();
            int team = state.teamOf(seat);
            if (team == dealerTeam) {
                continue;
            }
            int score = state.getTeamScore(team);
            // 同分时赢得最后一墩的组优先，否则按庄家之后的座位顺序
            if (bestTeam < 0 || score > bestScore || (score == bestScore && team == lastTeam)) {
                bestTeam = team;
                bestScore = score;
            }
        }

        int[] levels = state.getTeamLevels();
        boolean dealerDefended = bestScore < props.getLevelUpThreshold();
        int winningTeam;
        int matchWinner = -1;

        // 3. 升级 / 下庄
        if (dealerDefended) {
            winningTeam = dealerTeam;
            int newLevel = levels[dealerTeam] + props.getLevelStep();
            if (newLevel > Rank.ACE.getValue()) {
                matchWinner = dealerTeam;
                newLevel = Rank.ACE.getValue();
                log.info("组 {} 打过 A，赢得整场比赛", dealerTeam);
            }
            levels[dealerTeam] = newLevel;
            log.info("庄家组 {} 守住（抓分方最高 {} 分），升到 {}", dealerTeam, bestScore, Rank.fromValue(newLevel).getLabel());
        } else {
            winningTeam = bestTeam;
            log.info("抓分组 {} 得 {} 分，下庄", bestTeam, bestScore);
        }

        int nextDealer = firstSeatOfTeam(state, dealer, winningTeam);
        int nextLevel = levels[winningTeam];

        return new RoundResult(dealerTeam, state.getTeamScores(), bestScore, bottomPoints, kouDiPoints,
            lastTeam, winningTeam, dealerDefended, nextDealer, levels, nextLevel, matchWinner);
    }

    /**
     * 从庄家之后按座位顺序找到的第一个属于 team 的座位（庄家组即为庄家的对家）
     */
    public static int firstSeatOfTeam(GameState state, int dealer, int team) {
        for (int i = 1; i <= state.getPlayerCount(); i++) {
            int seat = (dealer + i) % state.getPlayerCount();
            if (state.teamOf(seat) == team) {
                return seat;
            }
        }
        return dealer;
    }
}
