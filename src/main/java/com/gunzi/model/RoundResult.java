package com.gunzi.model;

/**
 * 一局结算结果（局末冻结，开下一局时生效）
 */
public class RoundResult {
    private final int dealerTeam;           // 本局庄家组
    private final int[] teamScores;         // 各组得分（含扣底）
    private final int catchingScore;        // 抓分方最高得分
    private final int bottomPoints;         // 底牌原始分
    private final int kouDiPoints;          // 扣底实际计入的分（已乘倍数）
    private final int lastTrickTeam;        // 最后一墩的赢家组
    private final int winningTeam;          // 本局胜方（庄家守住则为庄家组）
    private final boolean dealerDefended;   // 庄家是否守住
    private final int nextDealer;           // 下一局庄家座位
    private final int[] teamLevels;         // 结算后的各组级数
    private final int nextLevel;            // 下一局打的级
    private final int matchWinnerTeam;      // 整场胜者（-1 表示比赛继续）

    public RoundResult(int dealerTeam, int[] teamScores, int catchingScore, int bottomPoints,
                       int kouDiPoints, int lastTrickTeam, int winningTeam, boolean dealerDefended,
                       int nextDealer, int[] teamLevels, int nextLevel, int matchWinnerTeam) {
        this.dealerTeam = dealerTeam;
        this.teamScores = teamScores.clone();
        this.catchingScore = catchingScore;
        this.bottomPoints = bottomPoints;
        this.kouDiPoints = kouDiPoints;
        this.lastTrickTeam = lastTrickTeam;
        this.winningTeam = winningTeam;
        this.dealerDefended = dealerDefended;
        this.nextDealer = nextDealer;
        this.teamLevels = teamLevels.clone();
        this.nextLevel = nextLevel;
        this.matchWinnerTeam = matchWinnerTeam;
    }

    public int getDealerTeam() {
        return dealerTeam;
    }

    public int[] getTeamScores() {
        return teamScores.clone();
    }

    public int getCatchingScore() {
        return catchingScore;
    }

    public int getBottomPoints() {
        return bottomPoints;
    }

    public int getKouDiPoints() {
        return kouDiPoints;
    }

    public int getLastTrickTeam() {
        return lastTrickTeam;
    }

    public int getWinningTeam() {
        return winningTeam;
    }

    public boolean isDealerDefended() {
        return dealerDefended;
    }

    public int getNextDealer() {
        return nextDealer;
    }

    public int[] getTeamLevels() {
        return teamLevels.clone();
    }

    public int getNextLevel() {
        return nextLevel;
    }

    public int getMatchWinnerTeam() {
        return matchWinnerTeam;
    }

    public boolean isMatchOver() {
        return matchWinnerTeam >= 0;
    }
}
