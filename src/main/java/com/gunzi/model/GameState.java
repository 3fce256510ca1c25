package com.gunzi.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 房间游戏状态（只由 GameEngine 在持有房间写锁时修改）
 */
public class GameState {
    public static final int TEAM_COUNT = 3;

    private final String roomId;                // 房间ID
    private final Player[] seats;               // 座位（6 个，空位为 null）
    private GamePhase phase;                    // 游戏阶段
    private int currentLevel;                   // 本局打的级（2-14）
    private Suit mainSuit;                      // 主花色（null 表示未亮主/无主）
    private int dealerIndex;                    // 庄家座位（-1 表示首局尚未确定）
    private boolean dealerFixed;                // 庄家是否已由上一局结算确定
    private int currentTurnIndex;               // 当前行动座位
    private int nextDrawIndex;                  // 下一张牌发给谁
    private List<Card> drawPile;                // 待摸的牌
    private List<Card> bottomCards;             // 底牌
    private Declaration declaration;            // 当前有效的亮主
    private Trick currentTrick;                 // 当前这一墩
    private final int[] teamScores;             // 各组本局得分
    private final int[] teamLevels;             // 各组级数
    private int roundNumber;                    // 第几局
    private int lastTrickWinner;                // 上一墩赢家座位
    private RoundResult roundResult;            // 本局结算（FINISHED 时有效）
    private int matchWinnerTeam;                // 整场胜者组号（-1 表示未决出）

    public GameState(String roomId, int playerCount, int startingLevel) {
        this.roomId = roomId;
        this.seats = new Player[playerCount];
        this.phase = GamePhase.WAITING;
        this.currentLevel = startingLevel;
        this.mainSuit = null;
        this.dealerIndex = -1;
        this.dealerFixed = false;
        this.currentTurnIndex = -1;
        this.nextDrawIndex = 0;
        this.drawPile = new ArrayList<>();
        this.bottomCards = new ArrayList<>();
        this.currentTrick = new Trick(playerCount);
        this.teamScores = new int[TEAM_COUNT];
        this.teamLevels = new int[TEAM_COUNT];
        Arrays.fill(teamLevels, startingLevel);
        this.roundNumber = 0;
        this.lastTrickWinner = -1;
        this.matchWinnerTeam = -1;
    }

    public String getRoomId() {
        return roomId;
    }

    public int getPlayerCount() {
        return seats.length;
    }

    /**
     * 获取座位上的玩家（空位返回 null）
     */
    public Player getPlayer(int seat) {
        if (seat >= 0 && seat < seats.length) {
            return seats[seat];
        }
        return null;
    }

    public List<Player> getPlayers() {
        List<Player> players = new ArrayList<>();
        for (Player p : seats) {
            if (p != null) {
                players.add(p);
            }
        }
        return players;
    }

    public void seatPlayer(Player player) {
        seats[player.getSeat()] = player;
    }

    public int findSeatByPlayerId(String playerId) {
        for (Player p : seats) {
            if (p != null && p.getId().equals(playerId)) {
                return p.getSeat();
            }
        }
        return -1;
    }

    public int firstFreeSeat() {
        for (int i = 0; i < seats.length; i++) {
            if (seats[i] == null) {
                return i;
            }
        }
        return -1;
    }

    public boolean isAllSeated() {
        return firstFreeSeat() < 0;
    }

    /**
     * 下一个座位（逆时针）
     */
    public int nextSeat(int seat) {
        return (seat + 1) % seats.length;
    }

    public int teamOf(int seat) {
        return seat % TEAM_COUNT;
    }

    public int getDealerTeam() {
        return dealerIndex < 0 ? -1 : teamOf(dealerIndex);
    }

    public boolean isCatchingTeam(int team) {
        return team != getDealerTeam();
    }

    public GamePhase getPhase() {
        return phase;
    }

    public void setPhase(GamePhase phase) {
        this.phase = phase;
    }

    public int getCurrentLevel() {
        return currentLevel;
    }

    public void setCurrentLevel(int currentLevel) {
        this.currentLevel = currentLevel;
    }

    public Suit getMainSuit() {
        return mainSuit;
    }

    public void setMainSuit(Suit mainSuit) {
        this.mainSuit = mainSuit;
    }

    public int getDealerIndex() {
        return dealerIndex;
    }

    public void setDealerIndex(int dealerIndex) {
        this.dealerIndex = dealerIndex;
    }

    public boolean isDealerFixed() {
        return dealerFixed;
    }

    public void setDealerFixed(boolean dealerFixed) {
        this.dealerFixed = dealerFixed;
    }

    public int getCurrentTurnIndex() {
        return currentTurnIndex;
    }

    public void setCurrentTurnIndex(int currentTurnIndex) {
        this.currentTurnIndex = currentTurnIndex;
    }

    public int getNextDrawIndex() {
        return nextDrawIndex;
    }

    public void setNextDrawIndex(int nextDrawIndex) {
        this.nextDrawIndex = nextDrawIndex;
    }

    public List<Card> getDrawPile() {
        return drawPile;
    }

    public void setDrawPile(List<Card> drawPile) {
        this.drawPile = drawPile;
    }

    /**
     * 从牌堆顶摸一张牌
     */
    public Card drawCard() {
        if (!drawPile.isEmpty()) {
            return drawPile.remove(0);
        }
        return null;
    }

    public List<Card> getBottomCards() {
        return bottomCards;
    }

    public void setBottomCards(List<Card> bottomCards) {
        this.bottomCards = bottomCards;
    }

    public int getBottomPoints() {
        int points = 0;
        for (Card card : bottomCards) {
            points += card.getPoints();
        }
        return points;
    }

    public Declaration getDeclaration() {
        return declaration;
    }

    public void setDeclaration(Declaration declaration) {
        this.declaration = declaration;
    }

    public Trick getCurrentTrick() {
        return currentTrick;
    }

    public int[] getTeamScores() {
        return teamScores.clone();
    }

    public int getTeamScore(int team) {
        return teamScores[team];
    }

    public void addTeamScore(int team, int points) {
        teamScores[team] += points;
    }

    public int[] getTeamLevels() {
        return teamLevels.clone();
    }

    public int getTeamLevel(int team) {
        return teamLevels[team];
    }

    public void setTeamLevels(int[] levels) {
        System.arraycopy(levels, 0, teamLevels, 0, teamLevels.length);
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public int getLastTrickWinner() {
        return lastTrickWinner;
    }

    public void setLastTrickWinner(int lastTrickWinner) {
        this.lastTrickWinner = lastTrickWinner;
    }

    public RoundResult getRoundResult() {
        return roundResult;
    }

    public void setRoundResult(RoundResult roundResult) {
        this.roundResult = roundResult;
    }

    public int getMatchWinnerTeam() {
        return matchWinnerTeam;
    }

    public void setMatchWinnerTeam(int matchWinnerTeam) {
        this.matchWinnerTeam = matchWinnerTeam;
    }

    /**
     * 开始新一局前重置与"本局"相关的数据
     * （级数/庄家/座位等跨局数据不在此重置）
     */
    public void resetForNewRound() {
        roundNumber++;
        mainSuit = null;
        declaration = null;
        currentTrick.clear();
        drawPile = new ArrayList<>();
        bottomCards = new ArrayList<>();
        Arrays.fill(teamScores, 0);
        lastTrickWinner = -1;
        roundResult = null;
        for (Player p : seats) {
            if (p != null) {
                p.resetForNewRound();
            }
        }
    }
}
