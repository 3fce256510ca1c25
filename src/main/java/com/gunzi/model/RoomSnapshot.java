package com.gunzi.model;

import java.util.Collections;
import java.util.List;

/**
 * 房间公开快照（断线重连/同步用），在读锁下一次性构建，不会看到做了一半的动作
 */
public class RoomSnapshot {
    private final String roomId;
    private final GamePhase phase;
    private final int roundNumber;
    private final List<SeatSnapshot> seats;
    private final int dealerIndex;
    private final int currentLevel;
    private final Suit mainSuit;
    private final int currentTurnIndex;
    private final List<TrickPlay> currentTrick;
    private final int[] teamScores;
    private final int[] teamLevels;
    private final int remainingCards;
    private final RoundResult roundResult;

    public RoomSnapshot(String roomId, GamePhase phase, int roundNumber, List<SeatSnapshot> seats,
                        int dealerIndex, int currentLevel, Suit mainSuit, int currentTurnIndex,
                        List<TrickPlay> currentTrick, int[] teamScores, int[] teamLevels,
                        int remainingCards, RoundResult roundResult) {
        this.roomId = roomId;
        this.phase = phase;
        this.roundNumber = roundNumber;
        this.seats = Collections.unmodifiableList(seats);
        this.dealerIndex = dealerIndex;
        this.currentLevel = currentLevel;
        this.mainSuit = mainSuit;
        this.currentTurnIndex = currentTurnIndex;
        this.currentTrick = Collections.unmodifiableList(currentTrick);
        this.teamScores = teamScores.clone();
        this.teamLevels = teamLevels.clone();
        this.remainingCards = remainingCards;
        this.roundResult = roundResult;
    }

    public String getRoomId() {
        return roomId;
    }

    public GamePhase getPhase() {
        return phase;
    }

    public int getRoundNumber() {
        return roundNumber;
    }

    public List<SeatSnapshot> getSeats() {
        return seats;
    }

    public int getDealerIndex() {
        return dealerIndex;
    }

    public int getCurrentLevel() {
        return currentLevel;
    }

    public Suit getMainSuit() {
        return mainSuit;
    }

    public int getCurrentTurnIndex() {
        return currentTurnIndex;
    }

    public List<TrickPlay> getCurrentTrick() {
        return currentTrick;
    }

    public int[] getTeamScores() {
        return teamScores.clone();
    }

    public int[] getTeamLevels() {
        return teamLevels.clone();
    }

    public int getRemainingCards() {
        return remainingCards;
    }

    public RoundResult getRoundResult() {
        return roundResult;
    }

    public long getOccupiedSeats() {
        return seats.stream().filter(SeatSnapshot::isOccupied).count();
    }
}
