package com.gunzi.model;

/**
 * 座位公开信息（不含手牌）
 */
public class SeatSnapshot {
    private final int seat;
    private final String playerId;
    private final String playerName;
    private final int team;
    private final int handSize;

    public SeatSnapshot(int seat, String playerId, String playerName, int team, int handSize) {
        this.seat = seat;
        this.playerId = playerId;
        this.playerName = playerName;
        this.team = team;
        this.handSize = handSize;
    }

    public int getSeat() {
        return seat;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getPlayerName() {
        return playerName;
    }

    public int getTeam() {
        return team;
    }

    public int getHandSize() {
        return handSize;
    }

    public boolean isOccupied() {
        return playerId != null;
    }
}
