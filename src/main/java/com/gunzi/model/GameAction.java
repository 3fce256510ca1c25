package com.gunzi.model;

import java.util.Collections;
import java.util.List;

/**
 * 入站动作：动作类型 + 发起座位 + 载荷
 * JOIN 的 seat 是期望座位（可为空），DEAL_CARD 为系统动作没有座位
 */
public class GameAction {
    private final PlayerAction type;
    private final Integer seat;
    private final String playerId;
    private final String playerName;
    private final List<String> cardIds;
    private final Suit suit;

    private GameAction(PlayerAction type, Integer seat, String playerId, String playerName,
                       List<String> cardIds, Suit suit) {
        this.type = type;
        this.seat = seat;
        this.playerId = playerId;
        this.playerName = playerName;
        this.cardIds = cardIds == null ? Collections.emptyList() : List.copyOf(cardIds);
        this.suit = suit;
    }

    public static GameAction join(String playerId, String playerName, Integer seat) {
        return new GameAction(PlayerAction.JOIN, seat, playerId, playerName, null, null);
    }

    public static GameAction startGame(int seat) {
        return new GameAction(PlayerAction.START_GAME, seat, null, null, null, null);
    }

    public static GameAction dealCard() {
        return new GameAction(PlayerAction.DEAL_CARD, null, null, null, null, null);
    }

    public static GameAction declareMain(int seat, List<String> cardIds, Suit suit) {
        return new GameAction(PlayerAction.DECLARE_MAIN, seat, null, null, cardIds, suit);
    }

    public static GameAction exchangeCards(int seat, List<String> cardIds) {
        return new GameAction(PlayerAction.EXCHANGE_CARDS, seat, null, null, cardIds, null);
    }

    public static GameAction playCards(int seat, List<String> cardIds) {
        return new GameAction(PlayerAction.PLAY_CARDS, seat, null, null, cardIds, null);
    }

    public static GameAction startNextRound(int seat) {
        return new GameAction(PlayerAction.START_NEXT_ROUND, seat, null, null, null, null);
    }

    public PlayerAction getType() {
        return type;
    }

    public Integer getSeat() {
        return seat;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getPlayerName() {
        return playerName;
    }

    public List<String> getCardIds() {
        return cardIds;
    }

    public Suit getSuit() {
        return suit;
    }

    @Override
    public String toString() {
        return type + "{seat=" + seat + ", cards=" + cardIds + (suit != null ? ", suit=" + suit : "") + "}";
    }
}
