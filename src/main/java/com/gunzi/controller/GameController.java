package com.gunzi.controller;

import com.gunzi.model.ActionResult;
import com.gunzi.model.GameAction;
import com.gunzi.model.RoomSnapshot;
import com.gunzi.model.SeatView;
import com.gunzi.model.Suit;
import com.gunzi.service.GameRoom;
import com.gunzi.service.RoomManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 游戏控制器
 *
 * 只做协议转换：请求 -> GameAction，结果事件由 RoomManager 推送。
 * STOMP 请求按 playerId 找房间和座位，客户端不能自己指定座位。
 */
@Controller
public class GameController {

    private static final Logger log = LoggerFactory.getLogger(GameController.class);

    private final RoomManager roomManager;
    private final RoomEventPublisher eventPublisher;

    public GameController(RoomManager roomManager, RoomEventPublisher eventPublisher) {
        this.roomManager = roomManager;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 创建房间
     */
    @PostMapping("/api/room/create")
    @ResponseBody
    public Map<String, String> createRoom() {
        String roomId = roomManager.createRoom();
        Map<String, String> response = new HashMap<>();
        response.put("roomId", roomId);
        return response;
    }

    /**
     * 加入房间
     */
    @PostMapping("/api/room/join")
    @ResponseBody
    public Map<String, Object> joinRoom(@RequestBody JoinRoomRequest request) {
        if (request.getPlayerId() == null || request.getPlayerId().isEmpty()) {
            throw new IllegalArgumentException("缺少玩家ID");
        }
        ActionResult result = roomManager.joinRoom(
            request.getRoomId(),
            request.getPlayerId(),
            request.getPlayerName(),
            request.getSeat()
        );

        Map<String, Object> response = toResponse(result);
        if (result.isAccepted()) {
            response.put("seat", roomManager.getRoom(request.getRoomId()).seatOf(request.getPlayerId()));
        }
        return response;
    }

    /**
     * 开始游戏（人齐后任一在座玩家都可以开）
     */
    @PostMapping("/api/room/{roomId}/start")
    @ResponseBody
    public Map<String, Object> startGame(@PathVariable String roomId, @RequestBody PlayerRequest request) {
        int seat = requireSeat(roomManager.getRoom(roomId), request.getPlayerId());
        log.info("收到开始游戏请求：房间={}, 玩家={}", roomId, request.getPlayerId());
        return toResponse(roomManager.submit(roomId, GameAction.startGame(seat)));
    }

    /**
     * 开下一局
     */
    @PostMapping("/api/room/{roomId}/next")
    @ResponseBody
    public Map<String, Object> nextRound(@PathVariable String roomId, @RequestBody PlayerRequest request) {
        int seat = requireSeat(roomManager.getRoom(roomId), request.getPlayerId());
        log.info("收到开下一局请求：房间={}, 玩家={}", roomId, request.getPlayerId());
        return toResponse(roomManager.submit(roomId, GameAction.startNextRound(seat)));
    }

    /**
     * 公开状态
     */
    @GetMapping("/api/room/{roomId}/state")
    @ResponseBody
    public RoomSnapshot getState(@PathVariable String roomId) {
        return roomManager.getRoom(roomId).snapshot();
    }

    /**
     * 某个座位的视图（含手牌）
     */
    @GetMapping("/api/room/{roomId}/state/{seat}")
    @ResponseBody
    public SeatView getSeatState(@PathVariable String roomId, @PathVariable int seat) {
        GameRoom room = roomManager.getRoom(roomId);
        if (seat < 0 || seat >= room.getPlayerCount()) {
            throw new IllegalArgumentException("座位不存在：" + seat);
        }
        return room.seatView(seat);
    }

    /**
     * 亮主 / 反主
     */
    @MessageMapping("/game/declare")
    public void declare(@Payload DeclareRequest request) {
        log.info("收到亮主请求：玩家={}, 牌={}, 花色={}", request.getPlayerId(), request.getCardIds(), request.getSuit());
        GameRoom room = findRoom(request.getPlayerId());
        int seat = room == null ? -1 : seatInRoom(room, request.getPlayerId());
        if (seat < 0) {
            return;
        }
        roomManager.submit(room.getRoomId(), GameAction.declareMain(seat, request.getCardIds(), request.getSuit()));
    }

    /**
     * 庄家扣底
     */
    @MessageMapping("/game/exchange")
    public void exchange(@Payload CardsRequest request) {
        log.info("收到扣底请求：玩家={}, 牌={}", request.getPlayerId(), request.getCardIds());
        GameRoom room = findRoom(request.getPlayerId());
        int seat = room == null ? -1 : seatInRoom(room, request.getPlayerId());
        if (seat < 0) {
            return;
        }
        roomManager.submit(room.getRoomId(), GameAction.exchangeCards(seat, request.getCardIds()));
    }

    /**
     * 出牌
     */
    @MessageMapping("/game/play")
    public void play(@Payload CardsRequest request) {
        log.info("收到出牌请求：玩家={}, 牌={}", request.getPlayerId(), request.getCardIds());
        GameRoom room = findRoom(request.getPlayerId());
        int seat = room == null ? -1 : seatInRoom(room, request.getPlayerId());
        if (seat < 0) {
            return;
        }
        roomManager.submit(room.getRoomId(), GameAction.playCards(seat, request.getCardIds()));
    }

    /**
     * 同步游戏状态（用于玩家刚连接WebSocket时获取最新状态）
     */
    @MessageMapping("/game/sync")
    public void syncGameState(@Payload PlayerRequest request) {
        log.info("收到同步请求：玩家={}", request.getPlayerId());
        GameRoom room = findRoom(request.getPlayerId());
        int seat = room == null ? -1 : seatInRoom(room, request.getPlayerId());
        if (seat < 0) {
            return;
        }
        eventPublisher.sendSeatView(room.getRoomId(), room.seatView(seat));
        log.info("已为玩家 {} 同步游戏状态", request.getPlayerId());
    }

    private GameRoom findRoom(String playerId) {
        String roomId = roomManager.getRoomIdByPlayerId(playerId);
        if (roomId == null || !roomManager.getAllRooms().containsKey(roomId)) {
            log.warn("玩家 {} 不在任何房间中", playerId);
            return null;
        }
        return roomManager.getRoom(roomId);
    }

    /**
     * 玩家在房间里的座位，不在座位上返回 -1
     */
    private int seatInRoom(GameRoom room, String playerId) {
        int seat = room.seatOf(playerId);
        if (seat < 0) {
            log.warn("玩家 {} 不在房间 {} 的座位上", playerId, room.getRoomId());
        }
        return seat;
    }

    private int requireSeat(GameRoom room, String playerId) {
        int seat = seatInRoom(room, playerId);
        if (seat < 0) {
            throw new IllegalArgumentException("玩家不在房间座位上：" + playerId);
        }
        return seat;
    }

    private Map<String, Object> toResponse(ActionResult result) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", result.isAccepted());
        if (!result.isAccepted()) {
            response.put("reason", result.getReason());
            response.put("message", result.getMessage());
        }
        return response;
    }

    // === 请求类 ===

    public static class JoinRoomRequest {
        private String roomId;
        private String playerId;
        private String playerName;
        private Integer seat;

        public String getRoomId() { return roomId; }
        public void setRoomId(String roomId) { this.roomId = roomId; }
        public String getPlayerId() { return playerId; }
        public void setPlayerId(String playerId) { this.playerId = playerId; }
        public String getPlayerName() { return playerName; }
        public void setPlayerName(String playerName) { this.playerName = playerName; }
        public Integer getSeat() { return seat; }
        public void setSeat(Integer seat) { this.seat = seat; }
    }

    public static class PlayerRequest {
        private String playerId;

        public String getPlayerId() { return playerId; }
        public void setPlayerId(String playerId) { this.playerId = playerId; }
    }

    public static class CardsRequest {
        private String playerId;
        private List<String> cardIds;

        public String getPlayerId() { return playerId; }
        public void setPlayerId(String playerId) { this.playerId = playerId; }
        public List<String> getCardIds() { return cardIds; }
        public void setCardIds(List<String> cardIds) { this.cardIds = cardIds; }
    }

    public static class DeclareRequest {
        private String playerId;
        private List<String> cardIds;
        private Suit suit;

        public String getPlayerId() { return playerId; }
        public void setPlayerId(String playerId) { this.playerId = playerId; }
        public List<String> getCardIds() { return cardIds; }
        public void setCardIds(List<String> cardIds) { this.cardIds = cardIds; }
        public Suit getSuit() { return suit; }
        public void setSuit(Suit suit) { this.suit = suit; }
    }
}
