package com.gunzi.service;

import com.gunzi.config.GameProperties;
import com.gunzi.engine.GameEngine;
import com.gunzi.model.ActionResult;
import com.gunzi.model.GameAction;
import com.gunzi.model.GamePhase;
import com.gunzi.model.GameState;
import com.gunzi.model.RejectReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import java.security.SecureRandom;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 房间管理器
 */
@Service
public class RoomManager {

    private static final Logger log = LoggerFactory.getLogger(RoomManager.class);

    private final GameProperties props;
    private final DealingScheduler dealingScheduler;
    private final RoomEventListener listener;

    private final Map<String, GameRoom> rooms = new ConcurrentHashMap<>();
    private final Map<String, String> playerRoomMap = new ConcurrentHashMap<>(); // playerId -> roomId

    public RoomManager(GameProperties props, DealingScheduler dealingScheduler, RoomEventListener listener) {
        this.props = props;
        this.dealingScheduler = dealingScheduler;
        this.listener = listener;
    }

    /**
     * 创建房间（牌数校验失败时直接抛异常，房间不会登记）
     */
    public String createRoom() {
        String roomId = "ROOM_" + UUID.randomUUID().toString().substring(0, 8);
        GameState gameState = new GameState(roomId, props.getPlayerCount(), props.getStartingLevel());
        GameEngine engine = new GameEngine(gameState, props, new SecureRandom());
        rooms.put(roomId, new GameRoom(roomId, engine));

        log.info("房间创建成功：{}", roomId);
        return roomId;
    }

    /**
     * 加入房间，seat 为空时自动分配第一个空座
     */
    public ActionResult joinRoom(String roomId, String playerId, String playerName, Integer seat) {
        GameRoom room = getRoom(roomId);

        // 检查玩家是否已在其他房间
        String existingRoom = playerRoomMap.get(playerId);
        if (existingRoom != null && !existingRoom.equals(roomId) && rooms.containsKey(existingRoom)) {
            log.warn("玩家 {} 已在房间 {} 中", playerId, existingRoom);
            return ActionResult.rejected(null, RejectReason.SEAT_TAKEN, "玩家已在房间 " + existingRoom + " 中");
        }

        ActionResult result = submit(roomId, GameAction.join(playerId, playerName, seat));
        if (result.isAccepted()) {
            playerRoomMap.put(playerId, roomId);
            log.info("玩家 {} 进入房间 {}，座位 {}", playerName, roomId, room.seatOf(playerId));
        }
        return result;
    }

    /**
     * 向房间提交动作并推送产生的事件；进入摸牌阶段时启动发牌
     */
    public ActionResult submit(String roomId, GameAction action) {
        GameRoom room = getRoom(roomId);
        ActionResult result = room.submit(action);
        listener.onEvents(roomId, result.getEvents());

        if (result.isAccepted() && room.getPhase() == GamePhase.DRAWING) {
            dealingScheduler.start(room);
        }
        return result;
    }

    /**
     * 删除房间
     */
    public void removeRoom(String roomId) {
        GameRoom room = rooms.remove(roomId);
        if (room != null) {
            dealingScheduler.stop(roomId);
            playerRoomMap.values().removeIf(roomId::equals);
            log.info("房间 {} 已删除", roomId);
        }
    }

    /**
     * 获取房间，不存在抛 {@link RoomNotFoundException}
     */
    public GameRoom getRoom(String roomId) {
        GameRoom room = roomId == null ? null : rooms.get(roomId);
        if (room == null) {
            throw new RoomNotFoundException(roomId);
        }
        return room;
    }

    /**
     * 根据玩家ID获取所在房间ID
     */
    public String getRoomIdByPlayerId(String playerId) {
        return playerRoomMap.get(playerId);
    }

    public Map<String, GameRoom> getAllRooms() {
        return rooms;
    }
}
