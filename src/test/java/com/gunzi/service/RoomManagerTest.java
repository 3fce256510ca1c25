package com.gunzi.service;

import com.gunzi.config.GameProperties;
import com.gunzi.model.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 房间管理器测试：建房、入座、开局后自动发牌
 */
class RoomManagerTest {

    private ThreadPoolTaskScheduler scheduler;
    private final List<GameEvent> published = new CopyOnWriteArrayList<>();
    private DealingScheduler dealingScheduler;
    private RoomManager roomManager;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("deal-test-");
        scheduler.initialize();

        GameProperties props = new GameProperties();
        props.setDealIntervalMillis(1);
        RoomEventListener listener = (roomId, events) -> published.addAll(events);
        dealingScheduler = new DealingScheduler(scheduler, listener, props);
        roomManager = new RoomManager(props, dealingScheduler, listener);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private String createFullRoom() {
        String roomId = roomManager.createRoom();
        for (int i = 0; i < 6; i++) {
            assertTrue(roomManager.joinRoom(roomId, "p" + i, "玩家" + i, null).isAccepted());
        }
        return roomId;
    }

    @Test
    void testCreateAndJoin() {
        String roomId = createFullRoom();
        assertTrue(roomId.startsWith("ROOM_"));
        assertEquals(roomId, roomManager.getRoomIdByPlayerId("p3"));
        assertEquals(3, roomManager.getRoom(roomId).seatOf("p3"));

        ActionResult full = roomManager.joinRoom(roomId, "p6", "玩家6", null);
        assertEquals(RejectReason.ROOM_FULL, full.getReason());
        assertTrue(published.stream().noneMatch(e -> e.getType() == EventType.ACTION_REJECTED && e.isBroadcast()),
            "拒绝不能广播给整个房间");
    }

    @Test
    void testPlayerCannotJoinTwoRooms() {
        String first = createFullRoom();
        String second = roomManager.createRoom();
        ActionResult result = roomManager.joinRoom(second, "p0", "玩家0", null);
        assertFalse(result.isAccepted());
        assertEquals(first, roomManager.getRoomIdByPlayerId("p0"));

        // 指定的座位属于第一个房间的 p2，拒绝不能发到那里
        ActionResult seated = roomManager.joinRoom(first, "p9", "玩家9", 2);
        assertEquals(RejectReason.ROOM_FULL, seated.getReason());
        ActionResult elsewhere = roomManager.joinRoom(second, "p2", "玩家2", 0);
        assertEquals(RejectReason.SEAT_TAKEN, elsewhere.getReason());
        assertTrue(elsewhere.getEvents().isEmpty());
        assertTrue(seated.getEvents().isEmpty(), "加入被拒时没有座位可以通知");
    }

    @Test
    void testUnknownRoom() {
        assertThrows(RoomNotFoundException.class, () -> roomManager.getRoom("ROOM_NONE"));
        assertThrows(RoomNotFoundException.class,
            () -> roomManager.submit("ROOM_NONE", GameAction.startGame(0)));
    }

    @Test
    void testStartGameDealsAutomatically() throws InterruptedException {
        String roomId = createFullRoom();
        GameRoom room = roomManager.getRoom(roomId);

        assertTrue(roomManager.submit(roomId, GameAction.startGame(0)).isAccepted());

        long deadline = System.currentTimeMillis() + 20000;
        while (room.getPhase() == GamePhase.DRAWING && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }

        assertEquals(GamePhase.EXCHANGING, room.getPhase(), "牌发完进入扣底");
        // 最后一次发牌的事件在提交返回后才推送
        Thread.sleep(100);
        long dealt = published.stream().filter(e -> e.getType() == EventType.CARD_DEALT).count();
        assertEquals(210, dealt);
        assertTrue(published.stream().anyMatch(e -> e.getType() == EventType.EXCHANGE_STARTED));
        assertFalse(dealingScheduler.isDealing(roomId), "离开摸牌阶段后停止发牌");
    }

    @Test
    void testRemoveRoom() {
        String roomId = createFullRoom();
        roomManager.removeRoom(roomId);
        assertThrows(RoomNotFoundException.class, () -> roomManager.getRoom(roomId));
        assertNull(roomManager.getRoomIdByPlayerId("p0"));
    }
}
