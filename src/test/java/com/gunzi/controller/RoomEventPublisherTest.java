package com.gunzi.controller;

import com.gunzi.model.EventType;
import com.gunzi.model.GameEvent;
import com.gunzi.model.RejectReason;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import java.util.List;
import java.util.Map;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 推送路由测试：广播走房间主题，定向事件只走座位主题
 */
class RoomEventPublisherTest {

    @Test
    void testRouting() {
        SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
        RoomEventPublisher publisher = new RoomEventPublisher(template);

        publisher.onEvents("ROOM_1", List.of(
            GameEvent.broadcast(EventType.PLAY_ACCEPTED, Map.of("seat", 1)),
            GameEvent.targeted(EventType.CARD_DEALT, 4, Map.of("seat", 4)),
            GameEvent.rejected(2, RejectReason.NOT_YOUR_TURN, "还没轮到")));

        verify(template, times(1)).convertAndSend(eq("/topic/room/ROOM_1"), any(Object.class));
        verify(template, times(1)).convertAndSend(eq("/topic/room/ROOM_1/seat/4"), any(Object.class));
        verify(template, times(1)).convertAndSend(eq("/topic/room/ROOM_1/seat/2"), any(Object.class));
        verifyNoMoreInteractions(template);
    }

    @Test
    void testRejectionIsNeverBroadcast() {
        SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
        RoomEventPublisher publisher = new RoomEventPublisher(template);

        publisher.onEvents("ROOM_1", List.of(
            GameEvent.broadcast(EventType.ACTION_REJECTED, Map.of("reason", RejectReason.ROOM_FULL))));

        verifyNoInteractions(template);
    }
}
