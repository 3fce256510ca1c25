package com.gunzi.controller;

import com.gunzi.model.EventType;
import com.gunzi.model.GameEvent;
import com.gunzi.model.SeatView;
import com.gunzi.service.RoomEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把房间事件推送到 STOMP 主题
 * 广播事件发 /topic/room/{roomId}，定向事件只发 /topic/room/{roomId}/seat/{seat}
 * ACTION_REJECTED 从不广播
 */
@Component
public class RoomEventPublisher implements RoomEventListener {

    private static final Logger log = LoggerFactory.getLogger(RoomEventPublisher.class);

    private final SimpMessagingTemplate messagingTemplate;

    public RoomEventPublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @Override
    public void onEvents(String roomId, List<GameEvent> events) {
        for (GameEvent event : events) {
            if (event.getType() == EventType.ACTION_REJECTED && event.isBroadcast()) {
                // 拒绝只能发给提交者
                log.warn("房间 {} 丢弃没有目标座位的拒绝事件：{}", roomId, event);
                continue;
            }
            if (event.isBroadcast()) {
                messagingTemplate.convertAndSend(roomTopic(roomId), toMessage(event));
            } else {
                messagingTemplate.convertAndSend(seatTopic(roomId, event.getTargetSeat()), toMessage(event));
            }
            log.debug("房间 {} 推送事件 {}", roomId, event.getType());
        }
    }

    /**
     * 给某个座位推送私有视图（断线重连同步用）
     */
    public void sendSeatView(String roomId, SeatView view) {
        messagingTemplate.convertAndSend(seatTopic(roomId, view.getSeat()), view);
    }

    private Map<String, Object> toMessage(GameEvent event) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", event.getType());
        message.put("data", event.getData());
        return message;
    }

    static String roomTopic(String roomId) {
        return "/topic/room/" + roomId;
    }

    static String seatTopic(String roomId, int seat) {
        return "/topic/room/" + roomId + "/seat/" + seat;
    }
}
