package com.gunzi.service;

import com.gunzi.config.GameProperties;
import com.gunzi.model.ActionResult;
import com.gunzi.model.GameAction;
import com.gunzi.model.GamePhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 摸牌节奏：按固定间隔给房间提交 DEAL_CARD，离开摸牌阶段后自动停止
 *
 * 每次摸牌都走 GameRoom 的写锁，和玩家亮主动作互相排队。
 */
@Component
public class DealingScheduler {

    private static final Logger log = LoggerFactory.getLogger(DealingScheduler.class);

    private final TaskScheduler taskScheduler;
    private final RoomEventListener listener;
    private final Duration interval;
    private final Map<String, ScheduledFuture<?>> running = new ConcurrentHashMap<>();

    public DealingScheduler(@Qualifier("dealTaskScheduler") TaskScheduler taskScheduler,
                            RoomEventListener listener, GameProperties props) {
        this.taskScheduler = taskScheduler;
        this.listener = listener;
        this.interval = Duration.ofMillis(Math.max(1, props.getDealIntervalMillis()));
    }

    /**
     * 开始给房间发牌（已经在发的房间不会重复启动）
     */
    public void start(GameRoom room) {
        String roomId = room.getRoomId();
        running.computeIfAbsent(roomId, id -> {
            log.info("房间 {} 开始发牌，间隔 {} 毫秒", id, interval.toMillis());
            return taskScheduler.scheduleAtFixedRate(() -> tick(room), interval);
        });
    }

    /**
     * 停止给房间发牌
     */
    public void stop(String roomId) {
        ScheduledFuture<?> future = running.remove(roomId);
        if (future != null) {
            future.cancel(false);
        }
    }

    public boolean isDealing(String roomId) {
        return running.containsKey(roomId);
    }

    private void tick(GameRoom room) {
        if (room.getPhase() != GamePhase.DRAWING) {
            stop(room.getRoomId());
            return;
        }
        ActionResult result = room.submit(GameAction.dealCard());
        listener.onEvents(room.getRoomId(), result.getEvents());
        if (!result.isAccepted() || room.getPhase() != GamePhase.DRAWING) {
            log.info("房间 {} 发牌结束", room.getRoomId());
            stop(room.getRoomId());
        }
    }
}
