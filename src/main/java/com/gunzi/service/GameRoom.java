package com.gunzi.service;

import com.gunzi.engine.GameEngine;
import com.gunzi.model.ActionResult;
import com.gunzi.model.GameAction;
import com.gunzi.model.GamePhase;
import com.gunzi.model.RejectReason;
import com.gunzi.model.RoomSnapshot;
import com.gunzi.model.SeatView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 房间：一个引擎 + 一把读写锁
 *
 * 动作在写锁下串行执行，快照在读锁下读取，外部看不到执行到一半的状态。
 */
public class GameRoom {

    private static final Logger log = LoggerFactory.getLogger(GameRoom.class);

    private final String roomId;
    private final GameEngine engine;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public GameRoom(String roomId, GameEngine engine) {
        this.roomId = roomId;
        this.engine = engine;
    }

    /**
     * 提交一个动作；规则错误已由引擎转成拒绝结果
     * 引擎内部异常记 error 日志并以 INTERNAL_ERROR 返回，不产生事件，也不冒充规则拒绝
     */
    public ActionResult submit(GameAction action) {
        lock.writeLock().lock();
        try {
            return engine.handle(action);
        } catch (RuntimeException e) {
            log.error("房间 {} 执行动作 {} 出现内部错误", roomId, action, e);
            return ActionResult.rejected(null, RejectReason.INTERNAL_ERROR, e.getMessage());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public RoomSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return engine.snapshot();
        } finally {
            lock.readLock().unlock();
        }
    }

    public SeatView seatView(int seat) {
        lock.readLock().lock();
        try {
            return engine.seatView(seat);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 按玩家ID查座位，不在房间返回 -1
     */
    public int seatOf(String playerId) {
        lock.readLock().lock();
        try {
            return engine.getGameState().findSeatByPlayerId(playerId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public GamePhase getPhase() {
        lock.readLock().lock();
        try {
            return engine.getGameState().getPhase();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getPlayerCount() {
        return engine.getGameState().getPlayerCount();
    }

    public String getRoomId() {
        return roomId;
    }
}
