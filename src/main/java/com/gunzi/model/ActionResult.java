package com.gunzi.model;

import java.util.Collections;
import java.util.List;

/**
 * 动作处理结果：接受时带出站事件，拒绝时带原因
 */
public class ActionResult {
    private final boolean accepted;
    private final RejectReason reason;
    private final String message;
    private final List<GameEvent> events;

    private ActionResult(boolean accepted, RejectReason reason, String message, List<GameEvent> events) {
        this.accepted = accepted;
        this.reason = reason;
        this.message = message;
        this.events = Collections.unmodifiableList(events);
    }

    public static ActionResult accepted(List<GameEvent> events) {
        return new ActionResult(true, null, null, events);
    }

    /**
     * 拒绝只通知提交的座位；没有座位（未入座的玩家、系统动作）时不产生事件，原因只在结果里返回
     */
    public static ActionResult rejected(Integer seat, RejectReason reason, String message) {
        List<GameEvent> events = seat == null
            ? List.of()
            : List.of(GameEvent.rejected(seat, reason, message));
        return new ActionResult(false, reason, message, events);
    }

    public boolean isAccepted() {
        return accepted;
    }

    public RejectReason getReason() {
        return reason;
    }

    public String getMessage() {
        return message;
    }

    public List<GameEvent> getEvents() {
        return events;
    }
}
