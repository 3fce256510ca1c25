package com.gunzi.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 出站事件
 * targetSeat 为空表示广播，否则只发给该座位
 */
public class GameEvent {
    private final EventType type;
    private final Integer targetSeat;
    private final Map<String, Object> data;

    private GameEvent(EventType type, Integer targetSeat, Map<String, Object> data) {
        this.type = type;
        this.targetSeat = targetSeat;
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static GameEvent broadcast(EventType type, Map<String, Object> data) {
        return new GameEvent(type, null, data);
    }

    public static GameEvent targeted(EventType type, int seat, Map<String, Object> data) {
        return new GameEvent(type, seat, data);
    }

    public static GameEvent rejected(int seat, RejectReason reason, String message) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", reason);
        data.put("message", message);
        return new GameEvent(EventType.ACTION_REJECTED, seat, data);
    }

    public EventType getType() {
        return type;
    }

    public Integer getTargetSeat() {
        return targetSeat;
    }

    public boolean isBroadcast() {
        return targetSeat == null;
    }

    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public String toString() {
        return type + (targetSeat != null ? "@" + targetSeat : "") + data;
    }
}
