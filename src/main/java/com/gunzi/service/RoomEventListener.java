package com.gunzi.service;

import com.gunzi.model.GameEvent;
import java.util.List;

/**
 * 房间出站事件的去向（推送层实现）
 */
public interface RoomEventListener {

    void onEvents(String roomId, List<GameEvent> events);
}
