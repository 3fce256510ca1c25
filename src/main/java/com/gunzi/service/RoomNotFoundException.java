package com.gunzi.service;

/**
 * 房间不存在
 */
public class RoomNotFoundException extends RuntimeException {

    public RoomNotFoundException(String roomId) {
        super("房间不存在：" + roomId);
    }
}
