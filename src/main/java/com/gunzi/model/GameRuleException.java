package com.gunzi.model;

/**
 * 规则校验失败，在房间边界被转换为 ACTION_REJECTED 事件，不会向外抛出
 */
public class GameRuleException extends RuntimeException {

    private final RejectReason reason;

    public GameRuleException(RejectReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RejectReason getReason() {
        return reason;
    }
}
