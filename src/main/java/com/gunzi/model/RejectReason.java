package com.gunzi.model;

/**
 * 动作被拒绝的原因（除 INTERNAL_ERROR 外全部可恢复：状态不变，只通知提交者）
 */
public enum RejectReason {
    INVALID_PHASE,          // 当前阶段不允许该动作
    NOT_YOUR_TURN,          // 没轮到该座位
    NOT_DEALER,             // 只有庄家可以扣底
    WRONG_CARD_COUNT,       // 张数不对
    MUST_FOLLOW_SUIT,       // 必须跟花色
    MUST_EXHAUST_SUIT,      // 该花色不够时必须全部跟出
    DEAD_STICK,             // 死棒：有对子/滚子/炸子必须跟
    INVALID_STRUCTURE,      // 首家出牌不成牌型
    UNKNOWN_CARD,           // 手中没有该牌
    ROOM_FULL,              // 房间已满
    SEAT_TAKEN,             // 座位已被占
    INVALID_SEAT,           // 座位号不存在
    NOT_ENOUGH_PLAYERS,     // 人数不足，不能开局
    NOT_SEATED,             // 提交者不在座位上
    INVALID_DECLARATION,    // 亮主牌不合法
    DECLARATION_TOO_WEAK,   // 反主强度不够
    MATCH_OVER,             // 整场比赛已结束
    INTERNAL_ERROR          // 服务端内部错误（状态异常，不是规则问题）
}
