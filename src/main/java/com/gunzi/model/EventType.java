package com.gunzi.model;

/**
 * 出站事件类型
 */
public enum EventType {
    PLAYER_JOINED,          // 有玩家入座
    GAME_STARTED,           // 开始摸牌
    CARD_DEALT,             // 摸到一张牌（只发给本人）
    MAIN_DECLARED,          // 亮主/反主成功
    EXCHANGE_STARTED,       // 开始扣底
    BOTTOM_CARDS_REVEALED,  // 底牌（扣底时只给庄家，结算时广播）
    PLAY_STARTED,           // 扣底完成，庄家首出
    PLAY_ACCEPTED,          // 出牌成功
    TRICK_RESOLVED,         // 一墩结束
    ROUND_FINISHED,         // 一局结束
    ACTION_REJECTED         // 动作被拒绝（只发给提交者）
}
