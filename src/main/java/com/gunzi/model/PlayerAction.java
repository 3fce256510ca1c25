package com.gunzi.model;

/**
 * 玩家行动类型
 */
public enum PlayerAction {
    JOIN,               // 入座
    START_GAME,         // 开局
    DEAL_CARD,          // 发一张牌（系统动作）
    DECLARE_MAIN,       // 亮主/反主
    EXCHANGE_CARDS,     // 扣底
    PLAY_CARDS,         // 出牌
    START_NEXT_ROUND    // 开下一局
}
