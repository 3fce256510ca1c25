package com.gunzi.model;

/**
 * 游戏阶段
 */
public enum GamePhase {
    WAITING,        // 等待玩家入座
    DRAWING,        // 摸牌阶段（可亮主/反主）
    EXCHANGING,     // 庄家扣底
    PLAYING,        // 出牌阶段
    FINISHED        // 本局结束，等待开下一局
}
