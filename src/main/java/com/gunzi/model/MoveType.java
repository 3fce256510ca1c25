package com.gunzi.model;

/**
 * 出牌牌型（只有同花色同点数的牌才能组成牌型，不存在顺子/拖拉机）
 */
public enum MoveType {
    INVALID(0),
    SINGLE(1),  // 单张
    PAIR(2),    // 对子
    TRIPLE(3),  // 滚子（三张）
    QUAD(4);    // 炸子（四张）

    private final int size;

    MoveType(int size) {
        this.size = size;
    }

    public int getSize() {
        return size;
    }

    public static MoveType ofSize(int size) {
        switch (size) {
            case 1:
                return SINGLE;
            case 2:
                return PAIR;
            case 3:
                return TRIPLE;
            case 4:
                return QUAD;
            default:
                return INVALID;
        }
    }
}
