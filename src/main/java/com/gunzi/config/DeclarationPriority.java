package com.gunzi.config;

/**
 * 亮主强度的比较顺序
 */
public enum DeclarationPriority {
    /**
     * 先比张数，张数相同再比种类（红色级牌 > 黑色级牌 > 大王 > 小王）
     */
    COUNT_FIRST,
    /**
     * 先比种类，种类相同再比张数
     */
    KIND_FIRST
}
