package com.gunzi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 对局规则配置。
 *
 * 支持通过 application.yml（gunzi.game.*）或环境变量覆盖；
 * 引擎本身不依赖 Spring，单元测试直接 new 一个默认配置即可。
 */
@ConfigurationProperties(prefix = "gunzi.game")
public class GameProperties {

    /**
     * 座位数（三组对家）
     */
    private int playerCount = 6;

    /**
     * 几副牌
     */
    private int deckCount = 4;

    /**
     * 底牌张数
     */
    private int bottomCardCount = 6;

    /**
     * 开局级数（2-14）
     */
    private int startingLevel = 2;

    /**
     * 用王亮主至少需要几张相同的王
     */
    private int minJokersToDeclare = 3;

    /**
     * 亮主强度比较顺序，默认先比种类：红色级牌 > 黑色级牌 > 王
     */
    private DeclarationPriority declarationPriority = DeclarationPriority.KIND_FIRST;

    /**
     * 抓分方扣底时底分的倍数
     */
    private int kouDiMultiplier = 2;

    /**
     * 抓分方达到该分数即下庄
     */
    private int levelUpThreshold = 130;

    /**
     * 庄家守住后升几级
     */
    private int levelStep = 1;

    /**
     * 自动发牌间隔（毫秒），留出亮主时间
     */
    private long dealIntervalMillis = 200;

    public int getPlayerCount() {
        return playerCount;
    }

    public void setPlayerCount(int playerCount) {
        this.playerCount = playerCount;
    }

    public int getDeckCount() {
        return deckCount;
    }

    public void setDeckCount(int deckCount) {
        this.deckCount = deckCount;
    }

    public int getBottomCardCount() {
        return bottomCardCount;
    }

    public void setBottomCardCount(int bottomCardCount) {
        this.bottomCardCount = bottomCardCount;
    }

    public int getStartingLevel() {
        return startingLevel;
    }

    public void setStartingLevel(int startingLevel) {
        this.startingLevel = startingLevel;
    }

    public int getMinJokersToDeclare() {
        return minJokersToDeclare;
    }

    public void setMinJokersToDeclare(int minJokersToDeclare) {
        this.minJokersToDeclare = minJokersToDeclare;
    }

    public DeclarationPriority getDeclarationPriority() {
        return declarationPriority;
    }

    public void setDeclarationPriority(DeclarationPriority declarationPriority) {
        this.declarationPriority = declarationPriority;
    }

    public int getKouDiMultiplier() {
        return kouDiMultiplier;
    }

    public void setKouDiMultiplier(int kouDiMultiplier) {
        this.kouDiMultiplier = kouDiMultiplier;
    }

    public int getLevelUpThreshold() {
        return levelUpThreshold;
    }

    public void setLevelUpThreshold(int levelUpThreshold) {
        this.levelUpThreshold = levelUpThreshold;
    }

    public int getLevelStep() {
        return levelStep;
    }

    public void setLevelStep(int levelStep) {
        this.levelStep = levelStep;
    }

    public long getDealIntervalMillis() {
        return dealIntervalMillis;
    }

    public void setDealIntervalMillis(long dealIntervalMillis) {
        this.dealIntervalMillis = dealIntervalMillis;
    }
}
