package com.gunzi.engine;

import com.gunzi.config.GameProperties;
import com.gunzi.model.Card;
import com.gunzi.model.GameState;
import com.gunzi.model.Rank;
import com.gunzi.model.RoundResult;
import com.gunzi.model.Suit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import java.util.ArrayList;
import java.util.List;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 一局结算测试：庄家 0 号位（组 0，对家 3 号位），底牌 25 分
 */
class RoundSettlementTest {

    private GameProperties props;
    private GameState state;

    @BeforeEach
    void setUp() {
        props = new GameProperties();
        state = new GameState("TEST", 6, 2);
        state.setDealerIndex(0);

        List<Card> bottom = new ArrayList<>();
        bottom.add(new Card(Suit.SPADE, Rank.KING, "b0"));
        bottom.add(new Card(Suit.CLUB, Rank.TEN, "b1"));
        bottom.add(new Card(Suit.HEART, Rank.FIVE, "b2"));
        bottom.add(new Card(Suit.SPADE, Rank.THREE, "b3"));
        bottom.add(new Card(Suit.DIAMOND, Rank.SEVEN, "b4"));
        bottom.add(new Card(Suit.CLUB, Rank.FOUR, "b5"));
        state.setBottomCards(bottom);
    }

    @Test
    void testKouDiByCatchingTeam() {
        state.addTeamScore(1, 80);
        state.addTeamScore(2, 100);
        state.addTeamScore(0, 195);
        state.setLastTrickWinner(1);

        RoundResult result = RoundSettlement.settle(state, props);

        assertEquals(25, result.getBottomPoints());
        assertEquals(50, result.getKouDiPoints(), "扣底翻倍");
        assertEquals(130, state.getTeamScore(1));
        assertEquals(130, result.getCatchingScore());
        assertFalse(result.isDealerDefended(), "抓分方够130分下庄");
        assertEquals(1, result.getWinningTeam());
        assertEquals(1, result.getNextDealer(), "庄家之后第一个组1的座位坐庄");
        assertEquals(2, result.getNextLevel(), "下庄不升级");
        assertArrayEquals(new int[]{2, 2, 2}, result.getTeamLevels());
        assertFalse(result.isMatchOver());
    }

    @Test
    void testDealerWinsLastTrick() {
        state.addTeamScore(1, 120);
        state.addTeamScore(2, 60);
        state.addTeamScore(0, 195);
        state.setLastTrickWinner(3);

        RoundResult result = RoundSettlement.settle(state, props);

        assertEquals(0, result.getKouDiPoints());
        assertEquals(220, state.getTeamScore(0), "底分归庄家组");
        assertEquals(120, result.getCatchingScore());
        assertTrue(result.isDealerDefended());
        assertEquals(3, result.getNextDealer(), "庄家守住，对家坐庄");
        assertEquals(3, result.getNextLevel(), "庄家组升一级");
        assertArrayEquals(new int[]{3, 2, 2}, result.getTeamLevels());

        int sum = 0;
        for (int score : result.getTeamScores()) {
            sum += score;
        }
        assertEquals(400, sum, "底分不翻倍时各组分数之和就是总分");
    }

    @Test
    void testTieGoesToLastTrickTeam() {
        state.addTeamScore(1, 130);
        state.addTeamScore(2, 80);
        state.setLastTrickWinner(5);

        RoundResult result = RoundSettlement.settle(state, props);

        assertEquals(130, state.getTeamScore(2), "80 + 25 x 2");
        assertEquals(2, result.getWinningTeam(), "同分时赢最后一墩的组坐庄");
        assertEquals(2, result.getNextDealer());
    }

    @Test
    void testPassingAceWinsMatch() {
        state.setTeamLevels(new int[]{14, 9, 6});
        state.setCurrentLevel(14);
        state.addTeamScore(1, 40);
        state.setLastTrickWinner(0);

        RoundResult result = RoundSettlement.settle(state, props);

        assertTrue(result.isDealerDefended());
        assertTrue(result.isMatchOver(), "打过A赢得比赛");
        assertEquals(0, result.getMatchWinnerTeam());
        assertEquals(14, result.getTeamLevels()[0]);
    }

    @Test
    void testThresholdConfigurable() {
        props.setLevelUpThreshold(200);
        state.addTeamScore(1, 150);
        state.setLastTrickWinner(3);

        RoundResult result = RoundSettlement.settle(state, props);

        assertTrue(result.isDealerDefended());
    }
}
