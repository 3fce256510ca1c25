package com.gunzi.engine;

import com.gunzi.model.Card;
import com.gunzi.model.MoveType;
import com.gunzi.model.Rank;
import com.gunzi.model.RejectReason;
import com.gunzi.model.Suit;
import org.junit.jupiter.api.Test;
import java.util.ArrayList;
import java.util.List;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 跟牌校验测试（打5，红桃为主）
 */
class FollowRuleValidatorTest {

    private static final int LEVEL = 5;
    private static final Suit MAIN = Suit.HEART;

    private int seq = 0;

    private Card card(Suit suit, Rank rank) {
        return new Card(suit, rank, "c" + (seq++));
    }

    private List<Card> same(Suit suit, Rank rank, int count) {
        List<Card> cards = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            cards.add(card(suit, rank));
        }
        return cards;
    }

    @SafeVarargs
    private static List<Card> hand(List<Card>... groups) {
        List<Card> all = new ArrayList<>();
        for (List<Card> group : groups) {
            all.addAll(group);
        }
        return all;
    }

    private RejectReason validate(List<Card> leader, List<Card> played, List<Card> hand) {
        return FollowRuleValidator.validate(leader, played, hand, MAIN, LEVEL);
    }

    @Test
    void testWrongCount() {
        List<Card> leader = same(Suit.SPADE, Rank.KING, 2);
        Card seven = card(Suit.SPADE, Rank.SEVEN);
        assertEquals(RejectReason.WRONG_CARD_COUNT, validate(leader, List.of(seven), List.of(seven)));
    }

    @Test
    void testMustFollowSuit() {
        List<Card> leader = same(Suit.SPADE, Rank.KING, 2);
        Card s7 = card(Suit.SPADE, Rank.SEVEN);
        Card s8 = card(Suit.SPADE, Rank.EIGHT);
        Card s9 = card(Suit.SPADE, Rank.NINE);
        Card c3 = card(Suit.CLUB, Rank.THREE);
        List<Card> hand = List.of(s7, s8, s9, c3);

        assertEquals(RejectReason.MUST_FOLLOW_SUIT, validate(leader, List.of(s7, c3), hand), "黑桃够数必须全跟黑桃");
        assertNull(validate(leader, List.of(s7, s8), hand));
    }

    @Test
    void testMustExhaustSuit() {
        List<Card> leader = same(Suit.SPADE, Rank.KING, 2);
        Card s7 = card(Suit.SPADE, Rank.SEVEN);
        Card c3 = card(Suit.CLUB, Rank.THREE);
        Card c4 = card(Suit.CLUB, Rank.FOUR);
        List<Card> hand = List.of(s7, c3, c4);

        assertEquals(RejectReason.MUST_EXHAUST_SUIT, validate(leader, List.of(c3, c4), hand), "黑桃不够也要先出尽");
        assertNull(validate(leader, List.of(s7, c3), hand));
    }

    @Test
    void testMainLeadIncludesLevelCardsAndTwos() {
        List<Card> leader = List.of(card(Suit.JOKER, Rank.SMALL_JOKER));
        Card spadeTwo = card(Suit.SPADE, Rank.TWO);
        Card clubFive = card(Suit.CLUB, Rank.FIVE);
        Card spadeAce = card(Suit.SPADE, Rank.ACE);
        List<Card> hand = List.of(spadeTwo, clubFive, spadeAce);

        assertEquals(RejectReason.MUST_FOLLOW_SUIT, validate(leader, List.of(spadeAce), hand), "首家出主，手里有主必须跟主");
        assertNull(validate(leader, List.of(spadeTwo), hand));
        assertNull(validate(leader, List.of(clubFive), hand));
    }

    @Test
    void testDeadStickPairLead() {
        List<Card> leader = same(Suit.CLUB, Rank.ACE, 2);
        List<Card> sixes = same(Suit.CLUB, Rank.SIX, 2);
        Card c7 = card(Suit.CLUB, Rank.SEVEN);
        Card c8 = card(Suit.CLUB, Rank.EIGHT);
        List<Card> hand = hand(sixes, List.of(c7, c8));

        assertEquals(RejectReason.DEAD_STICK, validate(leader, List.of(c7, c8), hand), "有对子不能拆成两张单");
        assertEquals(RejectReason.DEAD_STICK, validate(leader, List.of(sixes.get(0), c7), hand));
        assertNull(validate(leader, sixes, hand));
    }

    @Test
    void testDeadStickTripleRequiresPair() {
        List<Card> leader = same(Suit.SPADE, Rank.KING, 3);
        List<Card> nines = same(Suit.SPADE, Rank.NINE, 2);
        Card s7 = card(Suit.SPADE, Rank.SEVEN);
        Card s8 = card(Suit.SPADE, Rank.EIGHT);
        List<Card> hand = hand(nines, List.of(s7, s8));

        assertEquals(RejectReason.DEAD_STICK, validate(leader, List.of(nines.get(0), s7, s8), hand),
            "手里有对子，首家出滚子时必须跟对子");
        assertNull(validate(leader, List.of(nines.get(0), nines.get(1), s7), hand));
    }

    @Test
    void testDeadStickQuadRequiresTriple() {
        List<Card> leader = same(Suit.DIAMOND, Rank.QUEEN, 4);
        List<Card> nines = same(Suit.DIAMOND, Rank.NINE, 3);
        List<Card> eights = same(Suit.DIAMOND, Rank.EIGHT, 2);
        List<Card> hand = hand(nines, eights);

        assertEquals(RejectReason.DEAD_STICK,
            validate(leader, List.of(nines.get(0), nines.get(1), eights.get(0), eights.get(1)), hand),
            "手里有滚子时跟两对不行");
        assertNull(validate(leader, List.of(nines.get(0), nines.get(1), nines.get(2), eights.get(0)), hand));
    }

    @Test
    void testDeadStickNotCheckedWhenShortOfSuit() {
        List<Card> leader = same(Suit.SPADE, Rank.KING, 3);
        List<Card> nines = same(Suit.SPADE, Rank.NINE, 2);
        Card c3 = card(Suit.CLUB, Rank.THREE);
        Card c4 = card(Suit.CLUB, Rank.FOUR);
        List<Card> hand = hand(nines, List.of(c3, c4));

        assertNull(validate(leader, List.of(nines.get(0), nines.get(1), c3), hand));
        assertEquals(RejectReason.MUST_EXHAUST_SUIT, validate(leader, List.of(nines.get(0), c3, c4), hand));
    }

    @Test
    void testSingleLeadHasNoStructureRequirement() {
        List<Card> leader = List.of(card(Suit.SPADE, Rank.KING));
        List<Card> nines = same(Suit.SPADE, Rank.NINE, 4);
        Card s3 = card(Suit.SPADE, Rank.THREE);
        assertNull(validate(leader, List.of(s3), hand(nines, List.of(s3))));
    }

    @Test
    void testRequiredStructureSize() {
        List<Card> pair = same(Suit.SPADE, Rank.NINE, 2);
        assertEquals(2, FollowRuleValidator.requiredStructureSize(MoveType.QUAD, pair));
        assertEquals(2, FollowRuleValidator.requiredStructureSize(MoveType.PAIR, same(Suit.SPADE, Rank.TEN, 4)));
        assertEquals(1, FollowRuleValidator.requiredStructureSize(MoveType.TRIPLE, List.of(card(Suit.SPADE, Rank.JACK))));
        assertEquals(1, FollowRuleValidator.requiredStructureSize(MoveType.SINGLE, pair));
    }
}
