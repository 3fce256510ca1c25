package com.gunzi.engine;

import com.gunzi.config.GameProperties;
import com.gunzi.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.*;

/**
 * 游戏引擎 - 房间状态机
 *
 * 所有动作都从 {@link #handle(GameAction)} 进入：先查阶段-动作表，再分派到对应处理器。
 * 处理器先做完全部校验再修改状态，校验失败抛 {@link GameRuleException}，
 * 在这里统一转换为 ACTION_REJECTED，状态保持不变。
 * 引擎本身不加锁，由 GameRoom 保证同一时刻只有一个动作在执行。
 */
public class GameEngine {

    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final GameState gameState;
    private final GameProperties props;
    private final Random random;

    public GameEngine(GameState gameState, GameProperties props, Random random) {
        this.gameState = gameState;
        this.props = props;
        this.random = random;

        // 牌数结构性校验：不对就直接让建房失败
        int dealt = props.getDeckCount() * DeckFactory.CARDS_PER_DECK - props.getBottomCardCount();
        if (gameState.getPlayerCount() != props.getPlayerCount() || dealt % props.getPlayerCount() != 0) {
            throw new IllegalStateException("牌数与人数不匹配：" + dealt + " 张发给 " + props.getPlayerCount() + " 人");
        }
        DeckFactory.verify(DeckFactory.createFullDeck(props.getDeckCount()), props.getDeckCount());
    }

    /**
     * 处理一个动作
     */
    public ActionResult handle(GameAction action) {
        Integer seat = rejectTarget(action);
        if (!PhaseTransitions.isAllowed(gameState.getPhase(), action.getType())) {
            log.warn("阶段 {} 不允许动作 {}", gameState.getPhase(), action.getType());
            return ActionResult.rejected(seat, RejectReason.INVALID_PHASE,
                "当前阶段 " + gameState.getPhase() + " 不能执行 " + action.getType());
        }

        try {
            List<GameEvent> events;
            switch (action.getType()) {
                case JOIN:
                    events = join(action);
                    break;
                case START_GAME:
                    events = startGame(action);
                    break;
                case DEAL_CARD:
                    events = dealCard();
                    break;
                case DECLARE_MAIN:
                    events = declareMain(action);
                    break;
                case EXCHANGE_CARDS:
                    events = exchangeCards(action);
                    break;
                case PLAY_CARDS:
                    events = playCards(action);
                    break;
                case START_NEXT_ROUND:
                    events = startNextRound(action);
                    break;
                default:
                    throw new IllegalArgumentException("未知动作：" + action.getType());
            }
            return ActionResult.accepted(events);
        } catch (GameRuleException e) {
            log.warn("房间 {} 拒绝动作 {}：{} {}", gameState.getRoomId(), action, e.getReason(), e.getMessage());
            return ActionResult.rejected(seat, e.getReason(), e.getMessage());
        }
    }

    /**
     * 拒绝事件发给谁：只发给实际存在的座位
     * JOIN 的座位只是期望座位，可能已有别人，拒绝不能发到那里
     */
    private Integer rejectTarget(GameAction action) {
        Integer seat = action.getSeat();
        if (action.getType() == PlayerAction.JOIN || seat == null
            || seat < 0 || seat >= gameState.getPlayerCount()) {
            return null;
        }
        return seat;
    }

    // === 入座 / 开局 ===

    private List<GameEvent> join(GameAction action) {
        String playerId = action.getPlayerId();
        if (playerId == null || playerId.isEmpty()) {
            throw new GameRuleException(RejectReason.NOT_SEATED, "缺少玩家ID");
        }

        // 重连：已在座位上的玩家直接返回原座位
        int existing = gameState.findSeatByPlayerId(playerId);
        if (existing >= 0) {
            log.info("玩家 {} 重新连接到房间 {}，座位 {}", playerId, gameState.getRoomId(), existing);
            return List.of(GameEvent.targeted(EventType.PLAYER_JOINED, existing, seatData(existing, true)));
        }

        if (gameState.getPhase() != GamePhase.WAITING) {
            throw new GameRuleException(RejectReason.INVALID_PHASE, "对局已开始，不能再入座");
        }

        Integer requested = action.getSeat();
        int seat;
        if (requested != null) {
            if (requested < 0 || requested >= gameState.getPlayerCount()) {
                throw new GameRuleException(RejectReason.INVALID_SEAT, "座位不存在：" + requested);
            }
            if (gameState.isAllSeated()) {
                throw new GameRuleException(RejectReason.ROOM_FULL, "房间已满");
            }
            if (gameState.getPlayer(requested) != null) {
                throw new GameRuleException(RejectReason.SEAT_TAKEN, "座位已被占：" + requested);
            }
            seat = requested;
        } else {
            seat = gameState.firstFreeSeat();
            if (seat < 0) {
                throw new GameRuleException(RejectReason.ROOM_FULL, "房间已满");
            }
        }

        String name = action.getPlayerName() != null ? action.getPlayerName() : playerId;
        gameState.seatPlayer(new Player(playerId, name, seat));
        log.info("玩家 {} 加入房间 {}，座位：{}，组：{}", name, gameState.getRoomId(), seat, gameState.teamOf(seat));
        return List.of(GameEvent.broadcast(EventType.PLAYER_JOINED, seatData(seat, false)));
    }

    private List<GameEvent> startGame(GameAction action) {
        requireSeated(action);
        if (!gameState.isAllSeated()) {
            throw new GameRuleException(RejectReason.NOT_ENOUGH_PLAYERS,
                "人数不足：" + gameState.getPlayers().size() + "/" + gameState.getPlayerCount());
        }
        log.info("游戏开始！房间ID: {}", gameState.getRoomId());
        return startRound();
    }

    /**
     * 开始"一局"：清理上局数据、洗牌、留底牌，进入摸牌阶段
     */
    private List<GameEvent> startRound() {
        gameState.resetForNewRound();

        List<Card> deck = DeckFactory.createAndShuffleDeck(props.getDeckCount(), random);
        int bottomCount = props.getBottomCardCount();
        gameState.setBottomCards(new ArrayList<>(deck.subList(0, bottomCount)));
        gameState.setDrawPile(new ArrayList<>(deck.subList(bottomCount, deck.size())));

        // 首局庄家要等亮主决定，从 0 号位开始摸牌；之后由上局结算决定
        int firstDraw = gameState.isDealerFixed() ? gameState.getDealerIndex() : 0;
        if (!gameState.isDealerFixed()) {
            gameState.setDealerIndex(-1);
        }
        gameState.setNextDrawIndex(firstDraw);
        gameState.setCurrentTurnIndex(firstDraw);
        gameState.setPhase(GamePhase.DRAWING);

        log.info("第 {} 局开始，打 {}，牌堆 {} 张，底牌 {} 张",
            gameState.getRoundNumber(), Rank.fromValue(gameState.getCurrentLevel()).getLabel(),
            gameState.getDrawPile().size(), bottomCount);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("round", gameState.getRoundNumber());
        data.put("dealer", gameState.getDealerIndex());
        data.put("level", gameState.getCurrentLevel());
        data.put("teamLevels", gameState.getTeamLevels());
        data.put("firstDraw", firstDraw);
        return List.of(GameEvent.broadcast(EventType.GAME_STARTED, data));
    }

    // === 摸牌 / 亮主 ===

    private List<GameEvent> dealCard() {
        Card card = gameState.drawCard();
        if (card == null) {
            throw new IllegalStateException("摸牌阶段牌堆为空");
        }

        List<GameEvent> events = new ArrayList<>();
        int seat = gameState.getNextDrawIndex();
        gameState.getPlayer(seat).addCard(card);
        log.debug("座位 {} 摸牌：{}", seat, card);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", seat);
        data.put("card", card);
        data.put("remaining", gameState.getDrawPile().size());
        events.add(GameEvent.targeted(EventType.CARD_DEALT, seat, data));

        int next = gameState.nextSeat(seat);
        gameState.setNextDrawIndex(next);
        gameState.setCurrentTurnIndex(next);

        if (gameState.getDrawPile().isEmpty()) {
            events.addAll(finishDrawing());
        }
        return events;
    }

    private List<GameEvent> declareMain(GameAction action) {
        Player player = requireSeated(action);
        List<Card> cards = resolveCards(player, action.getCardIds());

        int strength = DeclarationRules.strength(cards, gameState.getCurrentLevel(),
            props.getMinJokersToDeclare(), props.getDeclarationPriority());
        if (strength == 0) {
            throw new GameRuleException(RejectReason.INVALID_DECLARATION, "亮主牌不合法：" + cards);
        }

        // 级牌亮主花色就是牌的花色；王亮主由玩家指定（不指定为无主）
        Suit suit;
        Card first = cards.get(0);
        if (first.isJoker()) {
            suit = action.getSuit() == Suit.JOKER ? null : action.getSuit();
        } else {
            if (action.getSuit() != null && action.getSuit() != first.getSuit()) {
                throw new GameRuleException(RejectReason.INVALID_DECLARATION, "级牌亮主花色必须与牌一致");
            }
            suit = first.getSuit();
        }

        Declaration current = gameState.getDeclaration();
        if (current != null && strength <= current.getStrength()) {
            throw new GameRuleException(RejectReason.DECLARATION_TOO_WEAK,
                "反主强度不够，当前强度：" + current.getStrength());
        }

        gameState.setDeclaration(new Declaration(player.getSeat(), action.getCardIds(), suit, strength));
        gameState.setMainSuit(suit);
        log.info("座位 {} {}：{}，强度 {}", player.getSeat(), current == null ? "亮主" : "反主",
            suit == null ? "无主" : suit, strength);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", player.getSeat());
        data.put("suit", suit);
        data.put("strength", strength);
        data.put("cards", cards);
        data.put("override", current != null);
        return List.of(GameEvent.broadcast(EventType.MAIN_DECLARED, data));
    }

    /**
     * 牌发完：确定主花色与庄家，底牌交给庄家，进入扣底
     */
    private List<GameEvent> finishDrawing() {
        List<GameEvent> events = new ArrayList<>();
        Declaration declaration = gameState.getDeclaration();
        List<Card> bottom = gameState.getBottomCards();

        if (declaration == null) {
            // 无人亮主：翻底牌，点数最大的非王牌花色为主，全是王则无主
            Card best = null;
            for (Card card : bottom) {
                if (!card.isJoker() && (best == null || card.getRank().getValue() > best.getRank().getValue())) {
                    best = card;
                }
            }
            gameState.setMainSuit(best == null ? null : best.getSuit());
            log.info("无人亮主，翻底定主：{}", best == null ? "无主" : best.getSuit());

            Map<String, Object> flipped = new LinkedHashMap<>();
            flipped.put("cards", new ArrayList<>(bottom));
            flipped.put("flipped", true);
            flipped.put("mainSuit", gameState.getMainSuit());
            events.add(GameEvent.broadcast(EventType.BOTTOM_CARDS_REVEALED, flipped));
        }

        if (!gameState.isDealerFixed()) {
            gameState.setDealerIndex(declaration != null ? declaration.getSeat() : 0);
        }
        int dealer = gameState.getDealerIndex();

        List<Card> bottomCards = new ArrayList<>(bottom);
        gameState.getPlayer(dealer).addCards(bottomCards);
        gameState.setBottomCards(new ArrayList<>());
        gameState.setPhase(GamePhase.EXCHANGING);
        gameState.setCurrentTurnIndex(dealer);
        log.info("摸牌结束，庄家：{}，主花色：{}，开始扣底", dealer, gameState.getMainSuit());

        Map<String, Object> started = new LinkedHashMap<>();
        started.put("dealer", dealer);
        started.put("mainSuit", gameState.getMainSuit());
        started.put("level", gameState.getCurrentLevel());
        events.add(GameEvent.broadcast(EventType.EXCHANGE_STARTED, started));

        Map<String, Object> reveal = new LinkedHashMap<>();
        reveal.put("cards", bottomCards);
        reveal.put("seat", dealer);
        events.add(GameEvent.targeted(EventType.BOTTOM_CARDS_REVEALED, dealer, reveal));
        return events;
    }

    // === 扣底 ===

    private List<GameEvent> exchangeCards(GameAction action) {
        Player player = requireSeated(action);
        if (player.getSeat() != gameState.getDealerIndex()) {
            throw new GameRuleException(RejectReason.NOT_DEALER, "只有庄家可以扣底");
        }
        if (action.getCardIds().size() != props.getBottomCardCount()) {
            throw new GameRuleException(RejectReason.WRONG_CARD_COUNT,
                "必须扣 " + props.getBottomCardCount() + " 张牌，实际 " + action.getCardIds().size());
        }
        resolveCards(player, action.getCardIds());

        List<Card> buried = player.removeCards(action.getCardIds());
        gameState.setBottomCards(buried);
        gameState.setPhase(GamePhase.PLAYING);
        gameState.setCurrentTurnIndex(player.getSeat());
        log.info("庄家 {} 扣底完成，底分 {}，开始出牌", player.getSeat(), gameState.getBottomPoints());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("leader", player.getSeat());
        data.put("mainSuit", gameState.getMainSuit());
        data.put("level", gameState.getCurrentLevel());
        return List.of(GameEvent.broadcast(EventType.PLAY_STARTED, data));
    }

    // === 出牌 ===

    private List<GameEvent> playCards(GameAction action) {
        Player player = requireSeated(action);
        if (player.getSeat() != gameState.getCurrentTurnIndex()) {
            throw new GameRuleException(RejectReason.NOT_YOUR_TURN,
                "还没轮到座位 " + player.getSeat() + "，当前：" + gameState.getCurrentTurnIndex());
        }
        List<Card> cards = resolveCards(player, action.getCardIds());
        Trick trick = gameState.getCurrentTrick();
        Suit mainSuit = gameState.getMainSuit();
        int level = gameState.getCurrentLevel();

        if (trick.isEmpty()) {
            if (StructureClassifier.classify(cards) == MoveType.INVALID) {
                throw new GameRuleException(RejectReason.INVALID_STRUCTURE, "首家只能出单张/对子/滚子/炸子：" + cards);
            }
        } else {
            RejectReason reason = FollowRuleValidator.validate(trick.getLead().getCards(), cards,
                player.getHandCards(), mainSuit, level);
            if (reason != null) {
                throw new GameRuleException(reason, "跟牌不合法：" + cards);
            }
        }

        // 校验全部通过，开始修改状态
        player.removeCards(action.getCardIds());
        trick.add(new TrickPlay(player.getSeat(), cards));
        gameState.setCurrentTurnIndex(gameState.nextSeat(player.getSeat()));
        log.info("座位 {} 打出：{}", player.getSeat(), cards);

        List<GameEvent> events = new ArrayList<>();
        GameEvent trickEvent = null;
        if (trick.isComplete()) {
            trickEvent = resolveTrick();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", player.getSeat());
        data.put("cards", cards);
        data.put("nextTurn", gameState.getCurrentTurnIndex());
        events.add(GameEvent.broadcast(EventType.PLAY_ACCEPTED, data));

        if (trickEvent != null) {
            events.add(trickEvent);
            if (allHandsEmpty()) {
                events.addAll(finishRound());
            }
        }
        return events;
    }

    /**
     * 一墩打完：判定赢家、计分、赢家下一墩首出
     */
    private GameEvent resolveTrick() {
        Trick trick = gameState.getCurrentTrick();
        int winner = TrickResolver.resolveWinner(trick, gameState.getMainSuit(),
            gameState.getCurrentLevel(), gameState.getPlayerCount());
        int points = trick.getPoints();
        int team = gameState.teamOf(winner);
        gameState.addTeamScore(team, points);
        gameState.setLastTrickWinner(winner);
        gameState.setCurrentTurnIndex(winner);
        trick.clear();

        log.info("本墩赢家：座位 {}（组 {}{}），分数 {}", winner, team,
            gameState.isCatchingTeam(team) ? "，抓分方" : "，庄家方", points);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("winner", winner);
        data.put("points", points);
        data.put("catching", gameState.isCatchingTeam(team));
        data.put("scores", gameState.getTeamScores());
        data.put("nextTurn", winner);
        return GameEvent.broadcast(EventType.TRICK_RESOLVED, data);
    }

    /**
     * 手牌出完：扣底结算，冻结分数
     */
    private List<GameEvent> finishRound() {
        RoundResult result = RoundSettlement.settle(gameState, props);
        gameState.setRoundResult(result);
        gameState.setPhase(GamePhase.FINISHED);
        gameState.setCurrentTurnIndex(-1);
        if (result.isMatchOver()) {
            gameState.setMatchWinnerTeam(result.getMatchWinnerTeam());
        }
        log.info("第 {} 局结束，各组得分 {}，下一局庄家 {}", gameState.getRoundNumber(),
            Arrays.toString(result.getTeamScores()), result.getNextDealer());

        List<GameEvent> events = new ArrayList<>();
        Map<String, Object> bottom = new LinkedHashMap<>();
        bottom.put("cards", new ArrayList<>(gameState.getBottomCards()));
        bottom.put("seat", gameState.getDealerIndex());
        bottom.put("points", result.getBottomPoints());
        events.add(GameEvent.broadcast(EventType.BOTTOM_CARDS_REVEALED, bottom));

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("scores", result.getTeamScores());
        data.put("levels", result.getTeamLevels());
        data.put("nextDealer", result.getNextDealer());
        data.put("nextLevel", result.getNextLevel());
        data.put("dealerDefended", result.isDealerDefended());
        data.put("kouDiPoints", result.getKouDiPoints());
        data.put("matchWinner", result.getMatchWinnerTeam());
        events.add(GameEvent.broadcast(EventType.ROUND_FINISHED, data));
        return events;
    }

    private List<GameEvent> startNextRound(GameAction action) {
        requireSeated(action);
        RoundResult result = gameState.getRoundResult();
        if (gameState.getMatchWinnerTeam() >= 0) {
            throw new GameRuleException(RejectReason.MATCH_OVER, "组 " + gameState.getMatchWinnerTeam() + " 已赢得比赛");
        }

        gameState.setTeamLevels(result.getTeamLevels());
        gameState.setDealerIndex(result.getNextDealer());
        gameState.setDealerFixed(true);
        gameState.setCurrentLevel(result.getNextLevel());
        gameState.setPhase(GamePhase.WAITING);
        log.info("开下一局：庄家 {}，打 {}", result.getNextDealer(), Rank.fromValue(result.getNextLevel()).getLabel());

        return startRound();
    }

    // === 工具方法 ===

    private Player requireSeated(GameAction action) {
        Integer seat = action.getSeat();
        Player player = seat == null ? null : gameState.getPlayer(seat);
        if (player == null) {
            throw new GameRuleException(RejectReason.NOT_SEATED, "座位上没有玩家：" + seat);
        }
        return player;
    }

    /**
     * 按 id 取出手牌，任何一个 id 不在手中或重复都视为未知牌
     */
    private List<Card> resolveCards(Player player, List<String> cardIds) {
        Set<String> seen = new HashSet<>();
        List<Card> cards = new ArrayList<>(cardIds.size());
        for (String cardId : cardIds) {
            Card card = player.getCard(cardId);
            if (card == null || !seen.add(cardId)) {
                throw new GameRuleException(RejectReason.UNKNOWN_CARD, "座位 " + player.getSeat() + " 手中没有牌：" + cardId);
            }
            cards.add(card);
        }
        return cards;
    }

    private boolean allHandsEmpty() {
        for (Player p : gameState.getPlayers()) {
            if (p.getHandSize() > 0) {
                return false;
            }
        }
        return true;
    }

    private Map<String, Object> seatData(int seat, boolean reconnect) {
        Player p = gameState.getPlayer(seat);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", seat);
        data.put("playerId", p.getId());
        data.put("name", p.getName());
        data.put("team", p.getTeam());
        data.put("reconnect", reconnect);
        return data;
    }

    // === 查询 ===

    /**
     * 公开快照
     */
    public RoomSnapshot snapshot() {
        List<SeatSnapshot> seats = new ArrayList<>();
        for (int i = 0; i < gameState.getPlayerCount(); i++) {
            Player p = gameState.getPlayer(i);
            if (p == null) {
                seats.add(new SeatSnapshot(i, null, null, gameState.teamOf(i), 0));
            } else {
                seats.add(new SeatSnapshot(i, p.getId(), p.getName(), p.getTeam(), p.getHandSize()));
            }
        }
        return new RoomSnapshot(gameState.getRoomId(), gameState.getPhase(), gameState.getRoundNumber(), seats,
            gameState.getDealerIndex(), gameState.getCurrentLevel(), gameState.getMainSuit(),
            gameState.getCurrentTurnIndex(), new ArrayList<>(gameState.getCurrentTrick().getPlays()),
            gameState.getTeamScores(), gameState.getTeamLevels(), gameState.getDrawPile().size(),
            gameState.getRoundResult());
    }

    /**
     * 座位私有视图（含手牌）
     */
    public SeatView seatView(int seat) {
        Player p = gameState.getPlayer(seat);
        List<Card> hand = p == null ? Collections.emptyList() : p.getHandCards();
        return new SeatView(seat, snapshot(), hand);
    }

    public GameState getGameState() {
        return gameState;
    }
}
