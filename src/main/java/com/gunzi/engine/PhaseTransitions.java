package com.gunzi.engine;

import com.gunzi.model.GamePhase;
import com.gunzi.model.PlayerAction;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 阶段-动作表：每个（阶段，动作）要么对应一个处理器，要么 INVALID_PHASE
 * JOIN 在开局后只用于断线重连
 */
public class PhaseTransitions {

    private static final Map<GamePhase, Set<PlayerAction>> ALLOWED = new EnumMap<>(GamePhase.class);

    static {
        ALLOWED.put(GamePhase.WAITING, EnumSet.of(PlayerAction.JOIN, PlayerAction.START_GAME));
        ALLOWED.put(GamePhase.DRAWING, EnumSet.of(PlayerAction.JOIN, PlayerAction.DEAL_CARD, PlayerAction.DECLARE_MAIN));
        ALLOWED.put(GamePhase.EXCHANGING, EnumSet.of(PlayerAction.JOIN, PlayerAction.EXCHANGE_CARDS));
        ALLOWED.put(GamePhase.PLAYING, EnumSet.of(PlayerAction.JOIN, PlayerAction.PLAY_CARDS));
        ALLOWED.put(GamePhase.FINISHED, EnumSet.of(PlayerAction.JOIN, PlayerAction.START_NEXT_ROUND));
    }

    public static boolean isAllowed(GamePhase phase, PlayerAction action) {
        return ALLOWED.get(phase).contains(action);
    }

    public static Set<PlayerAction> allowedIn(GamePhase phase) {
        return EnumSet.copyOf(ALLOWED.get(phase));
    }
}
