package com.example.clocktower.game.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * 리마인더 토큰 테이블
 */
public class ReminderTokens {

    private final Map<ReminderToken, GamePlayer> tokens = new EnumMap<>(ReminderToken.class);

    public void place(ReminderToken token, GamePlayer target) {
        tokens.put(token, target);
    }

    public Optional<GamePlayer> get(ReminderToken token) {
        return Optional.ofNullable(tokens.get(token));
    }

    public boolean has(ReminderToken token) {
        return tokens.containsKey(token);
    }

    public boolean marks(ReminderToken token, GamePlayer player) {
        return tokens.get(token) == player;
    }

    /**
     * 토큰을 제거하고 대상을 반환한다.
     */
    public Optional<GamePlayer> consume(ReminderToken token) {
        return Optional.ofNullable(tokens.remove(token));
    }

    /**
     * 낮 시작 시 NIGHT 범위 토큰 정리
     */
    public void clearScope(TokenScope scope) {
        tokens.keySet().removeIf(token -> token.getScope() == scope);
    }

    public Map<ReminderToken, GamePlayer> asMap() {
        return Collections.unmodifiableMap(tokens);
    }
}
