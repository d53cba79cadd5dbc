package com.example.clocktower.game.state;

import com.example.clocktower.game.domain.Phase;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 페이즈별 상태를 제공하는 Factory
 */
@Component
@RequiredArgsConstructor
public class GamePhaseFactory {

    private final NightPhaseState nightPhaseState;
    private final DayPhaseState dayPhaseState;

    /**
     * 현재 페이즈에 맞는 상태 객체 반환
     */
    public GamePhaseState getState(Phase phase) {
        return switch (phase) {
            case NIGHT -> nightPhaseState;
            case DAY -> dayPhaseState;
            case SETUP -> throw new IllegalStateException("Setup is handled by GameSetupService");
        };
    }
}
