package com.example.clocktower.game.state;

import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.Phase;

/**
 * 게임 페이즈 상태 인터페이스 (State Pattern)
 */
public interface GamePhaseState {

    /**
     * 페이즈 전체를 진행한다. 도중에 승패가 갈리면 결과를 기록하고 즉시 반환한다.
     *
     * @param gameState 게임 상태
     */
    void process(GameState gameState);

    /**
     * 다음 페이즈
     */
    Phase nextPhase();

    /**
     * 현재 페이즈 종류 반환
     */
    Phase getPhase();
}
