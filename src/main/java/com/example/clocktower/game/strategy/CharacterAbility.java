package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;

/**
 * 캐릭터별 밤 능력 전략 인터페이스 (Strategy Pattern)
 */
public interface CharacterAbility {

    /**
     * 이 전략이 담당하는 캐릭터
     */
    Character getCharacter();

    /**
     * 밤 능력 실행
     *
     * @param gameState 현재 게임 상태
     * @param actor     능력 사용자 (드렁크일 수 있음)
     * @return 능력 사용자에게만 전달할 정보와 결과
     */
    AbilityResult resolve(GameState gameState, GamePlayer actor);

    /**
     * 게임 준비 시 필요한 리마인더 토큰 배치 (워셔우먼 쌍, 레드 헤링 등)
     */
    default void setup(GameState gameState, GamePlayer actor) {
    }

    /**
     * 사망한 상태로도 깨어나는지 여부
     */
    default boolean wakesWhenDead(GameState gameState, GamePlayer actor) {
        return false;
    }
}
