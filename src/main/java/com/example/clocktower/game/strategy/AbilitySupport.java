package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 거짓 정보 생성 등에 쓰는 무작위 선택. 모든 무작위는 게임 상태의 난수원에서 뽑는다.
 */
@Component
public class AbilitySupport {

    public <T> T pick(GameState gameState, List<T> candidates) {
        return candidates.get(gameState.getRandom().nextInt(candidates.size()));
    }

    /**
     * 능력 사용자를 제외한 무작위 플레이어 count 명
     */
    public List<GamePlayer> randomOthers(GameState gameState, GamePlayer actor, int count) {
        List<GamePlayer> others = gameState.getPlayerList().stream()
                .filter(player -> player != actor)
                .collect(Collectors.toCollection(ArrayList::new));
        Collections.shuffle(others, gameState.getRandom());
        return others.subList(0, Math.min(count, others.size()));
    }

    public Character randomCharacter(GameState gameState, CharacterType type) {
        return pick(gameState, gameState.getScript().charactersOf(type));
    }

    public Character randomScriptCharacter(GameState gameState) {
        return pick(gameState, gameState.getScript().allCharacters());
    }

    /**
     * 두 명을 무작위 순서로 나열한다.
     */
    public String shuffledPair(GameState gameState, GamePlayer first, GamePlayer second) {
        return gameState.getRandom().nextBoolean()
                ? first.getName() + " and " + second.getName()
                : second.getName() + " and " + first.getName();
    }
}
