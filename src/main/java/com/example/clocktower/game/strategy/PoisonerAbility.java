package com.example.clocktower.game.strategy;

import com.example.clocktower.agent.DecisionGateway;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.service.StatusResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 포이즈너: 매일 밤 한 명을 중독시킨다. 이전 중독은 새로 고르기 전에 풀린다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PoisonerAbility implements CharacterAbility {

    private final StatusResolver statusResolver;
    private final DecisionGateway decisionGateway;

    @Override
    public Character getCharacter() {
        return Character.POISONER;
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        // 무력화 여부는 자신의 이전 중독을 풀기 전에 판정한다
        boolean impaired = statusResolver.isImpaired(gameState, actor);
        gameState.getPoisonGraph().removePoisoner(actor);

        Optional<List<GamePlayer>> choice = decisionGateway.requestNightTargets(gameState, actor,
                "Choose a player to poison tonight and tomorrow.", 1, GamePlayer::isAlive);
        if (choice.isEmpty()) {
            return AbilityResult.silent(getCharacter(), actor.getName());
        }

        GamePlayer target = choice.get().get(0);
        if (!impaired) {
            gameState.getPoisonGraph().addPoisoner(target, actor);
            log.debug("[중독] poisoner={}, target={}", actor.getName(), target.getName());
        }

        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .targetName(target.getName())
                .info("Storyteller: You have poisoned " + target.getName() + ".")
                .impaired(impaired)
                .success(!impaired)
                .build();
    }
}
