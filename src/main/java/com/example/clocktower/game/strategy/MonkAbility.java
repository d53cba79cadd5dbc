package com.example.clocktower.game.strategy;

import com.example.clocktower.agent.DecisionGateway;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.service.StatusResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 몽크: 자신이 아닌 한 명을 오늘 밤 Demon 으로부터 보호한다
 * 보호가 실제로 통하는지는 Demon 공격 시점에 몽크의 상태로 판정한다.
 */
@Component
@RequiredArgsConstructor
public class MonkAbility implements CharacterAbility {

    private final StatusResolver statusResolver;
    private final DecisionGateway decisionGateway;

    @Override
    public Character getCharacter() {
        return Character.MONK;
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        Optional<List<GamePlayer>> choice = decisionGateway.requestNightTargets(gameState, actor,
                "Choose a player (not yourself) to protect from the Demon tonight.", 1,
                player -> player != actor && player.isAlive());
        if (choice.isEmpty()) {
            return AbilityResult.silent(getCharacter(), actor.getName());
        }

        GamePlayer target = choice.get().get(0);
        gameState.getTokens().place(ReminderToken.MONK_PROTECTED, target);
        boolean impaired = statusResolver.isImpaired(gameState, actor);

        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .targetName(target.getName())
                .info("Storyteller: You are protecting " + target.getName() + " tonight.")
                .impaired(impaired)
                .success(!impaired)
                .build();
    }
}
