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
 * 버틀러: 주인을 고른다. 다음 투표에서 주인이 찬성하지 않으면 찬성할 수 없다.
 */
@Component
@RequiredArgsConstructor
public class ButlerAbility implements CharacterAbility {

    private final StatusResolver statusResolver;
    private final DecisionGateway decisionGateway;

    @Override
    public Character getCharacter() {
        return Character.BUTLER;
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        Optional<List<GamePlayer>> choice = decisionGateway.requestNightTargets(gameState, actor,
                "Choose your master (not yourself). Tomorrow you may only vote yes if your master votes yes.", 1,
                player -> player != actor);
        if (choice.isEmpty()) {
            return AbilityResult.silent(getCharacter(), actor.getName());
        }

        GamePlayer master = choice.get().get(0);
        gameState.getTokens().place(ReminderToken.BUTLER_MASTER, master);
        boolean impaired = statusResolver.isImpaired(gameState, actor);

        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .targetName(master.getName())
                .info("Storyteller: Your master is " + master.getName() + ".")
                .impaired(impaired)
                .success(!impaired)
                .build();
    }
}
