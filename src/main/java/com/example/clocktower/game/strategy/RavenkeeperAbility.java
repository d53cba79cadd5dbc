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
 * 레이븐키퍼: 밤에 Demon 에게 죽으면 깨어나 한 명의 캐릭터를 알게 된다
 */
@Component
@RequiredArgsConstructor
public class RavenkeeperAbility implements CharacterAbility {

    private final StatusResolver statusResolver;
    private final DecisionGateway decisionGateway;
    private final AbilitySupport support;

    @Override
    public Character getCharacter() {
        return Character.RAVENKEEPER;
    }

    @Override
    public boolean wakesWhenDead(GameState gameState, GamePlayer actor) {
        return gameState.getTokens().marks(ReminderToken.RAVENKEEPER_WOKEN, actor);
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        if (!gameState.getTokens().marks(ReminderToken.RAVENKEEPER_WOKEN, actor)) {
            return AbilityResult.silent(getCharacter(), actor.getName());
        }
        gameState.getTokens().consume(ReminderToken.RAVENKEEPER_WOKEN);

        Optional<List<GamePlayer>> choice = decisionGateway.requestNightTargets(gameState, actor,
                "You died tonight. Choose a player to learn their character.", 1, player -> true);
        if (choice.isEmpty()) {
            return AbilityResult.silent(getCharacter(), actor.getName());
        }

        GamePlayer target = choice.get().get(0);
        boolean impaired = statusResolver.isImpaired(gameState, actor);
        Character shown = impaired ? support.randomScriptCharacter(gameState) : target.getCharacter();

        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .targetName(target.getName())
                .info("Storyteller: " + target.getName() + " is the " + shown.getDisplayName() + ".")
                .impaired(impaired)
                .success(!impaired)
                .meta("shownCharacter", shown.name())
                .build();
    }
}
