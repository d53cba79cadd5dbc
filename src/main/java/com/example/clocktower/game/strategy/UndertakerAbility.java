package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.service.StatusResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 언더테이커: 오늘 처형된 플레이어의 캐릭터를 알게 된다. 처형이 없었으면 깨어나지 않는다.
 */
@Component
@RequiredArgsConstructor
public class UndertakerAbility implements CharacterAbility {

    private final StatusResolver statusResolver;
    private final AbilitySupport support;

    @Override
    public Character getCharacter() {
        return Character.UNDERTAKER;
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        if (!gameState.getTokens().has(ReminderToken.UNDERTAKER_EXECUTED)) {
            return AbilityResult.silent(getCharacter(), actor.getName());
        }
        boolean impaired = statusResolver.isImpaired(gameState, actor);
        Optional<GamePlayer> executed = gameState.getTokens().consume(ReminderToken.UNDERTAKER_EXECUTED);
        GamePlayer target = executed.orElseThrow();
        Character shown = impaired ? support.randomScriptCharacter(gameState) : target.getCharacter();

        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .targetName(target.getName())
                .info("Storyteller: The executed player " + target.getName() + " was the "
                        + shown.getDisplayName() + ".")
                .impaired(impaired)
                .success(!impaired)
                .meta("shownCharacter", shown.name())
                .build();
    }
}
