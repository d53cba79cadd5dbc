package com.example.clocktower.game.strategy;

import com.example.clocktower.agent.DecisionGateway;
import com.example.clocktower.game.domain.Alignment;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.service.StatusResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 포춘텔러: 두 명을 골라 그중 Demon 이 있는지 알게 된다
 * - 선 플레이어 한 명이 레드 헤링으로 지정되어 Demon 처럼 보인다
 */
@Component
@RequiredArgsConstructor
public class FortuneTellerAbility implements CharacterAbility {

    private final StatusResolver statusResolver;
    private final DecisionGateway decisionGateway;
    private final AbilitySupport support;

    @Override
    public Character getCharacter() {
        return Character.FORTUNE_TELLER;
    }

    @Override
    public void setup(GameState gameState, GamePlayer actor) {
        List<GamePlayer> good = gameState.getPlayerList().stream()
                .filter(player -> player.getAlignment() == Alignment.GOOD)
                .collect(Collectors.toList());
        if (!good.isEmpty()) {
            gameState.getTokens().place(ReminderToken.RED_HERRING, support.pick(gameState, good));
        }
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        Optional<List<GamePlayer>> choice = decisionGateway.requestNightTargets(gameState, actor,
                "Choose two players. You will learn if either of them is the Demon.", 2, player -> true);
        if (choice.isEmpty()) {
            return AbilityResult.silent(getCharacter(), actor.getName());
        }

        List<GamePlayer> targets = choice.get();
        boolean demonSeen = targets.stream().anyMatch(target -> registersAsDemon(gameState, target));
        boolean impaired = statusResolver.isImpaired(gameState, actor);
        boolean shown = impaired != demonSeen;

        String names = targets.get(0).getName() + " and " + targets.get(1).getName();
        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .targetNames(targets.stream().map(GamePlayer::getName).collect(Collectors.toList()))
                .info("Storyteller: " + (shown ? "Yes" : "No") + ", there is "
                        + (shown ? "a" : "no") + " Demon among " + names + ".")
                .impaired(impaired)
                .success(!impaired)
                .meta("demonSeen", shown)
                .build();
    }

    private boolean registersAsDemon(GameState gameState, GamePlayer target) {
        return target.registersAs(CharacterType.DEMON)
                || gameState.getTokens().marks(ReminderToken.RED_HERRING, target);
    }
}
