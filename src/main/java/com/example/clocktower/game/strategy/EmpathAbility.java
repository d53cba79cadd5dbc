package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.service.StatusResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 엠패스: 가장 가까운 살아 있는 이웃 중 악의 수
 */
@Component
@RequiredArgsConstructor
public class EmpathAbility implements CharacterAbility {

    private final StatusResolver statusResolver;

    @Override
    public Character getCharacter() {
        return Character.EMPATH;
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        List<GamePlayer> neighbours = gameState.getPlayers().aliveNeighbours(actor);
        int evil = (int) neighbours.stream().filter(GamePlayer::isApparentlyEvil).count();
        boolean impaired = statusResolver.isImpaired(gameState, actor);
        int shown = impaired ? (evil + 1) % 3 : evil;

        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .targetNames(neighbours.stream().map(GamePlayer::getName).collect(Collectors.toList()))
                .info("Storyteller: " + shown + " of your alive neighbours are evil.")
                .impaired(impaired)
                .success(!impaired)
                .meta("evilNeighbours", shown)
                .build();
    }
}
