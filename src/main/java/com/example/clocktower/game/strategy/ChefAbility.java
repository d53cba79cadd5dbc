package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.service.StatusResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 셰프: 서로 이웃한 악 플레이어 쌍의 수를 알게 된다
 */
@Component
@RequiredArgsConstructor
public class ChefAbility implements CharacterAbility {

    private final StatusResolver statusResolver;

    @Override
    public Character getCharacter() {
        return Character.CHEF;
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        int pairs = countEvilPairs(gameState.getPlayerList());
        boolean impaired = statusResolver.isImpaired(gameState, actor);
        int shown = impaired ? (pairs + 1) % 3 : pairs;

        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .info("Storyteller: There are " + shown + " pairs of evil players sitting next to each other.")
                .impaired(impaired)
                .success(!impaired)
                .meta("pairs", shown)
                .build();
    }

    static int countEvilPairs(List<GamePlayer> seats) {
        if (seats.size() < 2) {
            return 0;
        }
        int pairs = 0;
        for (int i = 0; i < seats.size(); i++) {
            GamePlayer current = seats.get(i);
            GamePlayer next = seats.get((i + 1) % seats.size());
            if (current.isApparentlyEvil() && next.isApparentlyEvil()) {
                pairs++;
            }
        }
        // 2명이면 같은 쌍을 두 번 센다
        return seats.size() == 2 ? pairs / 2 : pairs;
    }
}
