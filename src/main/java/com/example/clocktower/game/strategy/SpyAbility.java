package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.ReminderToken;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 스파이: 매일 밤 그리모어 전체를 본다. 무력화되어도 정확한 정보를 받는다.
 */
@Component
@RequiredArgsConstructor
public class SpyAbility implements CharacterAbility {

    @Override
    public Character getCharacter() {
        return Character.SPY;
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .info("Storyteller: The Grimoire:\n" + grimoire(gameState))
                .success(true)
                .build();
    }

    static String grimoire(GameState gameState) {
        StringBuilder sb = new StringBuilder();
        for (GamePlayer player : gameState.getPlayerList()) {
            sb.append("- ").append(player.getName()).append(": ").append(player.getCharacter().getDisplayName())
                    .append(player.isAlive() ? " (alive)" : " (dead)");
            if (player.getDrunkCharacter() != null) {
                sb.append(", believes they are the ").append(player.getDrunkCharacter().getDisplayName());
            }
            Set<GamePlayer> poisoners = gameState.getPoisonGraph().getPoisoners(player);
            if (!poisoners.isEmpty()) {
                sb.append(", poisoned by ").append(poisoners.stream()
                        .map(GamePlayer::getName).sorted().collect(Collectors.joining(", ")));
            }
            sb.append('\n');
        }
        for (Map.Entry<ReminderToken, GamePlayer> entry : gameState.getTokens().asMap().entrySet()) {
            sb.append("* ").append(entry.getKey().name()).append(" -> ").append(entry.getValue().getName())
                    .append('\n');
        }
        return sb.toString().trim();
    }
}
