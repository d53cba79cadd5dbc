package com.example.clocktower.game.dto.response;

import com.example.clocktower.event.GameStatistics;
import com.example.clocktower.game.domain.GameOutcome;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import lombok.Builder;

import java.util.List;
import java.util.stream.Collectors;

@Builder
public record GameResultResponse(
        String gameId,
        GameOutcome outcome,
        int roundsPlayed,
        List<PlayerResult> players,
        GameStatistics statistics
) {

    public record PlayerResult(String name, String character, String believedCharacter, String alignment,
                               boolean alive) {

        static PlayerResult from(GamePlayer player) {
            return new PlayerResult(
                    player.getName(),
                    player.getCharacter().getDisplayName(),
                    player.getBelievedCharacter().getDisplayName(),
                    player.getAlignment().name(),
                    player.isAlive());
        }
    }

    public static GameResultResponse from(GameState gameState) {
        return GameResultResponse.builder()
                .gameId(gameState.getGameId())
                .outcome(gameState.getOutcome())
                .roundsPlayed(gameState.getRoundNumber())
                .players(gameState.getPlayerList().stream().map(PlayerResult::from).collect(Collectors.toList()))
                .statistics(gameState.getEventLog().getStatistics())
                .build();
    }
}
