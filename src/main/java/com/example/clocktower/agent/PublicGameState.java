package com.example.clocktower.agent;

import com.example.clocktower.game.domain.ChoppingBlock;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.Phase;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 모든 플레이어에게 공개되는 상태 스냅샷 (좌석 순서)
 */
public record PublicGameState(
        int roundNumber,
        Phase phase,
        List<PublicPlayer> players,
        String choppingBlockNominee,
        Integer choppingBlockVotes,
        boolean nominationsOpen) {

    public record PublicPlayer(String name, boolean alive, boolean usedGhostVote) {
    }

    public static PublicGameState from(GameState gameState) {
        ChoppingBlock block = gameState.getChoppingBlock();
        return new PublicGameState(
                gameState.getRoundNumber(),
                gameState.getPhase(),
                gameState.getPlayerList().stream()
                        .map(player -> new PublicPlayer(player.getName(), player.isAlive(),
                                !player.isAlive() && player.isUsedGhostVote()))
                        .collect(Collectors.toList()),
                block == null ? null : block.nominee().getName(),
                block == null ? null : block.voteCount(),
                gameState.isNominationsOpen());
    }
}
