package com.example.clocktower.game.service;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * 능력 무력화(취함/중독) 판정
 * - 드렁크는 항상 무력화
 * - 살아 있고 스스로 무력화되지 않은 중독자가 한 명이라도 있으면 무력화
 * - 순환 중독(A↔B, 자기 자신)은 현재 탐색 경로에 있는 플레이어를 무력화되지 않은 것으로 보고 끊는다
 */
@Component
public class StatusResolver {

    public boolean isImpaired(GameState gameState, GamePlayer player) {
        return isImpaired(gameState, player, new HashSet<>());
    }

    private boolean isImpaired(GameState gameState, GamePlayer player, Set<GamePlayer> path) {
        if (player.getCharacter() == Character.DRUNK) {
            return true;
        }

        path.add(player);
        try {
            for (GamePlayer poisoner : gameState.getPoisonGraph().getPoisoners(player)) {
                if (!path.contains(poisoner)
                        && poisoner.isAlive()
                        && !isImpaired(gameState, poisoner, path)) {
                    return true;
                }
            }
            return false;
        } finally {
            path.remove(player);
        }
    }
}
