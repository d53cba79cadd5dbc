package com.example.clocktower.game.service;

import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.GameOutcome;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.Players;
import com.example.clocktower.game.domain.Winner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 일반 승리 조건 판정 (상태 없음)
 * - 살아 있는 Demon 이 없으면 선 승리
 * - 생존자가 2명 이하이면 악 승리
 * 시장/성자 같은 즉시 승리는 낮 페이즈가 발생 시점에 직접 처리한다.
 */
@Slf4j
@Component
public class WinConditionEvaluator {

    public Winner evaluate(Players players) {
        long aliveDemons = players.countAliveOfType(CharacterType.DEMON);
        if (aliveDemons == 0) {
            log.debug("[승리판정] 살아 있는 Demon 없음 - 선 승리");
            return Winner.GOOD;
        }

        int aliveCount = players.countAlive();
        if (aliveCount <= 2) {
            log.debug("[승리판정] 생존자 {}명 - 악 승리", aliveCount);
            return Winner.EVIL;
        }
        return Winner.NONE;
    }

    /**
     * 승패가 갈렸으면 게임 결과에 반영한다. 이미 즉시 승리로 끝난 게임은 그대로 둔다.
     *
     * @return 게임이 끝났는지 여부
     */
    public boolean applyTo(GameState gameState) {
        if (gameState.isOver()) {
            return true;
        }
        Winner winner = evaluate(gameState.getPlayers());
        if (!winner.isDecided()) {
            return false;
        }
        gameState.setOutcome(GameOutcome.of(winner));
        log.info("[승리판정] gameId={}, winner={}", gameState.getGameId(), winner);
        return true;
    }
}
