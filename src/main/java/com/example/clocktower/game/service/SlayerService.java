package com.example.clocktower.game.service;

import com.example.clocktower.event.EventType;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 슬레이어 능력: 누구나 한 번 공개적으로 시도할 수 있고, 정상 상태의 진짜 슬레이어가 Demon 을 고른 경우에만 성공한다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SlayerService {

    private final StatusResolver statusResolver;
    private final DeathService deathService;

    /**
     * @return 대상이 죽었는지 여부
     */
    public boolean useSlayerPower(GameState gameState, GamePlayer actor, GamePlayer target, String publicReasoning) {
        actor.setUsedCounterAbility(true);

        boolean works = actor.getCharacter() == Character.SLAYER
                && !statusResolver.isImpaired(gameState, actor)
                && target.isAlive()
                && target.getType() == CharacterType.DEMON;

        log.info("[슬레이어] actor={}, target={}, success={}", actor.getName(), target.getName(), works);
        gameState.record(EventType.SLAYER_POWER,
                actor.getName() + " used the Slayer power on " + target.getName(),
                List.of(actor.getName(), target.getName()),
                Map.of("success", works, "reason", publicReasoning == null ? "" : publicReasoning));

        if (works) {
            gameState.broadcast("Storyteller: " + actor.getName() + " has used their slayer power on "
                    + target.getName() + " and killed them.");
            deathService.kill(gameState, target, DeathCause.SLAYER);
        } else {
            gameState.broadcast("Storyteller: " + actor.getName() + " has used their slayer power on "
                    + target.getName() + " and nothing happened.");
        }
        return works;
    }
}
