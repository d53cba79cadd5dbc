package com.example.clocktower.game.strategy;

import com.example.clocktower.agent.DecisionGateway;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.service.DeathCause;
import com.example.clocktower.game.service.DeathService;
import com.example.clocktower.game.service.StatusResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 임프: 첫날 밤을 제외하고 매일 밤 한 명을 죽인다
 * - 정상 상태의 시장을 노리면 다른 플레이어가 대신 죽을 수 있다
 * - 몽크 보호, 솔저는 공격을 막는다
 * - 자신을 죽이면 살아 있는 Minion 이 새 임프가 된다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImpAbility implements CharacterAbility {

    private final StatusResolver statusResolver;
    private final DecisionGateway decisionGateway;
    private final DeathService deathService;

    @Override
    public Character getCharacter() {
        return Character.IMP;
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        Optional<List<GamePlayer>> choice = decisionGateway.requestNightTargets(gameState, actor,
                "Choose a player to kill tonight. You may choose yourself.", 1, GamePlayer::isAlive);
        if (choice.isEmpty()) {
            return AbilityResult.silent(getCharacter(), actor.getName());
        }

        GamePlayer target = choice.get().get(0);
        boolean impaired = statusResolver.isImpaired(gameState, actor);
        if (impaired) {
            return failed(actor, target, true, "impaired");
        }

        GamePlayer victim = target;
        if (target != actor && isHealthyMayor(gameState, target)) {
            victim = findMayorSubstitute(gameState, actor, target).orElse(target);
            if (victim != target) {
                log.info("[시장] 공격이 다른 플레이어에게 넘어감: mayor={}, victim={}", target.getName(), victim.getName());
            }
        }

        if (isProtectedByMonk(gameState, victim)) {
            return failed(actor, target, false, "monk");
        }
        if (victim.getCharacter() == Character.SOLDIER && !statusResolver.isImpaired(gameState, victim)) {
            return failed(actor, target, false, "soldier");
        }

        deathService.kill(gameState, victim, DeathCause.DEMON);
        gameState.getTokens().place(ReminderToken.IMP_KILLED, victim);

        if (victim == actor && gameState.getPlayers().countAliveOfType(CharacterType.DEMON) == 0) {
            deathService.promoteMinion(gameState, actor);
        }

        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .targetName(target.getName())
                .info("Storyteller: You attacked " + target.getName() + ".")
                .success(true)
                .meta("victim", victim.getName())
                .build();
    }

    private AbilityResult failed(GamePlayer actor, GamePlayer target, boolean impaired, String reason) {
        log.debug("[공격실패] imp={}, target={}, reason={}", actor.getName(), target.getName(), reason);
        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .targetName(target.getName())
                .info("Storyteller: You attacked " + target.getName() + ". Nothing happened.")
                .impaired(impaired)
                .success(false)
                .meta("reason", reason)
                .build();
    }

    private boolean isHealthyMayor(GameState gameState, GamePlayer target) {
        return target.getCharacter() == Character.MAYOR && !statusResolver.isImpaired(gameState, target);
    }

    /**
     * 대신 죽을 플레이어: 대본의 우선순위대로 살아 있는 첫 번째 보유자
     */
    private Optional<GamePlayer> findMayorSubstitute(GameState gameState, GamePlayer imp, GamePlayer mayor) {
        for (Character character : gameState.getScript().deflectionOrder()) {
            Optional<GamePlayer> holder = gameState.getPlayers().findByCharacter(character)
                    .filter(GamePlayer::isAlive)
                    .filter(player -> player != imp && player != mayor);
            if (holder.isPresent()) {
                return holder;
            }
        }
        return Optional.empty();
    }

    private boolean isProtectedByMonk(GameState gameState, GamePlayer victim) {
        if (!gameState.getTokens().marks(ReminderToken.MONK_PROTECTED, victim)) {
            return false;
        }
        return gameState.getPlayers().findActing(Character.MONK)
                .filter(GamePlayer::isAlive)
                .filter(monk -> !statusResolver.isImpaired(gameState, monk))
                .isPresent();
    }
}
