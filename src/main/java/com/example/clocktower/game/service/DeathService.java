package com.example.clocktower.game.service;

import com.example.clocktower.event.EventType;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.ReminderToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 사망 처리와 사망에 따른 자동 효과
 * - 처형 시 언더테이커 토큰
 * - 밤 사망 시 레이븐키퍼 토큰
 * - Demon 사망 시 스칼렛 우먼 계승
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeathService {

    // 스칼렛 우먼 계승에 필요한 사망 후 최소 생존자 수
    static final int SCARLET_WOMAN_MIN_ALIVE = 4;

    private final StatusResolver statusResolver;

    /**
     * 플레이어를 사망시킨다. 이미 사망한 경우 아무 일도 없다.
     *
     * @return 실제로 사망 처리되었는지 여부
     */
    public boolean kill(GameState gameState, GamePlayer victim, DeathCause cause) {
        if (!victim.isAlive()) {
            return false;
        }
        victim.setAlive(false);
        log.info("[사망] player={}, character={}, cause={}", victim.getName(), victim.getCharacter(), cause);

        gameState.record(EventType.PLAYER_DEATH, victim.getName() + " has died.", List.of(victim.getName()),
                Map.of("character", victim.getCharacter().name(), "cause", cause.name()));

        // 밤 사망은 아침에 한꺼번에 공개한다
        if (cause != DeathCause.DEMON) {
            gameState.broadcast("Storyteller: " + victim.getName() + " has died.");
        }

        if (cause == DeathCause.DEMON && victim.actsAs(Character.RAVENKEEPER)) {
            gameState.getTokens().place(ReminderToken.RAVENKEEPER_WOKEN, victim);
        }

        scarletWomanCheck(gameState, victim);
        return true;
    }

    /**
     * 처형. 언더테이커가 볼 수 있도록 토큰을 먼저 놓는다.
     */
    public boolean execute(GameState gameState, GamePlayer victim) {
        if (!victim.isAlive()) {
            return false;
        }
        gameState.setExecutedToday(true);
        gameState.getTokens().place(ReminderToken.UNDERTAKER_EXECUTED, victim);
        gameState.record(EventType.EXECUTION, victim.getName() + " has been executed.", List.of(victim.getName()),
                Map.of("character", victim.getCharacter().name()));
        return kill(gameState, victim, DeathCause.EXECUTION);
    }

    /**
     * Demon 이 죽었을 때, 유일한 정상 상태의 스칼렛 우먼이 있고 4명 이상 살아 있으면 새 Demon 이 된다.
     */
    boolean scarletWomanCheck(GameState gameState, GamePlayer deadPlayer) {
        if (deadPlayer.getType() != CharacterType.DEMON) {
            return false;
        }
        List<GamePlayer> scarletWomen = gameState.getPlayerList().stream()
                .filter(GamePlayer::isAlive)
                .filter(player -> player.getCharacter() == Character.SCARLET_WOMAN)
                .filter(player -> !statusResolver.isImpaired(gameState, player))
                .collect(Collectors.toList());

        if (scarletWomen.size() != 1 || gameState.getPlayers().countAlive() < SCARLET_WOMAN_MIN_ALIVE) {
            return false;
        }

        GamePlayer woman = scarletWomen.get(0);
        woman.setCharacter(deadPlayer.getCharacter());
        gameState.tellPrivately(woman, "Storyteller: The Demon has died and you have become the new Demon. "
                + "Your character is now " + woman.getCharacter().getDisplayName() + ".");
        gameState.record(EventType.SCARLET_WOMAN_TRANSFORM,
                woman.getName() + " (Scarlet Woman) became the " + woman.getCharacter().getDisplayName(),
                List.of(woman.getName(), deadPlayer.getName()));
        log.info("[계승] 스칼렛 우먼이 Demon 이 됨: player={}", woman.getName());
        return true;
    }

    /**
     * Imp 가 스스로를 죽였을 때 살아 있는 첫 번째 Minion (좌석 순)이 새 Imp 가 된다.
     */
    public Optional<GamePlayer> promoteMinion(GameState gameState, GamePlayer deadDemon) {
        Optional<GamePlayer> successor = gameState.getPlayerList().stream()
                .filter(GamePlayer::isAlive)
                .filter(player -> player.getType() == CharacterType.MINION)
                .findFirst();

        successor.ifPresent(minion -> {
            Character previous = minion.getCharacter();
            minion.setCharacter(deadDemon.getCharacter());
            // 더 이상 포이즈너로 깨어나지 않으므로 걸어 둔 중독도 여기서 풀린다
            gameState.getPoisonGraph().removePoisoner(minion);
            gameState.tellPrivately(minion, "Storyteller: The Imp has killed themselves and you are the new Imp.");
            gameState.record(EventType.IMP_PROMOTION,
                    minion.getName() + " (" + previous.getDisplayName() + ") became the Imp",
                    List.of(minion.getName(), deadDemon.getName()));
            log.info("[계승] Minion 이 Imp 로 승격: player={}, previous={}", minion.getName(), previous);
        });
        return successor;
    }
}
