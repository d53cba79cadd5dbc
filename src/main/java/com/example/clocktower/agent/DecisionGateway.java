package com.example.clocktower.agent;

import com.example.clocktower.event.EventType;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.global.error.DecisionFailedException;
import com.example.clocktower.global.error.ErrorCode;
import com.example.clocktower.global.error.InvalidDecisionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 의사결정 제공자 호출 창구
 * - 응답에 포함된 모든 이름을 명단과 대조해 검증
 * - 잘못된 응답은 RetryTemplate 으로 같은 플레이어에게 다시 요청
 * - 검증이 끝난 응답만 반환하므로 호출자는 상태를 안전하게 변경할 수 있다
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DecisionGateway {

    private final RetryTemplate decisionRetryTemplate;

    // ================= 낮 행동 =================

    /**
     * 낮 행동 요청. 재시도를 모두 소진하면 DecisionFailedException.
     */
    public Decision requestDayAction(GameState gameState, GamePlayer player, Set<DayActionType> availableActions) {
        DecisionRequest request = DecisionRequest.builder()
                .kind(DecisionKind.DAY_ACTION)
                .self(DecisionRequest.PlayerView.of(player))
                .publicState(PublicGameState.from(gameState))
                .prompt("It is your turn to either take an action or pass. What do you want to do?")
                .availableActions(availableActions)
                .candidates(gameState.getPlayers().names())
                .build();

        return decisionRetryTemplate.execute(
                context -> attempt(gameState, player, request, context.getRetryCount(), decision -> {
                    validateDayAction(gameState, decision, availableActions);
                    return decision;
                }),
                context -> {
                    throw new DecisionFailedException(player.getName(), context.getLastThrowable());
                });
    }

    private void validateDayAction(GameState gameState, Decision decision, Set<DayActionType> availableActions) {
        if (decision instanceof Decision.SendMessage message) {
            requireAvailable(availableActions, DayActionType.SEND_MESSAGE);
            if (message.recipients() == null || message.recipients().isEmpty()) {
                throw new InvalidDecisionException(ErrorCode.INVALID_TARGET, "message without recipients");
            }
            message.recipients().forEach(name -> resolve(gameState, name));
        } else if (decision instanceof Decision.Nominate nominate) {
            requireAvailable(availableActions, DayActionType.NOMINATE);
            GamePlayer nominee = resolve(gameState, nominate.nominee());
            if (!nominee.isAlive()) {
                throw new InvalidDecisionException(ErrorCode.INVALID_TARGET, "dead nominee " + nominee.getName());
            }
        } else if (decision instanceof Decision.UseCounterAbility counter) {
            requireAvailable(availableActions, DayActionType.USE_COUNTER_ABILITY);
            resolve(gameState, counter.target());
        } else if (!(decision instanceof Decision.Pass)) {
            throw new InvalidDecisionException(ErrorCode.MALFORMED_DECISION,
                    "unexpected day answer " + describe(decision));
        }
    }

    private void requireAvailable(Set<DayActionType> availableActions, DayActionType type) {
        if (!availableActions.contains(type)) {
            throw new InvalidDecisionException(ErrorCode.ACTION_NOT_ALLOWED, type.name());
        }
    }

    // ================= 투표 =================

    /**
     * 투표 요청. 재시도를 모두 소진하면 반대표로 처리한다.
     */
    public Decision.CastVote requestVote(GameState gameState, GamePlayer voter, DecisionRequest.VoteContext voteContext) {
        DecisionRequest request = DecisionRequest.builder()
                .kind(DecisionKind.VOTE)
                .self(DecisionRequest.PlayerView.of(voter))
                .publicState(PublicGameState.from(gameState))
                .prompt(voter.getName().equals(voteContext.nominee())
                        ? "You are the nominee for execution. Vote YES or NO."
                        : "The nominee for execution is " + voteContext.nominee() + ". Vote YES or NO.")
                .voteContext(voteContext)
                .build();

        return decisionRetryTemplate.execute(
                context -> attempt(gameState, voter, request, context.getRetryCount(), decision -> {
                    if (decision instanceof Decision.CastVote vote) {
                        return vote;
                    }
                    throw new InvalidDecisionException(ErrorCode.MALFORMED_DECISION,
                            "expected a vote but got " + describe(decision));
                }),
                context -> {
                    log.error("[투표] 응답 실패로 반대 처리: voter={}", voter.getName(), context.getLastThrowable());
                    return new Decision.CastVote(false, "no valid answer", "");
                });
    }

    // ================= 밤 대상 선택 =================

    /**
     * 밤 능력 대상 선택. 재시도를 모두 소진하면 빈 값 (그날 밤 능력 건너뜀).
     */
    public Optional<List<GamePlayer>> requestNightTargets(GameState gameState, GamePlayer actor, String prompt,
                                                          int targetCount, Predicate<GamePlayer> allowed) {
        List<String> candidates = gameState.getPlayerList().stream()
                .filter(allowed)
                .map(GamePlayer::getName)
                .collect(Collectors.toList());
        if (candidates.size() < targetCount) {
            log.warn("[밤행동] 선택 가능한 대상 부족: actor={}, candidates={}", actor.getName(), candidates);
            return Optional.empty();
        }

        DecisionRequest request = DecisionRequest.builder()
                .kind(DecisionKind.NIGHT_CHOICE)
                .self(DecisionRequest.PlayerView.of(actor))
                .publicState(PublicGameState.from(gameState))
                .prompt(prompt)
                .candidates(candidates)
                .targetCount(targetCount)
                .build();

        return decisionRetryTemplate.execute(
                context -> attempt(gameState, actor, request, context.getRetryCount(),
                        decision -> Optional.of(validateNightTargets(gameState, decision, targetCount, allowed))),
                context -> {
                    log.error("[밤행동] 대상 선택 실패, 능력 건너뜀: actor={}", actor.getName(),
                            context.getLastThrowable());
                    return Optional.empty();
                });
    }

    private List<GamePlayer> validateNightTargets(GameState gameState, Decision decision, int targetCount,
                                                  Predicate<GamePlayer> allowed) {
        if (!(decision instanceof Decision.ChooseNightTargets choice) || choice.targets() == null) {
            throw new InvalidDecisionException(ErrorCode.MALFORMED_DECISION,
                    "expected night targets but got " + describe(decision));
        }
        if (choice.targets().size() != targetCount) {
            throw new InvalidDecisionException(ErrorCode.INVALID_TARGET,
                    "expected " + targetCount + " targets but got " + choice.targets().size());
        }
        List<GamePlayer> targets = new ArrayList<>();
        Set<GamePlayer> seen = new HashSet<>();
        for (String name : choice.targets()) {
            GamePlayer target = resolve(gameState, name);
            if (!allowed.test(target) || !seen.add(target)) {
                throw new InvalidDecisionException(ErrorCode.INVALID_TARGET, name);
            }
            targets.add(target);
        }
        return targets;
    }

    // ================= 공통 =================

    /**
     * 제공자를 한 번 호출하고 검증한다. 실패는 기록 후 다시 던져 재시도를 유도한다.
     */
    private <T> T attempt(GameState gameState, GamePlayer player, DecisionRequest request, int retryCount,
                          Function<Decision, T> validator) {
        if (retryCount > 0) {
            log.debug("[의사결정] 재요청: player={}, kind={}, retry={}", player.getName(), request.kind(), retryCount);
        }
        try {
            Decision decision = player.getAgent().decide(request);
            if (decision == null) {
                throw new InvalidDecisionException(ErrorCode.MALFORMED_DECISION, "empty answer");
            }
            return validator.apply(decision);
        } catch (RuntimeException e) {
            reportInvalid(gameState, player, request.kind(), e);
            throw e;
        }
    }

    private GamePlayer resolve(GameState gameState, String name) {
        GamePlayer player = gameState.findPlayer(name);
        if (player == null) {
            throw new InvalidDecisionException(ErrorCode.UNKNOWN_PLAYER, String.valueOf(name));
        }
        return player;
    }

    /**
     * 잘못된 응답을 로그와 이벤트로 남기고 해당 플레이어에게 알린다.
     */
    public void reportInvalid(GameState gameState, GamePlayer player, DecisionKind kind, RuntimeException e) {
        log.warn("[의사결정] 잘못된 응답: player={}, kind={}, reason={}", player.getName(), kind, e.getMessage());
        player.giveInfo("Storyteller: your last answer was invalid (" + e.getMessage() + "). Please try again.");
        gameState.record(EventType.INVALID_ACTION, player.getName() + " gave an invalid answer: " + e.getMessage(),
                List.of(player.getName()), Map.of("kind", kind.name()));
    }

    private String describe(Decision decision) {
        return decision == null ? "nothing" : decision.getClass().getSimpleName();
    }
}
