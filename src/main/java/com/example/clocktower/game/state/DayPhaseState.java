package com.example.clocktower.game.state;

import com.example.clocktower.agent.DayActionType;
import com.example.clocktower.agent.Decision;
import com.example.clocktower.agent.DecisionGateway;
import com.example.clocktower.event.EventType;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.ChoppingBlock;
import com.example.clocktower.game.domain.GameOutcome;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.Phase;
import com.example.clocktower.game.domain.TokenScope;
import com.example.clocktower.game.service.DeathService;
import com.example.clocktower.game.service.NominationService;
import com.example.clocktower.game.service.SlayerService;
import com.example.clocktower.game.service.StatusResolver;
import com.example.clocktower.game.service.WinConditionEvaluator;
import com.example.clocktower.global.config.GameProperties;
import com.example.clocktower.global.error.DecisionFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 낮 페이즈 상태
 * - 정해진 횟수만큼 모든 플레이어에게 행동을 한 번씩 묻는다 (사망자는 메시지/패스만)
 * - 중간 라운드부터 지명 허용
 * - 낮이 끝나면 처형대의 플레이어를 처형하거나 시장 승리를 확인한다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DayPhaseState implements GamePhaseState {

    private final GameProperties gameProperties;
    private final DecisionGateway decisionGateway;
    private final NominationService nominationService;
    private final SlayerService slayerService;
    private final DeathService deathService;
    private final StatusResolver statusResolver;
    private final WinConditionEvaluator winConditionEvaluator;

    private enum TurnOutcome {
        PASSED,
        ACTED,
        DAY_ENDED
    }

    @Override
    public void process(GameState gameState) {
        startDay(gameState);

        GameProperties.Day config = gameProperties.getDay();
        boolean dayOver = false;
        for (int round = 1; round <= config.getActionRounds() && !dayOver; round++) {
            if (round == config.getNominationsOpenRound()) {
                gameState.setNominationsOpen(true);
                gameState.broadcast("Storyteller: Nominations are now open.");
            }

            List<GamePlayer> order = new ArrayList<>(gameState.getPlayerList());
            Collections.shuffle(order, gameState.getRandom());

            boolean everyonePassed = true;
            for (GamePlayer player : order) {
                TurnOutcome outcome = takeTurn(gameState, player);
                if (gameState.isOver()) {
                    return;
                }
                if (outcome == TurnOutcome.DAY_ENDED) {
                    dayOver = true;
                    break;
                }
                if (outcome == TurnOutcome.ACTED && player.isAlive()) {
                    everyonePassed = false;
                }
                if (gameState.isNominationsOpen() && noProductiveNominationLeft(gameState)) {
                    log.info("[낮] 더 이상 의미 있는 지명이 불가능하여 낮 종료");
                    dayOver = true;
                    break;
                }
            }

            if (!dayOver && round > 1 && everyonePassed) {
                log.info("[낮] 생존자 전원 패스로 낮 종료: round={}", round);
                dayOver = true;
            }
        }

        endDay(gameState);
    }

    private void startDay(GameState gameState) {
        gameState.setPhase(Phase.DAY);
        gameState.getTokens().clearScope(TokenScope.NIGHT);
        gameState.setNominationsOpen(false);
        gameState.setExecutedToday(false);
        gameState.clearChoppingBlock();
        int messagesPerDay = gameProperties.getDay().getMessagesPerDay();
        gameState.getPlayerList().forEach(player -> player.startOfDay(messagesPerDay));

        gameState.record(EventType.PHASE_CHANGE, "Day " + gameState.getRoundNumber() + " begins", List.of());
        log.info("[낮] gameId={}, round={}, alive={}", gameState.getGameId(), gameState.getRoundNumber(),
                gameState.getPlayers().countAlive());
    }

    private TurnOutcome takeTurn(GameState gameState, GamePlayer player) {
        Set<DayActionType> actions = availableActions(gameState, player);
        Decision decision;
        try {
            decision = decisionGateway.requestDayAction(gameState, player, actions);
        } catch (DecisionFailedException e) {
            log.error("[낮행동] 응답 실패로 낮 종료: player={}", player.getName(), e);
            return TurnOutcome.DAY_ENDED;
        }

        if (decision instanceof Decision.SendMessage message) {
            sendMessage(gameState, player, message);
            return TurnOutcome.ACTED;
        }
        if (decision instanceof Decision.Nominate nominate) {
            boolean endedEarly = nominationService.runNomination(gameState, player,
                    gameState.findPlayer(nominate.nominee()), nominate.publicReasoning());
            if (winConditionEvaluator.applyTo(gameState)) {
                return TurnOutcome.DAY_ENDED;
            }
            return endedEarly ? TurnOutcome.DAY_ENDED : TurnOutcome.ACTED;
        }
        if (decision instanceof Decision.UseCounterAbility counter) {
            slayerService.useSlayerPower(gameState, player, gameState.findPlayer(counter.target()),
                    counter.publicReasoning());
            winConditionEvaluator.applyTo(gameState);
            return TurnOutcome.ACTED;
        }

        gameState.record(EventType.PLAYER_PASS, player.getName() + " passed", List.of(player.getName()));
        return TurnOutcome.PASSED;
    }

    private Set<DayActionType> availableActions(GameState gameState, GamePlayer player) {
        Set<DayActionType> actions = EnumSet.of(DayActionType.PASS);
        if (player.getMessagesLeft() > 0) {
            actions.add(DayActionType.SEND_MESSAGE);
        }
        if (player.isAlive()) {
            if (gameState.isNominationsOpen() && !player.isUsedNomination()) {
                actions.add(DayActionType.NOMINATE);
            }
            if (!player.isUsedCounterAbility()) {
                actions.add(DayActionType.USE_COUNTER_ABILITY);
            }
        }
        return actions;
    }

    private void sendMessage(GameState gameState, GamePlayer sender, Decision.SendMessage message) {
        List<GamePlayer> recipients = message.recipients().stream()
                .map(gameState::findPlayer)
                .distinct()
                .collect(Collectors.toList());
        String recipientNames = recipients.stream().map(GamePlayer::getName).collect(Collectors.joining(", "));
        String text = "Message from " + sender.getName() + " to " + recipientNames + ": " + message.text();

        recipients.forEach(recipient -> gameState.tellPrivately(recipient, text));
        if (!recipients.contains(sender)) {
            gameState.tellPrivately(sender, text);
        }
        sender.setMessagesLeft(sender.getMessagesLeft() - 1);

        List<String> participants = new ArrayList<>();
        participants.add(sender.getName());
        recipients.stream().map(GamePlayer::getName).forEach(participants::add);
        gameState.record(EventType.MESSAGE, text, participants);
    }

    /**
     * 조기 종료 조건
     * - 지명할 수 있는 생존자 쌍이 없음 (악끼리는 서로 지명하지 않는다고 본다)
     * - 남은 투표 가능 인원으로 처형대를 넘기거나 동률을 만들 수 없음
     */
    boolean noProductiveNominationLeft(GameState gameState) {
        List<GamePlayer> alive = gameState.getPlayers().findAllAlivePlayers();
        boolean pairExists = alive.stream()
                .filter(nominator -> !nominator.isUsedNomination())
                .anyMatch(nominator -> alive.stream()
                        .filter(nominee -> nominee != nominator && !nominee.isNominatedToday())
                        .anyMatch(nominee -> !(nominator.isEvil() && nominee.isEvil())));
        if (!pairExists) {
            return true;
        }

        ChoppingBlock block = gameState.getChoppingBlock();
        if (block == null) {
            return false;
        }
        long eligibleVoters = gameState.getPlayerList().stream().filter(GamePlayer::canVoteYes).count();
        return eligibleVoters < block.voteCount();
    }

    private void endDay(GameState gameState) {
        ChoppingBlock block = gameState.getChoppingBlock();
        gameState.clearChoppingBlock();
        gameState.setNominationsOpen(false);

        if (gameState.isExecutedToday()) {
            log.info("[처형] 오늘 이미 처형이 있었으므로 처형대와 시장 승리를 확인하지 않음");
            return;
        }

        if (block != null) {
            GamePlayer nominee = block.nominee();
            boolean healthySaint = nominee.getCharacter() == Character.SAINT
                    && !statusResolver.isImpaired(gameState, nominee);
            log.info("[처형] player={}, votes={}", nominee.getName(), block.voteCount());
            deathService.execute(gameState, nominee);

            if (healthySaint) {
                gameState.setOutcome(GameOutcome.EVIL_WINS);
                gameState.broadcast("Storyteller: " + nominee.getName() + " was the Saint. Evil wins!");
                gameState.record(EventType.SAINT_EXECUTED, nominee.getName() + " (Saint) was executed",
                        List.of(nominee.getName()));
                return;
            }
            winConditionEvaluator.applyTo(gameState);
            return;
        }

        if (gameState.getPlayers().countAlive() == 3 && healthyMayorAlive(gameState)) {
            gameState.setOutcome(GameOutcome.GOOD_WINS);
            gameState.broadcast("Storyteller: Only three players remain and no one was executed. "
                    + "The Mayor wins the game for the good team!");
            gameState.record(EventType.MAYOR_WIN, "Mayor win with three players alive and no execution",
                    gameState.getPlayers().findAllAlivePlayers().stream()
                            .map(GamePlayer::getName).collect(Collectors.toList()),
                    Map.of("alive", 3));
            log.info("[시장] 선 승리");
        }
    }

    private boolean healthyMayorAlive(GameState gameState) {
        return gameState.getPlayers().findByCharacter(Character.MAYOR)
                .filter(GamePlayer::isAlive)
                .filter(mayor -> !statusResolver.isImpaired(gameState, mayor))
                .isPresent();
    }

    @Override
    public Phase nextPhase() {
        return Phase.NIGHT;
    }

    @Override
    public Phase getPhase() {
        return Phase.DAY;
    }
}
