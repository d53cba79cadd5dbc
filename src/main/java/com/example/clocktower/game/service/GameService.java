package com.example.clocktower.game.service;

import com.example.clocktower.event.EventType;
import com.example.clocktower.game.domain.GameOutcome;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameSetup;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.Phase;
import com.example.clocktower.game.state.GamePhaseFactory;
import com.example.clocktower.game.state.GamePhaseState;
import com.example.clocktower.global.config.GameProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 게임 진행: 밤 → 낮 → (승패 확인) → 밤 ... 최대 라운드까지 반복
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameService {

    private final GameSetupService gameSetupService;
    private final GamePhaseFactory gamePhaseFactory;
    private final WinConditionEvaluator winConditionEvaluator;
    private final GameProperties gameProperties;

    public GameState createGame(GameSetup setup) {
        return gameSetupService.createGame(setup);
    }

    /**
     * 게임 생성부터 종료까지 한 번에 진행한다.
     */
    public GameState playGame(GameSetup setup, Integer maxRounds) {
        GameState gameState = createGame(setup);
        return runGame(gameState, maxRounds != null ? maxRounds : gameProperties.getMaxRounds());
    }

    public GameState runGame(GameState gameState, int maxRounds) {
        gameState.record(EventType.GAME_START, "Game " + gameState.getGameId() + " started",
                gameState.getPlayers().names());
        log.info("[게임시작] gameId={}, maxRounds={}", gameState.getGameId(), maxRounds);

        try {
            while (!gameState.isOver() && gameState.getRoundNumber() <= maxRounds) {
                gameState.record(EventType.ROUND_START, "Round " + gameState.getRoundNumber(), List.of());

                Phase phase = Phase.NIGHT;
                do {
                    GamePhaseState state = gamePhaseFactory.getState(phase);
                    state.process(gameState);
                    winConditionEvaluator.applyTo(gameState);
                    phase = state.nextPhase();
                } while (!gameState.isOver() && phase != Phase.NIGHT);

                if (!gameState.isOver()) {
                    gameState.setRoundNumber(gameState.getRoundNumber() + 1);
                }
            }

            if (!gameState.isOver()) {
                gameState.setOutcome(GameOutcome.MAX_ROUNDS_REACHED);
            }
            finish(gameState);
        } finally {
            gameState.getEventLog().close();
        }
        return gameState;
    }

    private void finish(GameState gameState) {
        GameOutcome outcome = gameState.getOutcome();
        String summary = gameState.getPlayerList().stream()
                .map(player -> player.getName() + "=" + player.getCharacter().getDisplayName()
                        + (player.isAlive() ? "" : "(dead)"))
                .collect(Collectors.joining(", "));

        gameState.broadcast("Storyteller: The game is over. Result: " + outcome + ".");
        gameState.record(EventType.GAME_END, "Game over: " + outcome,
                gameState.getPlayers().names(),
                Map.of("outcome", outcome.name(), "rounds", gameState.getRoundNumber(),
                        "alive", gameState.getPlayers().findAllAlivePlayers().stream()
                                .map(GamePlayer::getName).collect(Collectors.toList())));
        log.info("[게임종료] gameId={}, outcome={}, round={}, players=[{}]",
                gameState.getGameId(), outcome, gameState.getRoundNumber(), summary);
    }
}
