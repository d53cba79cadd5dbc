package com.example.clocktower.game.controller;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.GameSetup;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.Scripts;
import com.example.clocktower.game.dto.request.CreateGameRequest;
import com.example.clocktower.game.dto.response.GameResultResponse;
import com.example.clocktower.game.service.GameService;
import com.example.clocktower.global.dto.CommonResponse;
import com.example.clocktower.global.error.ErrorCode;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
public class GameController {

    // 인원 수를 생략하면 5인 게임 (Townsfolk 3, Minion 1, Demon 1)
    private static final int DEFAULT_TOWNSFOLK = 3;
    private static final int DEFAULT_OUTSIDERS = 0;
    private static final int DEFAULT_MINIONS = 1;

    private final GameService gameService;

    /**
     * 설정된 에이전트로 게임 한 판을 끝까지 진행하고 결과를 반환한다.
     */
    @PostMapping
    public ResponseEntity<CommonResponse<GameResultResponse>> playGame(@Valid @RequestBody CreateGameRequest request) {
        GameSetup setup = toSetup(request);
        GameState gameState = gameService.playGame(setup, request.maxRounds());
        log.info("[API] 게임 완료: gameId={}, outcome={}", gameState.getGameId(), gameState.getOutcome());
        return ResponseEntity.ok(CommonResponse.success(GameResultResponse.from(gameState), "게임이 종료되었습니다."));
    }

    private GameSetup toSetup(CreateGameRequest request) {
        if (request.characters() != null) {
            List<Character> characters = new ArrayList<>();
            for (String name : request.characters()) {
                Character character = Character.fromName(name);
                if (character == null) {
                    throw ErrorCode.UNKNOWN_CHARACTER.commonException(name);
                }
                characters.add(character);
            }
            return GameSetup.of(Scripts.TROUBLE_BREWING, characters, request.seed());
        }
        return GameSetup.ofCounts(Scripts.TROUBLE_BREWING,
                orDefault(request.townsfolk(), DEFAULT_TOWNSFOLK),
                orDefault(request.outsiders(), DEFAULT_OUTSIDERS),
                orDefault(request.minions(), DEFAULT_MINIONS),
                request.seed());
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }
}
