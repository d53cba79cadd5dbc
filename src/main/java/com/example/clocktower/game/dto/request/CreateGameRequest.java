package com.example.clocktower.game.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 시뮬레이션 게임 생성 요청. characters 가 없으면 분류별 인원 수로 대본에서 뽑는다.
 */
public record CreateGameRequest(
        @Size(min = 1, max = 15) List<String> characters,
        @Min(0) Integer townsfolk,
        @Min(0) Integer outsiders,
        @Min(0) Integer minions,
        Long seed,
        @Min(1) @Max(20) Integer maxRounds
) {
}
