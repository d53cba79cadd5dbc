package com.example.clocktower.game.domain;

/**
 * 리마인더 토큰의 유지 범위
 */
public enum TokenScope {
    NIGHT,          // 다음 낮이 시작될 때 제거
    UNTIL_CONSUMED, // 해당 능력이 한 번 사용할 때까지 유지
    GAME            // 게임 종료까지 유지
}
