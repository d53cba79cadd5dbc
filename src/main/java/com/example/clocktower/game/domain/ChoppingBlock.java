package com.example.clocktower.game.domain;

/**
 * 처형 대기 자리 (득표 수, 피지명자)
 */
public record ChoppingBlock(int voteCount, GamePlayer nominee) {
}
