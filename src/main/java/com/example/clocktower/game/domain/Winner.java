package com.example.clocktower.game.domain;

/**
 * 승리 조건 판정 결과
 */
public enum Winner {
    GOOD,
    EVIL,
    NONE;

    public boolean isDecided() {
        return this != NONE;
    }
}
