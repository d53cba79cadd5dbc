package com.example.clocktower.game.service;

public enum DeathCause {
    DEMON,     // 밤의 Imp 공격
    EXECUTION, // 처형 (처형대, 버진 능력)
    SLAYER     // 슬레이어 능력
}
