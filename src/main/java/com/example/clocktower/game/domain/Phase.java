package com.example.clocktower.game.domain;

public enum Phase {
    SETUP, // 게임 준비
    NIGHT, // 밤 (능력 해결)
    DAY    // 낮 (대화, 지명, 투표)
}
