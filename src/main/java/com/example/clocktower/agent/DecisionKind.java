package com.example.clocktower.agent;

public enum DecisionKind {
    DAY_ACTION,   // 낮 행동 (메시지, 지명, 슬레이어 능력, 패스)
    VOTE,         // 지명 투표
    NIGHT_CHOICE  // 밤 능력 대상 선택
}
