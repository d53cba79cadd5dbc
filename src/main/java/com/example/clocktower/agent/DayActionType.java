package com.example.clocktower.agent;

public enum DayActionType {
    SEND_MESSAGE,
    NOMINATE,
    USE_COUNTER_ABILITY,
    PASS
}
