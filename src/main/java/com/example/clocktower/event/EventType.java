package com.example.clocktower.event;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.RequiredArgsConstructor;

/**
 * 게임 중 발생하는 이벤트 종류
 */
@RequiredArgsConstructor
public enum EventType {
    GAME_START("game_start"),
    GAME_SETUP("game_setup"),
    ROUND_START("round_start"),
    PHASE_CHANGE("phase_change"),
    PLAYER_DEATH("player_death"),
    CHARACTER_POWER("character_power"),
    NOMINATION("nomination"),
    NOMINATION_REJECTED("nomination_rejected"),
    NOMINATION_RESULT("nomination_result"),
    VOTING("voting"),
    EXECUTION("execution"),
    MESSAGE("message"),
    GAME_END("game_end"),
    INFO_BROADCAST("info_broadcast"),
    PLAYER_PASS("player_pass"),
    PLAYER_SETUP("player_setup"),
    STORYTELLER_INFO("storyteller_info"),
    INVALID_ACTION("invalid_action"),
    SLAYER_POWER("slayer_power"),
    VIRGIN_POWER("virgin_power"),
    SCARLET_WOMAN_TRANSFORM("scarlet_woman_transform"),
    IMP_PROMOTION("imp_promotion"),
    MAYOR_WIN("mayor_win"),
    SAINT_EXECUTED("saint_executed");

    private final String value;

    @JsonValue
    public String getValue() {
        return value;
    }
}
