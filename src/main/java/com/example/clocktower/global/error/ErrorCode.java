package com.example.clocktower.global.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    // 게임 준비 (설정 오류, 치명적)
    NO_DEMON(HttpStatus.BAD_REQUEST, "NO_DEMON", "Exactly one Demon must be in play"),
    TOO_MANY_DEMONS(HttpStatus.BAD_REQUEST, "TOO_MANY_DEMONS", "Only one Demon may be in play"),
    INVALID_PLAYER_COUNT(HttpStatus.BAD_REQUEST, "INVALID_PLAYER_COUNT", "Player count is out of range"),
    INVALID_CHARACTER_COUNT(HttpStatus.BAD_REQUEST, "INVALID_CHARACTER_COUNT", "Malformed character counts"),
    DUPLICATE_CHARACTER(HttpStatus.BAD_REQUEST, "DUPLICATE_CHARACTER", "A character may only be in play once"),
    CHARACTER_NOT_IN_SCRIPT(HttpStatus.BAD_REQUEST, "CHARACTER_NOT_IN_SCRIPT", "Character is not part of the script"),
    UNKNOWN_CHARACTER(HttpStatus.BAD_REQUEST, "UNKNOWN_CHARACTER", "Unknown character name"),

    // 의사결정 제공자 응답 검증
    UNKNOWN_PLAYER(HttpStatus.BAD_REQUEST, "UNKNOWN_PLAYER", "Referenced player does not exist"),
    INVALID_TARGET(HttpStatus.BAD_REQUEST, "INVALID_TARGET", "Target is not allowed for this action"),
    ACTION_NOT_ALLOWED(HttpStatus.BAD_REQUEST, "ACTION_NOT_ALLOWED", "Action is not available right now"),
    MALFORMED_DECISION(HttpStatus.BAD_REQUEST, "MALFORMED_DECISION", "Decision provider returned an unparseable answer"),
    DECISION_FAILED(HttpStatus.SERVICE_UNAVAILABLE, "DECISION_FAILED", "Decision provider failed after retries"),
    ;
    private final String code;
    private final String message;
    private final HttpStatus status;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.message = message;
        this.code = code;
    }

    public CommonException commonException() {return new CommonException(this);}

    public CommonException commonException(String detail) {return new CommonException(this, detail);}
}
