package com.example.clocktower.global.error;

/**
 * 재시도를 모두 소진한 경우. 낮 페이즈는 이 예외를 받으면 즉시 종료된다.
 */
public class DecisionFailedException extends CommonException {

    public DecisionFailedException(String playerName, Throwable cause) {
        super(ErrorCode.DECISION_FAILED, playerName, cause);
    }
}
