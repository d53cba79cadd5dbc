package com.example.clocktower.global.error;

/**
 * 의사결정 제공자의 응답이 형식 오류이거나 존재하지 않는 플레이어를 가리킬 때. 재시도 대상이다.
 */
public class InvalidDecisionException extends CommonException {

    public InvalidDecisionException(ErrorCode errorCode, String detail) {
        super(errorCode, detail);
    }

    public InvalidDecisionException(ErrorCode errorCode, String detail, Throwable cause) {
        super(errorCode, detail, cause);
    }
}
