package com.example.clocktower.global.dto;

import com.example.clocktower.global.error.ErrorResponse;

/**
 * API 공통 응답. 실패하면 data 에 오류 코드와 상세 메시지가 담긴다.
 */
public record CommonResponse<T>(
        boolean success,
        T data,
        String message
) {
    public static <T> CommonResponse<T> success(T data, String message) {
        return new CommonResponse<>(true, data, message);
    }

    public static CommonResponse<ErrorResponse> failure(ErrorResponse error) {
        return new CommonResponse<>(false, error, error.message());
    }
}
