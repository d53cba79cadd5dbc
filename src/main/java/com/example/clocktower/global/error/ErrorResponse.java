package com.example.clocktower.global.error;

import lombok.Builder;

@Builder
public record ErrorResponse(String code, String message) {
}
