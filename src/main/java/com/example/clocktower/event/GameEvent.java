package com.example.clocktower.event;

import com.example.clocktower.game.domain.Phase;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 이벤트 로그 한 줄
 */
public record GameEvent(
        LocalDateTime timestamp,
        int roundNumber,
        Phase phase,
        EventType eventType,
        String description,
        List<String> participants,
        Map<String, Object> metadata) {
}
