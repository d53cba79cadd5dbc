package com.example.clocktower.event;

import java.util.List;
import java.util.Map;

public record GameStatistics(
        int totalEvents,
        int totalRounds,
        Map<EventType, Long> eventsByType,
        List<String> deaths,
        List<String> executions,
        List<String> nominations) {
}
