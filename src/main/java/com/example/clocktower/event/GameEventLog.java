package com.example.clocktower.event;

import com.example.clocktower.game.domain.Phase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 게임 한 판의 이벤트 기록. 엔진 입장에서는 쓰기 전용이다.
 */
@Slf4j
@RequiredArgsConstructor
public class GameEventLog implements AutoCloseable {

    private final List<GameEvent> events = new ArrayList<>();
    private final JsonlEventWriter writer;
    private final Clock clock;

    public static GameEventLog inMemory() {
        return new GameEventLog(null, Clock.systemDefaultZone());
    }

    public void add(EventType type, String description, int roundNumber, Phase phase,
                    List<String> participants, Map<String, Object> metadata) {
        GameEvent event = new GameEvent(
                LocalDateTime.now(clock),
                roundNumber,
                phase,
                type,
                description,
                participants == null ? List.of() : List.copyOf(participants),
                metadata == null ? Map.of() : Map.copyOf(metadata));
        events.add(event);
        log.info("[{}][R{} {}] {}", type.getValue(), roundNumber, phase, description);
        if (writer != null) {
            writer.write(event);
        }
    }

    public List<GameEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<GameEvent> getEventsByType(EventType type) {
        return events.stream()
                .filter(event -> event.eventType() == type)
                .collect(Collectors.toList());
    }

    public List<GameEvent> getEventsByRound(int roundNumber) {
        return events.stream()
                .filter(event -> event.roundNumber() == roundNumber)
                .collect(Collectors.toList());
    }

    /**
     * 게임 요약 통계 (사망, 처형, 지명)
     */
    public GameStatistics getStatistics() {
        Map<EventType, Long> byType = events.stream()
                .collect(Collectors.groupingBy(GameEvent::eventType, Collectors.counting()));
        int totalRounds = events.stream().mapToInt(GameEvent::roundNumber).max().orElse(0);
        return new GameStatistics(
                events.size(),
                totalRounds,
                byType,
                firstParticipants(EventType.PLAYER_DEATH),
                firstParticipants(EventType.EXECUTION),
                getEventsByType(EventType.NOMINATION).stream()
                        .filter(event -> event.participants().size() >= 2)
                        .map(event -> event.participants().get(0) + " -> " + event.participants().get(1))
                        .collect(Collectors.toList()));
    }

    private List<String> firstParticipants(EventType type) {
        return getEventsByType(type).stream()
                .map(event -> event.participants().isEmpty() ? "Unknown" : event.participants().get(0))
                .collect(Collectors.toList());
    }

    @Override
    public void close() {
        if (writer != null) {
            writer.close();
        }
    }
}
