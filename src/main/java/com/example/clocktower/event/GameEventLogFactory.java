package com.example.clocktower.event;

import com.example.clocktower.global.config.GameProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Component
@RequiredArgsConstructor
public class GameEventLogFactory {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final GameProperties gameProperties;
    private final ObjectMapper objectMapper;

    public GameEventLog create(String gameId) {
        GameProperties.EventLog config = gameProperties.getEventLog();
        if (!config.isEnabled()) {
            return GameEventLog.inMemory();
        }
        String fileName = "game_log_" + LocalDateTime.now().format(FILE_TIMESTAMP) + "_" + gameId + ".jsonl";
        Path path = Path.of(config.getDirectory(), fileName);
        return new GameEventLog(new JsonlEventWriter(objectMapper, path), Clock.systemDefaultZone());
    }
}
