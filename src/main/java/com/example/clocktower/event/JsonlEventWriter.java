package com.example.clocktower.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 이벤트를 JSON Lines 파일로 즉시 기록한다. 재개(checkpoint)는 외부 도구가 이 파일을 읽어 처리한다.
 */
@Slf4j
public class JsonlEventWriter implements AutoCloseable {

    private final ObjectMapper objectMapper;
    private final BufferedWriter writer;
    private final Path path;

    public JsonlEventWriter(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("이벤트 로그 파일을 열 수 없습니다: " + path, e);
        }
        log.info("[이벤트로그] 기록 파일: {}", path);
    }

    public void write(GameEvent event) {
        try {
            writer.write(objectMapper.writeValueAsString(event));
            writer.newLine();
            writer.flush();
        } catch (JsonProcessingException e) {
            log.error("[이벤트로그] 직렬화 실패: type={}", event.eventType(), e);
        } catch (IOException e) {
            log.error("[이벤트로그] 쓰기 실패: path={}", path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("[이벤트로그] 파일 닫기 실패: path={}", path, e);
        }
    }
}
