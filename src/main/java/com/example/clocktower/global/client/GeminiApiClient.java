package com.example.clocktower.global.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Gemini generateContent 호출. LLM 플레이어가 사용한다.
 */
@Component
@Slf4j
public class GeminiApiClient {

    @Value("${gemini.api-key:}")
    private String apiKey;

    @Value("${gemini.url:https://generativelanguage.googleapis.com/v1beta/models/gemini-2.5-flash:generateContent}")
    private String apiUrl;

    private final RestClient restClient = RestClient.create();

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * JSON 응답을 요청한다.
     * 연결 오류만 여기서 재시도하고, 그 외 실패는 그대로 던져 호출자의 재시도 정책에 맡긴다.
     */
    @Retryable(retryFor = ResourceAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 500, multiplier = 2))
    public String generateJson(String prompt) {
        if (!isConfigured()) {
            throw new IllegalStateException("Gemini API Key is missing. Please set 'gemini.api-key'.");
        }

        GeminiRequest request = new GeminiRequest(
                List.of(new GeminiContent(List.of(new GeminiPart(prompt)))),
                new GenerationConfig("application/json"));

        GeminiResponse response = restClient.post()
                .uri(apiUrl + "?key=" + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(GeminiResponse.class);

        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            log.warn("Gemini API returned empty response: {}", response);
            return null;
        }
        return response.candidates().get(0).content().parts().get(0).text();
    }

    // DTOs
    public record GeminiRequest(List<GeminiContent> contents, GenerationConfig generationConfig) {
    }

    public record GenerationConfig(String responseMimeType) {
    }

    public record GeminiContent(List<GeminiPart> parts) {
    }

    public record GeminiPart(String text) {
    }

    public record GeminiResponse(List<Candidate> candidates) {
    }

    public record Candidate(GeminiContent content) {
    }
}
