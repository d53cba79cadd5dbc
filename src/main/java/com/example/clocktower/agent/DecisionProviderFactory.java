package com.example.clocktower.agent;

import com.example.clocktower.global.client.GeminiApiClient;
import com.example.clocktower.global.config.GameProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * 설정된 에이전트 종류에 따라 플레이어별 의사결정 제공자를 만든다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DecisionProviderFactory {

    private final GameProperties gameProperties;
    private final GeminiApiClient geminiApiClient;
    private final ObjectMapper objectMapper;

    /**
     * @param random 게임의 난수원. 무작위 플레이어의 시드를 여기서 뽑아 재현성을 유지한다.
     */
    public DecisionProvider create(Random random) {
        return switch (gameProperties.getAgent().getType()) {
            case RANDOM -> new RandomDecisionProvider(new Random(random.nextLong()));
            case GEMINI -> {
                if (!geminiApiClient.isConfigured()) {
                    log.warn("Gemini API Key is missing. Falling back to random players.");
                    yield new RandomDecisionProvider(new Random(random.nextLong()));
                }
                yield new GeminiDecisionProvider(geminiApiClient, objectMapper);
            }
        };
    }
}
