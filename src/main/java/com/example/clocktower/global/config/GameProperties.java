package com.example.clocktower.global.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * clocktower.* 설정 값
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "clocktower")
public class GameProperties {

    private int maxRounds = 6;

    // null 이면 매 게임마다 새 시드 사용
    private Long randomSeed;

    private Day day = new Day();

    private Decision decision = new Decision();

    private Agent agent = new Agent();

    private EventLog eventLog = new EventLog();

    @Getter
    @Setter
    public static class Day {
        private int actionRounds = 4;
        // 1부터 시작하는 라운드 번호
        private int nominationsOpenRound = 3;
        private int messagesPerDay = 2;
    }

    @Getter
    @Setter
    public static class Decision {
        // 최초 시도 + 재시도 2회
        private int maxAttempts = 3;
    }

    @Getter
    @Setter
    public static class Agent {
        private AgentType type = AgentType.RANDOM;
    }

    @Getter
    @Setter
    public static class EventLog {
        private boolean enabled = false;
        private String directory = "logs";
    }

    public enum AgentType {
        RANDOM,
        GEMINI
    }
}
