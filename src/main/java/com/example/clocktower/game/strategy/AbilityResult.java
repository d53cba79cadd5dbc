package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * 밤 능력 결과 DTO
 */
@Getter
@Builder
public class AbilityResult {
    private final Character character;
    private final String actorName;
    @Singular
    private final List<String> targetNames;
    private final String info; // 본인에게만 전달할 정보, null 이면 아무것도 전달하지 않음
    private final boolean impaired;
    private final boolean success;
    @Singular("meta")
    private final Map<String, Object> metadata;

    /**
     * 깨어날 조건이 안 되어 아무 출력도 없는 경우 (언더테이커, 레이븐키퍼)
     */
    public static AbilityResult silent(Character character, String actorName) {
        return AbilityResult.builder()
                .character(character)
                .actorName(actorName)
                .success(false)
                .build();
    }

    public boolean hasInfo() {
        return info != null;
    }
}
