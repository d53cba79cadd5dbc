package com.example.clocktower.game.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 중독 관계 그래프: 대상 -> 대상을 중독시키고 있는 플레이어 집합
 */
public class PoisonGraph {

    private final Map<GamePlayer, Set<GamePlayer>> poisonedBy = new LinkedHashMap<>();

    public void addPoisoner(GamePlayer target, GamePlayer poisoner) {
        poisonedBy.computeIfAbsent(target, key -> new LinkedHashSet<>()).add(poisoner);
    }

    /**
     * 중독자는 한 번에 한 명만 중독시킬 수 있으므로 기존 관계를 모두 제거한다.
     */
    public void removePoisoner(GamePlayer poisoner) {
        poisonedBy.values().forEach(poisoners -> poisoners.remove(poisoner));
        poisonedBy.values().removeIf(Set::isEmpty);
    }

    public Set<GamePlayer> getPoisoners(GamePlayer target) {
        return Collections.unmodifiableSet(poisonedBy.getOrDefault(target, Set.of()));
    }

    public Map<GamePlayer, Set<GamePlayer>> asMap() {
        return Collections.unmodifiableMap(poisonedBy);
    }
}
