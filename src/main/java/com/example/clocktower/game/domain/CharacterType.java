package com.example.clocktower.game.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 캐릭터 분류. 기본 진영은 분류에서 결정된다.
 */
@Getter
@RequiredArgsConstructor
public enum CharacterType {
    TOWNSFOLK("Townsfolk", Alignment.GOOD),
    OUTSIDER("Outsider", Alignment.GOOD),
    MINION("Minion", Alignment.EVIL),
    DEMON("Demon", Alignment.EVIL);

    private final String displayName;
    private final Alignment alignment;
}
