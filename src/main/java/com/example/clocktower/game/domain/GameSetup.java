package com.example.clocktower.game.domain;

import java.util.List;

/**
 * 게임 준비 입력: 명시적 캐릭터 목록 또는 분류별 인원 수. Demon 은 항상 1명이다.
 *
 * @param characters null 이면 인원 수로 대본에서 무작위 추출
 * @param seed       null 이면 설정의 시드를 사용
 */
public record GameSetup(Script script,
                        List<Character> characters,
                        int townsfolk,
                        int outsiders,
                        int minions,
                        Long seed) {

    public static GameSetup of(Script script, List<Character> characters, Long seed) {
        return new GameSetup(script, List.copyOf(characters), 0, 0, 0, seed);
    }

    public static GameSetup ofCounts(Script script, int townsfolk, int outsiders, int minions, Long seed) {
        return new GameSetup(script, null, townsfolk, outsiders, minions, seed);
    }

    public boolean hasExplicitCharacters() {
        return characters != null;
    }
}
