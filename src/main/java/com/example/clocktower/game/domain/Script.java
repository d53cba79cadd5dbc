package com.example.clocktower.game.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * 게임 변형(스크립트) 정의: 분류별 캐릭터와 밤 능력 해결 순서
 *
 * @param deflectionOrder 시장이 밤에 공격받았을 때 대신 죽을 후보의 우선순위
 */
public record Script(String name,
                     List<Character> townsfolk,
                     List<Character> outsiders,
                     List<Character> minions,
                     List<Character> demons,
                     List<Character> firstNightOrder,
                     List<Character> otherNightOrder,
                     List<Character> deflectionOrder) {

    public List<Character> charactersOf(CharacterType type) {
        return switch (type) {
            case TOWNSFOLK -> townsfolk;
            case OUTSIDER -> outsiders;
            case MINION -> minions;
            case DEMON -> demons;
        };
    }

    public List<Character> allCharacters() {
        List<Character> all = new ArrayList<>();
        all.addAll(townsfolk);
        all.addAll(outsiders);
        all.addAll(minions);
        all.addAll(demons);
        return all;
    }

    public boolean contains(Character character) {
        return charactersOf(character.getType()).contains(character);
    }

    public List<Character> nightOrder(int roundNumber) {
        return roundNumber == 1 ? firstNightOrder : otherNightOrder;
    }
}
