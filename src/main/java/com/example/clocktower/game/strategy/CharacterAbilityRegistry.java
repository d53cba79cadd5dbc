package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 캐릭터별 전략을 제공하는 Registry
 */
@Component
public class CharacterAbilityRegistry {

    private final Map<Character, CharacterAbility> abilities = new EnumMap<>(Character.class);

    public CharacterAbilityRegistry(List<CharacterAbility> abilityList) {
        for (CharacterAbility ability : abilityList) {
            CharacterAbility previous = abilities.put(ability.getCharacter(), ability);
            if (previous != null) {
                throw new IllegalStateException("Duplicate ability handler for " + ability.getCharacter());
            }
        }
    }

    /**
     * 캐릭터에 맞는 전략 반환 (밤 능력이 없으면 빈 값)
     */
    public Optional<CharacterAbility> find(Character character) {
        return Optional.ofNullable(abilities.get(character));
    }

    public Map<Character, CharacterAbility> asMap() {
        return Collections.unmodifiableMap(abilities);
    }
}
