package com.example.clocktower.game.service;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.Script;
import com.example.clocktower.global.error.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 게임 준비 검증. 위반은 설정 오류이므로 보정하지 않고 예외로 중단한다.
 */
@Component
public class GameValidator {

    static final int MAX_PLAYERS = 15;

    public void validateCounts(Script script, int townsfolk, int outsiders, int minions) {
        if (townsfolk < 0 || outsiders < 0 || minions < 0) {
            throw ErrorCode.INVALID_CHARACTER_COUNT.commonException("counts must not be negative");
        }
        requireAvailable(script, CharacterType.TOWNSFOLK, townsfolk);
        requireAvailable(script, CharacterType.OUTSIDER, outsiders);
        requireAvailable(script, CharacterType.MINION, minions);
    }

    public void validateCharacters(Script script, List<Character> characters) {
        if (characters == null || characters.isEmpty() || characters.size() > MAX_PLAYERS) {
            throw ErrorCode.INVALID_PLAYER_COUNT.commonException(
                    "between 1 and " + MAX_PLAYERS + " players are required");
        }

        Set<Character> seen = EnumSet.noneOf(Character.class);
        for (Character character : characters) {
            if (character == null) {
                throw ErrorCode.UNKNOWN_CHARACTER.commonException();
            }
            if (!script.contains(character)) {
                throw ErrorCode.CHARACTER_NOT_IN_SCRIPT.commonException(character.getDisplayName());
            }
            if (!seen.add(character)) {
                throw ErrorCode.DUPLICATE_CHARACTER.commonException(character.getDisplayName());
            }
        }

        long demons = characters.stream().filter(character -> character.is(CharacterType.DEMON)).count();
        if (demons == 0) {
            throw ErrorCode.NO_DEMON.commonException();
        }
        if (demons > 1) {
            throw ErrorCode.TOO_MANY_DEMONS.commonException(demons + " demons");
        }
    }

    private void requireAvailable(Script script, CharacterType type, int count) {
        int available = script.charactersOf(type).size();
        if (count > available) {
            throw ErrorCode.INVALID_CHARACTER_COUNT.commonException(
                    count + " " + type.getDisplayName() + " requested but the script has " + available);
        }
    }
}
