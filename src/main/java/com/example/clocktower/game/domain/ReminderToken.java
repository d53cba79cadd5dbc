package com.example.clocktower.game.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * (캐릭터, 토큰 종류) 키. 토큰 하나는 대상 플레이어 한 명을 가리킨다.
 */
@Getter
@RequiredArgsConstructor
public enum ReminderToken {
    RED_HERRING(Character.FORTUNE_TELLER, TokenScope.GAME),
    WASHERWOMAN_TOWNSFOLK(Character.WASHERWOMAN, TokenScope.GAME),
    WASHERWOMAN_OTHER(Character.WASHERWOMAN, TokenScope.GAME),
    LIBRARIAN_OUTSIDER(Character.LIBRARIAN, TokenScope.GAME),
    LIBRARIAN_OTHER(Character.LIBRARIAN, TokenScope.GAME),
    INVESTIGATOR_MINION(Character.INVESTIGATOR, TokenScope.GAME),
    INVESTIGATOR_OTHER(Character.INVESTIGATOR, TokenScope.GAME),
    MONK_PROTECTED(Character.MONK, TokenScope.NIGHT),
    IMP_KILLED(Character.IMP, TokenScope.NIGHT),
    RAVENKEEPER_WOKEN(Character.RAVENKEEPER, TokenScope.UNTIL_CONSUMED),
    UNDERTAKER_EXECUTED(Character.UNDERTAKER, TokenScope.UNTIL_CONSUMED),
    BUTLER_MASTER(Character.BUTLER, TokenScope.UNTIL_CONSUMED),
    IS_THE_DRUNK(Character.DRUNK, TokenScope.GAME),
    VIRGIN_POWER_USED(Character.VIRGIN, TokenScope.GAME);

    private final Character character;
    private final TokenScope scope;
}
