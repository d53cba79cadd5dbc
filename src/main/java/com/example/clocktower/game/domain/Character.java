package com.example.clocktower.game.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Trouble Brewing 캐릭터 목록.
 * 분류(CharacterType)는 타입 계층이 아닌 조회 값이다.
 */
@Getter
@RequiredArgsConstructor
public enum Character {

    // Townsfolk
    WASHERWOMAN("Washerwoman", CharacterType.TOWNSFOLK,
            "Starts knowing that 1 of 2 players is a particular Townsfolk."),
    LIBRARIAN("Librarian", CharacterType.TOWNSFOLK,
            "Starts knowing that 1 of 2 players is a particular Outsider (or that zero are in play)."),
    INVESTIGATOR("Investigator", CharacterType.TOWNSFOLK,
            "Starts knowing that 1 of 2 players is a particular Minion."),
    CHEF("Chef", CharacterType.TOWNSFOLK,
            "Starts knowing how many adjacent pairs of Evil players there are."),
    EMPATH("Empath", CharacterType.TOWNSFOLK,
            "Each night, learns how many of their 2 alive neighbours are Evil."),
    FORTUNE_TELLER("Fortune Teller", CharacterType.TOWNSFOLK,
            "Each night, chooses 2 players and learns if either is a Demon. A good player registers as a Demon."),
    UNDERTAKER("Undertaker", CharacterType.TOWNSFOLK,
            "Each night except the first, learns which character died by execution today."),
    MONK("Monk", CharacterType.TOWNSFOLK,
            "Each night except the first, chooses a player (not themselves) who is safe from the Demon tonight."),
    RAVENKEEPER("Ravenkeeper", CharacterType.TOWNSFOLK,
            "If they die at night, they wake to choose a player and learn their character."),
    VIRGIN("Virgin", CharacterType.TOWNSFOLK,
            "The first time they are nominated, if the nominator is a Townsfolk, the nominator is executed immediately."),
    SLAYER("Slayer", CharacterType.TOWNSFOLK,
            "Once per game, during the day, publicly choose a player: if they are the Demon, they die."),
    SOLDIER("Soldier", CharacterType.TOWNSFOLK,
            "Safe from the Demon."),
    MAYOR("Mayor", CharacterType.TOWNSFOLK,
            "If only 3 players live and no execution occurs, their team wins. If they die at night, another player might die instead."),

    // Outsiders
    BUTLER("Butler", CharacterType.OUTSIDER,
            "Each night, chooses a player (not themselves): tomorrow they may only vote if that player votes yes first."),
    DRUNK("Drunk", CharacterType.OUTSIDER,
            "Does not know they are the Drunk. Thinks they are a Townsfolk character, but their ability does not work."),
    RECLUSE("Recluse", CharacterType.OUTSIDER,
            "Might register as Evil and as a Minion or Demon, even if dead."),
    SAINT("Saint", CharacterType.OUTSIDER,
            "If they die by execution, their team loses."),

    // Minions
    POISONER("Poisoner", CharacterType.MINION,
            "Each night, chooses a player who is poisoned tonight and tomorrow day."),
    SPY("Spy", CharacterType.MINION,
            "Each night, sees the Grimoire. Might register as Good and as a Townsfolk or Outsider."),
    SCARLET_WOMAN("Scarlet Woman", CharacterType.MINION,
            "If there are 5 or more players alive and the Demon dies, becomes the Demon."),
    BARON("Baron", CharacterType.MINION,
            "There are extra Outsiders in play (+2 Outsiders)."),

    // Demon
    IMP("Imp", CharacterType.DEMON,
            "Each night except the first, chooses a player who dies. If they choose themselves, a Minion becomes the Imp.");

    private final String displayName;
    private final CharacterType type;
    private final String ability;

    public Alignment getDefaultAlignment() {
        return type.getAlignment();
    }

    public boolean is(CharacterType characterType) {
        return type == characterType;
    }

    /**
     * 대소문자, 공백, 밑줄을 무시하고 이름으로 캐릭터를 찾는다.
     */
    public static Character fromName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().replace(' ', '_').replace('-', '_').toUpperCase();
        for (Character character : values()) {
            if (character.name().equals(normalized)
                    || character.displayName.equalsIgnoreCase(name.trim())) {
                return character;
            }
        }
        return null;
    }
}
