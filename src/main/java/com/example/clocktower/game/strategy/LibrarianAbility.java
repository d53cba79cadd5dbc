package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.service.StatusResolver;
import org.springframework.stereotype.Component;

/**
 * 라이브러리언: 두 명 중 한 명의 Outsider 를 알게 된다 (없으면 0명이라고 듣는다)
 */
@Component
public class LibrarianAbility extends PairRevealAbility {

    public LibrarianAbility(StatusResolver statusResolver, AbilitySupport support) {
        super(statusResolver, support, CharacterType.OUTSIDER,
                ReminderToken.LIBRARIAN_OUTSIDER, ReminderToken.LIBRARIAN_OTHER);
    }

    @Override
    public Character getCharacter() {
        return Character.LIBRARIAN;
    }
}
