package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.service.StatusResolver;
import org.springframework.stereotype.Component;

/**
 * 워셔우먼: 두 명 중 한 명의 Townsfolk 를 알게 된다
 */
@Component
public class WasherwomanAbility extends PairRevealAbility {

    public WasherwomanAbility(StatusResolver statusResolver, AbilitySupport support) {
        super(statusResolver, support, CharacterType.TOWNSFOLK,
                ReminderToken.WASHERWOMAN_TOWNSFOLK, ReminderToken.WASHERWOMAN_OTHER);
    }

    @Override
    public Character getCharacter() {
        return Character.WASHERWOMAN;
    }
}
