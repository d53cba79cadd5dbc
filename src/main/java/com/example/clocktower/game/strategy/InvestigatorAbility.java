package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.service.StatusResolver;
import org.springframework.stereotype.Component;

/**
 * 인베스티게이터: 두 명 중 한 명의 Minion 을 알게 된다
 */
@Component
public class InvestigatorAbility extends PairRevealAbility {

    public InvestigatorAbility(StatusResolver statusResolver, AbilitySupport support) {
        super(statusResolver, support, CharacterType.MINION,
                ReminderToken.INVESTIGATOR_MINION, ReminderToken.INVESTIGATOR_OTHER);
    }

    @Override
    public Character getCharacter() {
        return Character.INVESTIGATOR;
    }
}
