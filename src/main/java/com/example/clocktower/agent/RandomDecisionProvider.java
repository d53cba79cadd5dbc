package com.example.clocktower.agent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 시드가 고정된 무작위 플레이어. 항상 유효한 응답만 만든다.
 */
public class RandomDecisionProvider implements DecisionProvider {

    private final Random random;

    public RandomDecisionProvider(Random random) {
        this.random = random;
    }

    @Override
    public Decision decide(DecisionRequest request) {
        return switch (request.kind()) {
            case DAY_ACTION -> dayAction(request);
            case VOTE -> new Decision.CastVote(random.nextBoolean(), "coin flip", "");
            case NIGHT_CHOICE -> new Decision.ChooseNightTargets(
                    pick(request.candidates(), request.targetCount(), request.self().name()), "random choice");
        };
    }

    private Decision dayAction(DecisionRequest request) {
        List<String> others = new ArrayList<>(request.candidates());
        others.remove(request.self().name());
        int roll = random.nextInt(10);

        if (roll < 2 && request.availableActions().contains(DayActionType.NOMINATE)) {
            List<String> nominees = request.publicState().players().stream()
                    .filter(PublicGameState.PublicPlayer::alive)
                    .map(PublicGameState.PublicPlayer::name)
                    .filter(name -> !name.equals(request.self().name()))
                    .toList();
            if (!nominees.isEmpty()) {
                String nominee = nominees.get(random.nextInt(nominees.size()));
                return new Decision.Nominate(nominee, "random nomination", "I have a bad feeling about " + nominee);
            }
        }
        if (roll == 2 && request.availableActions().contains(DayActionType.USE_COUNTER_ABILITY) && !others.isEmpty()) {
            String target = others.get(random.nextInt(others.size()));
            return new Decision.UseCounterAbility(target, "random shot", "I claim Slayer");
        }
        if (roll < 6 && request.availableActions().contains(DayActionType.SEND_MESSAGE) && !others.isEmpty()) {
            String recipient = others.get(random.nextInt(others.size()));
            return new Decision.SendMessage(List.of(recipient),
                    "I am the " + request.self().character().getDisplayName() + ".");
        }
        return new Decision.Pass("nothing to do");
    }

    private List<String> pick(List<String> candidates, int count, String self) {
        List<String> pool = new ArrayList<>(candidates);
        // 자기 자신은 가능하면 피한다
        if (pool.size() > count) {
            pool.remove(self);
        }
        Collections.shuffle(pool, random);
        return pool.subList(0, Math.min(count, pool.size()));
    }
}
