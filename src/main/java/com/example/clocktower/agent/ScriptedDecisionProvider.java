package com.example.clocktower.agent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 미리 기록된 응답을 순서대로 재생한다. 같은 시드와 함께 쓰면 게임을 그대로 재현할 수 있다.
 * 큐가 비면 낮에는 패스, 투표는 반대, 밤에는 앞쪽 후보를 고른다.
 */
public class ScriptedDecisionProvider implements DecisionProvider {

    private final Deque<Decision> dayActions = new ArrayDeque<>();
    private final Deque<Decision> votes = new ArrayDeque<>();
    private final Deque<Decision> nightChoices = new ArrayDeque<>();

    public ScriptedDecisionProvider onDay(Decision... decisions) {
        dayActions.addAll(List.of(decisions));
        return this;
    }

    public ScriptedDecisionProvider onVote(Decision... decisions) {
        votes.addAll(List.of(decisions));
        return this;
    }

    public ScriptedDecisionProvider votesYes(int times) {
        for (int i = 0; i < times; i++) {
            votes.add(new Decision.CastVote(true, "", ""));
        }
        return this;
    }

    public ScriptedDecisionProvider onNight(Decision... decisions) {
        nightChoices.addAll(List.of(decisions));
        return this;
    }

    public ScriptedDecisionProvider choose(String... targets) {
        nightChoices.add(new Decision.ChooseNightTargets(List.of(targets), ""));
        return this;
    }

    @Override
    public Decision decide(DecisionRequest request) {
        return switch (request.kind()) {
            case DAY_ACTION -> dayActions.isEmpty() ? new Decision.Pass("script exhausted") : dayActions.poll();
            case VOTE -> votes.isEmpty() ? new Decision.CastVote(false, "script exhausted", "") : votes.poll();
            case NIGHT_CHOICE -> nightChoices.isEmpty()
                    ? new Decision.ChooseNightTargets(
                            request.candidates().subList(0, request.targetCount()), "script exhausted")
                    : nightChoices.poll();
        };
    }
}
