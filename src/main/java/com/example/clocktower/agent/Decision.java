package com.example.clocktower.agent;

import java.util.List;

/**
 * 의사결정 제공자가 돌려주는 응답. 요청 한 번에 정확히 하나를 반환한다.
 */
public interface Decision {

    record SendMessage(List<String> recipients, String text) implements Decision {
    }

    record Nominate(String nominee, String privateReasoning, String publicReasoning) implements Decision {
    }

    record UseCounterAbility(String target, String privateReasoning, String publicReasoning) implements Decision {
    }

    record CastVote(boolean yes, String privateReasoning, String publicReasoning) implements Decision {
    }

    record ChooseNightTargets(List<String> targets, String privateReasoning) implements Decision {
    }

    record Pass(String privateReasoning) implements Decision {
    }
}
