package com.example.clocktower.agent;

/**
 * 플레이어 한 명의 의사결정 주체 (스크립트, 무작위, LLM).
 * 엔진은 동기적으로 호출하며 응답이 올 때까지 상태를 바꾸지 않는다.
 */
public interface DecisionProvider {

    Decision decide(DecisionRequest request);
}
