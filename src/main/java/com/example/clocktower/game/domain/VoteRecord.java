package com.example.clocktower.game.domain;

/**
 * 한 지명 투표에서 한 명이 던진 표
 */
public record VoteRecord(String voter, Vote vote, String publicReasoning) {
}
