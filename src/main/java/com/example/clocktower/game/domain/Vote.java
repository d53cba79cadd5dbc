package com.example.clocktower.game.domain;

public enum Vote {
    YES,
    NO,
    CANT_VOTE // 유령 투표를 이미 사용한 사망자
}
