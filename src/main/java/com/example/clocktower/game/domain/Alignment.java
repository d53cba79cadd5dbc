package com.example.clocktower.game.domain;

public enum Alignment {
    GOOD, // 선 (Townsfolk, Outsider)
    EVIL  // 악 (Minion, Demon)
}
