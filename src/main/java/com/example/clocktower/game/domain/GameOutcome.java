package com.example.clocktower.game.domain;

public enum GameOutcome {
    IN_PROGRESS,
    GOOD_WINS,
    EVIL_WINS,
    MAX_ROUNDS_REACHED;

    public static GameOutcome of(Winner winner) {
        return switch (winner) {
            case GOOD -> GOOD_WINS;
            case EVIL -> EVIL_WINS;
            case NONE -> IN_PROGRESS;
        };
    }
}
