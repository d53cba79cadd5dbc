package com.example.clocktower.game.service;

import com.example.clocktower.agent.DecisionProviderFactory;
import com.example.clocktower.event.EventType;
import com.example.clocktower.event.GameEventLog;
import com.example.clocktower.event.GameEventLogFactory;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameSetup;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.Players;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.domain.Script;
import com.example.clocktower.game.strategy.CharacterAbilityRegistry;
import com.example.clocktower.global.config.GameProperties;
import com.example.clocktower.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 게임 준비: 캐릭터 배정, 이름/좌석 배치, 드렁크와 레드 헤링, 리마인더 토큰, 역할 안내
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameSetupService {

    static final List<String> NAME_POOL = List.of(
            "Susan", "John", "Emma", "Michael", "Olivia", "James", "Sophia", "William",
            "Ava", "Steve", "Emily", "Daniel", "Isabella", "David", "Mia");

    // Baron 이 있으면 Townsfolk 2명이 Outsider 로 바뀐다
    static final int BARON_OUTSIDER_BONUS = 2;

    private final GameValidator gameValidator;
    private final GameProperties gameProperties;
    private final GameEventLogFactory gameEventLogFactory;
    private final DecisionProviderFactory decisionProviderFactory;
    private final CharacterAbilityRegistry abilityRegistry;

    public GameState createGame(GameSetup setup) {
        Random random = new Random(resolveSeed(setup));
        Script script = setup.script();

        List<Character> characters = setup.hasExplicitCharacters()
                ? new ArrayList<>(setup.characters())
                : sampleCharacters(script, setup, random);
        gameValidator.validateCharacters(script, characters);

        List<String> names = new ArrayList<>(NAME_POOL);
        Collections.shuffle(names, random);
        List<GamePlayer> seats = new ArrayList<>();
        for (int i = 0; i < characters.size(); i++) {
            seats.add(GamePlayer.of(names.get(i), characters.get(i)));
        }
        Collections.shuffle(seats, random);

        String gameId = new UUID(random.nextLong(), random.nextLong()).toString().substring(0, 8);
        GameEventLog eventLog = gameEventLogFactory.create(gameId);
        GameState gameState = GameState.builder()
                .gameId(gameId)
                .script(script)
                .players(new Players(seats))
                .random(random)
                .eventLog(eventLog)
                .build();

        assignDrunk(gameState, characters);
        seats.forEach(player -> player.setAgent(decisionProviderFactory.create(random)));

        gameState.record(EventType.GAME_SETUP, "Game created with " + seats.size() + " players",
                gameState.getPlayers().names(),
                Map.of("script", script.name(), "characters", characters.stream()
                        .map(Character::name).collect(Collectors.toList())));

        for (GamePlayer player : seats) {
            abilityRegistry.find(player.getBelievedCharacter())
                    .ifPresent(ability -> ability.setup(gameState, player));
            informRole(gameState, player);
        }

        log.info("[게임준비] gameId={}, players={}, characters={}", gameId, seats.size(), characters);
        return gameState;
    }

    private long resolveSeed(GameSetup setup) {
        if (setup.seed() != null) {
            return setup.seed();
        }
        if (gameProperties.getRandomSeed() != null) {
            return gameProperties.getRandomSeed();
        }
        return new Random().nextLong();
    }

    private List<Character> sampleCharacters(Script script, GameSetup setup, Random random) {
        int townsfolk = setup.townsfolk();
        int outsiders = setup.outsiders();
        gameValidator.validateCounts(script, townsfolk, outsiders, setup.minions());

        List<Character> minions = sample(script.charactersOf(CharacterType.MINION), setup.minions(), random);
        if (minions.contains(Character.BARON)) {
            townsfolk -= BARON_OUTSIDER_BONUS;
            outsiders += BARON_OUTSIDER_BONUS;
            if (townsfolk < 0) {
                throw ErrorCode.INVALID_CHARACTER_COUNT.commonException("not enough Townsfolk for the Baron");
            }
            gameValidator.validateCounts(script, townsfolk, outsiders, setup.minions());
        }

        List<Character> characters = new ArrayList<>();
        characters.addAll(sample(script.charactersOf(CharacterType.TOWNSFOLK), townsfolk, random));
        characters.addAll(sample(script.charactersOf(CharacterType.OUTSIDER), outsiders, random));
        characters.addAll(minions);
        characters.addAll(sample(script.charactersOf(CharacterType.DEMON), 1, random));
        return characters;
    }

    private List<Character> sample(List<Character> pool, int count, Random random) {
        List<Character> shuffled = new ArrayList<>(pool);
        Collections.shuffle(shuffled, random);
        return new ArrayList<>(shuffled.subList(0, count));
    }

    /**
     * 드렁크는 게임에 없는 Townsfolk 를 자신의 캐릭터로 믿는다.
     */
    private void assignDrunk(GameState gameState, List<Character> inPlay) {
        gameState.getPlayers().findByCharacter(Character.DRUNK).ifPresent(drunk -> {
            List<Character> notInPlay = gameState.getScript().charactersOf(CharacterType.TOWNSFOLK).stream()
                    .filter(character -> !inPlay.contains(character))
                    .collect(Collectors.toList());
            if (notInPlay.isEmpty()) {
                throw ErrorCode.INVALID_CHARACTER_COUNT.commonException("no Townsfolk left for the Drunk to believe in");
            }
            Character believed = notInPlay.get(gameState.getRandom().nextInt(notInPlay.size()));
            drunk.setDrunkCharacter(believed);
            gameState.getTokens().place(ReminderToken.IS_THE_DRUNK, drunk);
            log.debug("[게임준비] 드렁크 배정: player={}, believes={}", drunk.getName(), believed);
        });
    }

    private void informRole(GameState gameState, GamePlayer player) {
        Character shown = player.getBelievedCharacter();
        gameState.tellPrivately(player, "Storyteller: You are the " + shown.getDisplayName() + ", on the "
                + player.getAlignment().name().toLowerCase() + " team. " + shown.getAbility());
        Map<String, Object> metadata = player.getDrunkCharacter() == null
                ? Map.of("character", player.getCharacter().name(), "alignment", player.getAlignment().name())
                : Map.of("character", player.getCharacter().name(), "alignment", player.getAlignment().name(),
                "believes", player.getDrunkCharacter().name());
        gameState.record(EventType.PLAYER_SETUP, player.getName() + " is the " + player.getCharacter().getDisplayName(),
                List.of(player.getName()), metadata);
    }
}
