package com.example.clocktower.game.state;

import com.example.clocktower.event.EventType;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.Phase;
import com.example.clocktower.game.service.WinConditionEvaluator;
import com.example.clocktower.game.strategy.AbilityResult;
import com.example.clocktower.game.strategy.CharacterAbility;
import com.example.clocktower.game.strategy.CharacterAbilityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 밤 페이즈 상태
 * - 첫날 밤: Demon/Minion 정보 전달
 * - 대본의 밤 순서대로 능력 해결 (드렁크는 믿는 캐릭터 자리에서 깨어남)
 * - 첫날 밤이 아니면 밤사이 사망자 발표
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NightPhaseState implements GamePhaseState {

    static final int DEMON_BLUFF_COUNT = 3;

    private final CharacterAbilityRegistry abilityRegistry;
    private final WinConditionEvaluator winConditionEvaluator;

    @Override
    public void process(GameState gameState) {
        gameState.setPhase(Phase.NIGHT);
        gameState.record(EventType.PHASE_CHANGE, "Night " + gameState.getRoundNumber() + " begins", List.of());
        log.info("[밤] gameId={}, round={}", gameState.getGameId(), gameState.getRoundNumber());

        List<GamePlayer> aliveBefore = gameState.getPlayers().findAllAlivePlayers();
        if (gameState.getRoundNumber() == 1) {
            informEvilTeam(gameState);
        }

        for (Character character : gameState.getScript().nightOrder(gameState.getRoundNumber())) {
            resolveAbility(gameState, character);
            if (winConditionEvaluator.applyTo(gameState)) {
                log.info("[밤] 밤 도중 승패 결정, 남은 능력 생략");
                return;
            }
        }

        if (gameState.getRoundNumber() > 1) {
            announceDeaths(gameState, aliveBefore);
        }
    }

    private void resolveAbility(GameState gameState, Character character) {
        Optional<CharacterAbility> ability = abilityRegistry.find(character);
        Optional<GamePlayer> actor = gameState.getPlayers().findActing(character);
        if (ability.isEmpty() || actor.isEmpty()) {
            return;
        }
        GamePlayer player = actor.get();
        if (!player.isAlive() && !ability.get().wakesWhenDead(gameState, player)) {
            return;
        }

        AbilityResult result = ability.get().resolve(gameState, player);
        if (!result.hasInfo()) {
            log.debug("[밤행동] 출력 없음: character={}, actor={}", character, player.getName());
            return;
        }

        gameState.tellPrivately(player, result.getInfo());
        Map<String, Object> metadata = new HashMap<>(result.getMetadata());
        metadata.put("character", character.name());
        metadata.put("impaired", result.isImpaired());
        metadata.put("success", result.isSuccess());
        gameState.record(EventType.CHARACTER_POWER,
                player.getName() + " (" + character.getDisplayName() + "): " + result.getInfo(),
                participants(player, result), metadata);
        log.debug("[밤행동] character={}, actor={}, targets={}, impaired={}",
                character, player.getName(), result.getTargetNames(), result.isImpaired());
    }

    /**
     * Demon 에게 Minion 과 허세용 캐릭터 3개를, Minion 에게 Demon 과 동료 Minion 을 알려준다.
     */
    private void informEvilTeam(GameState gameState) {
        List<GamePlayer> minions = gameState.getPlayers().findByType(CharacterType.MINION);
        List<GamePlayer> demons = gameState.getPlayers().findByType(CharacterType.DEMON);
        String minionNames = minions.stream().map(GamePlayer::getName).collect(Collectors.joining(", "));
        String demonNames = demons.stream().map(GamePlayer::getName).collect(Collectors.joining(", "));

        List<Character> bluffs = demonBluffs(gameState);
        String bluffNames = bluffs.stream().map(Character::getDisplayName).collect(Collectors.joining(", "));
        for (GamePlayer demon : demons) {
            gameState.tellPrivately(demon, "Storyteller: Your minions are: "
                    + (minionNames.isEmpty() ? "none" : minionNames)
                    + ". These characters are not in play: " + bluffNames + ".");
        }
        for (GamePlayer minion : minions) {
            gameState.tellPrivately(minion, "Storyteller: The Demon is " + demonNames
                    + ". The minions are: " + minionNames + ".");
        }
        gameState.record(EventType.STORYTELLER_INFO, "The evil team learned each other",
                gameState.getPlayerList().stream()
                        .filter(player -> player.getType() == CharacterType.MINION
                                || player.getType() == CharacterType.DEMON)
                        .map(GamePlayer::getName)
                        .collect(Collectors.toList()),
                Map.of("bluffs", bluffs.stream().map(Character::name).collect(Collectors.toList())));
    }

    private List<Character> demonBluffs(GameState gameState) {
        List<Character> inPlay = gameState.getPlayerList().stream()
                .flatMap(player -> player.getDrunkCharacter() == null
                        ? Stream.of(player.getCharacter())
                        : Stream.of(player.getCharacter(), player.getDrunkCharacter()))
                .collect(Collectors.toList());
        List<Character> candidates = new ArrayList<>();
        candidates.addAll(gameState.getScript().charactersOf(CharacterType.TOWNSFOLK));
        candidates.addAll(gameState.getScript().charactersOf(CharacterType.OUTSIDER));
        candidates.removeAll(inPlay);
        Collections.shuffle(candidates, gameState.getRandom());
        return candidates.subList(0, Math.min(DEMON_BLUFF_COUNT, candidates.size()));
    }

    private void announceDeaths(GameState gameState, List<GamePlayer> aliveBefore) {
        List<String> died = aliveBefore.stream()
                .filter(player -> !player.isAlive())
                .map(GamePlayer::getName)
                .collect(Collectors.toList());
        if (died.isEmpty()) {
            gameState.broadcast("Storyteller: Dawn breaks. Nobody died last night.");
        } else {
            gameState.broadcast("Storyteller: Dawn breaks. " + String.join(", ", died) + " died last night.");
        }
    }

    private List<String> participants(GamePlayer actor, AbilityResult result) {
        List<String> names = new ArrayList<>();
        names.add(actor.getName());
        names.addAll(result.getTargetNames());
        return names;
    }

    @Override
    public Phase nextPhase() {
        return Phase.DAY;
    }

    @Override
    public Phase getPhase() {
        return Phase.NIGHT;
    }
}
