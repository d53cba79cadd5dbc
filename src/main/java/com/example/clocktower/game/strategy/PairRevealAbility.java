package com.example.clocktower.game.strategy;

import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.domain.ReminderTokens;
import com.example.clocktower.game.service.StatusResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * "두 명 중 한 명이 X 이다" 형태의 첫날 밤 정보 (워셔우먼, 라이브러리언, 인베스티게이터)
 * - 게임 준비 시 실제 보유자와 미끼 토큰을 배치한다
 * - 무력화 상태면 무작위 두 명과 무작위 캐릭터를 보여준다
 */
@Slf4j
public abstract class PairRevealAbility implements CharacterAbility {

    private final StatusResolver statusResolver;
    private final AbilitySupport support;
    private final CharacterType revealedType;
    private final ReminderToken holderToken;
    private final ReminderToken decoyToken;

    protected PairRevealAbility(StatusResolver statusResolver, AbilitySupport support, CharacterType revealedType,
                                ReminderToken holderToken, ReminderToken decoyToken) {
        this.statusResolver = statusResolver;
        this.support = support;
        this.revealedType = revealedType;
        this.holderToken = holderToken;
        this.decoyToken = decoyToken;
    }

    @Override
    public void setup(GameState gameState, GamePlayer actor) {
        List<GamePlayer> holders = gameState.getPlayerList().stream()
                .filter(player -> player != actor)
                .filter(player -> player.getType() == revealedType)
                .collect(Collectors.toList());
        if (holders.isEmpty()) {
            log.debug("[준비] {} 대상 없음: type={}", getCharacter(), revealedType);
            return;
        }
        GamePlayer holder = support.pick(gameState, holders);
        List<GamePlayer> decoys = gameState.getPlayerList().stream()
                .filter(player -> player != actor && player != holder)
                .collect(Collectors.toList());
        ReminderTokens tokens = gameState.getTokens();
        tokens.place(holderToken, holder);
        if (!decoys.isEmpty()) {
            tokens.place(decoyToken, support.pick(gameState, decoys));
        }
    }

    @Override
    public AbilityResult resolve(GameState gameState, GamePlayer actor) {
        if (statusResolver.isImpaired(gameState, actor)) {
            List<GamePlayer> shown = support.randomOthers(gameState, actor, 2);
            Character character = support.randomCharacter(gameState, revealedType);
            return reveal(actor, shown, character, true, support.shuffledPair(gameState, shown.get(0), shown.get(1)));
        }

        ReminderTokens tokens = gameState.getTokens();
        Optional<GamePlayer> holder = tokens.get(holderToken);
        Optional<GamePlayer> decoy = tokens.get(decoyToken);
        if (holder.isEmpty() || decoy.isEmpty()) {
            return AbilityResult.builder()
                    .character(getCharacter())
                    .actorName(actor.getName())
                    .info("Storyteller: You learn that no " + revealedType.getDisplayName() + " is in play.")
                    .success(true)
                    .build();
        }
        List<GamePlayer> shown = List.of(holder.get(), decoy.get());
        return reveal(actor, shown, holder.get().getCharacter(), false,
                support.shuffledPair(gameState, holder.get(), decoy.get()));
    }

    private AbilityResult reveal(GamePlayer actor, List<GamePlayer> shown, Character character, boolean impaired,
                                 String pair) {
        return AbilityResult.builder()
                .character(getCharacter())
                .actorName(actor.getName())
                .targetNames(shown.stream().map(GamePlayer::getName).collect(Collectors.toList()))
                .info("Storyteller: One of " + pair + " is the " + character.getDisplayName() + ".")
                .impaired(impaired)
                .success(!impaired)
                .meta("shownCharacter", character.name())
                .build();
    }
}
