package com.example.clocktower.game.service;

import com.example.clocktower.game.GameFixture;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.example.clocktower.game.domain.Character.CHEF;
import static com.example.clocktower.game.domain.Character.EMPATH;
import static com.example.clocktower.game.domain.Character.IMP;
import static com.example.clocktower.game.domain.Character.MONK;
import static com.example.clocktower.game.domain.Character.POISONER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class StatusResolverTest {

    private final StatusResolver statusResolver = new StatusResolver();

    private GameState fiveSeats() {
        return GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", POISONER)
                .seat("Emma", CHEF)
                .seat("Michael", EMPATH)
                .drunk("Olivia", MONK)
                .build();
    }

    @Test
    @DisplayName("드렁크는 중독과 관계없이 항상 무력화")
    void drunkIsAlwaysImpaired() {
        GameState game = fiveSeats();

        assertThat(statusResolver.isImpaired(game, game.findPlayer("Olivia"))).isTrue();
        assertThat(statusResolver.isImpaired(game, game.findPlayer("Emma"))).isFalse();
    }

    @Test
    @DisplayName("살아 있는 정상 중독자에게 중독되면 무력화, 중독자가 죽으면 해제")
    void poisonedByLivingPoisoner() {
        GameState game = fiveSeats();
        GamePlayer poisoner = game.findPlayer("John");
        GamePlayer chef = game.findPlayer("Emma");
        game.getPoisonGraph().addPoisoner(chef, poisoner);

        assertThat(statusResolver.isImpaired(game, chef)).isTrue();

        poisoner.setAlive(false);
        assertThat(statusResolver.isImpaired(game, chef)).isFalse();
    }

    @Test
    @DisplayName("무력화된 중독자의 중독은 효과가 없다")
    void impairedPoisonerHasNoEffect() {
        GameState game = fiveSeats();
        GamePlayer drunk = game.findPlayer("Olivia");
        GamePlayer chef = game.findPlayer("Emma");
        game.getPoisonGraph().addPoisoner(chef, drunk);

        assertThat(statusResolver.isImpaired(game, chef)).isFalse();
    }

    @Test
    @DisplayName("2-순환 중독도 유한 시간에 끝나고 양쪽 모두 무력화")
    void twoCycleTerminates() {
        GameState game = fiveSeats();
        GamePlayer a = game.findPlayer("Emma");
        GamePlayer b = game.findPlayer("Michael");
        game.getPoisonGraph().addPoisoner(b, a);
        game.getPoisonGraph().addPoisoner(a, b);

        assertThat(statusResolver.isImpaired(game, a)).isTrue();
        assertThat(statusResolver.isImpaired(game, b)).isTrue();
    }

    @Test
    @DisplayName("자기 자신을 중독시킨 경우는 무력화되지 않는다")
    void selfLoopTerminates() {
        GameState game = fiveSeats();
        GamePlayer a = game.findPlayer("Emma");
        game.getPoisonGraph().addPoisoner(a, a);

        assertThatCode(() -> statusResolver.isImpaired(game, a)).doesNotThrowAnyException();
        assertThat(statusResolver.isImpaired(game, a)).isFalse();
    }

    @Test
    @DisplayName("순환 중독 중인 플레이어를 중독되지 않은 세 번째 플레이어도 중독시키면 무력화")
    void cycleWithOutsidePoisoner() {
        GameState game = fiveSeats();
        GamePlayer a = game.findPlayer("Emma");
        GamePlayer b = game.findPlayer("Michael");
        GamePlayer c = game.findPlayer("John");
        game.getPoisonGraph().addPoisoner(b, a);
        game.getPoisonGraph().addPoisoner(a, b);
        game.getPoisonGraph().addPoisoner(a, c);

        assertThat(statusResolver.isImpaired(game, c)).isFalse();
        assertThat(statusResolver.isImpaired(game, a)).isTrue();
    }
}
