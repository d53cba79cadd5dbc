package com.example.clocktower.game.strategy;

import com.example.clocktower.agent.DecisionGateway;
import com.example.clocktower.game.GameFixture;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.service.DeathService;
import com.example.clocktower.game.service.StatusResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.example.clocktower.game.domain.Character.CHEF;
import static com.example.clocktower.game.domain.Character.EMPATH;
import static com.example.clocktower.game.domain.Character.IMP;
import static com.example.clocktower.game.domain.Character.MAYOR;
import static com.example.clocktower.game.domain.Character.MONK;
import static com.example.clocktower.game.domain.Character.POISONER;
import static com.example.clocktower.game.domain.Character.SCARLET_WOMAN;
import static com.example.clocktower.game.domain.Character.SOLDIER;
import static com.example.clocktower.game.domain.Character.SPY;
import static org.assertj.core.api.Assertions.assertThat;

class ImpAbilityTest {

    private final StatusResolver statusResolver = new StatusResolver();
    private final DecisionGateway gateway = GameFixture.gateway();
    private final DeathService deathService = new DeathService(statusResolver);
    private final ImpAbility imp = new ImpAbility(statusResolver, gateway, deathService);
    private final MonkAbility monk = new MonkAbility(statusResolver, gateway);
    private final PoisonerAbility poisoner = new PoisonerAbility(statusResolver, gateway);

    private final GameFixture fixture = GameFixture.create()
            .seat("Susan", IMP)
            .seat("John", POISONER)
            .seat("Emma", MONK)
            .seat("Michael", CHEF)
            .seat("Olivia", SOLDIER)
            .seat("James", EMPATH);

    @Test
    @DisplayName("선택한 플레이어를 죽이고 IMP_KILLED 토큰을 남긴다")
    void killsTarget() {
        GameState game = fixture.build();
        fixture.agent("Susan").choose("Michael");

        AbilityResult result = imp.resolve(game, game.findPlayer("Susan"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(game.findPlayer("Michael").isAlive()).isFalse();
        assertThat(game.getTokens().marks(ReminderToken.IMP_KILLED, game.findPlayer("Michael"))).isTrue();
    }

    @Test
    @DisplayName("몽크가 보호한 플레이어는 죽지 않는다")
    void monkProtects() {
        GameState game = fixture.build();
        fixture.agent("Emma").choose("Michael");
        fixture.agent("Susan").choose("Michael");

        monk.resolve(game, game.findPlayer("Emma"));
        AbilityResult result = imp.resolve(game, game.findPlayer("Susan"));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getInfo()).endsWith("Nothing happened.");
        assertThat(game.findPlayer("Michael").isAlive()).isTrue();
    }

    @Test
    @DisplayName("공격 시점에 몽크가 중독되어 있으면 보호가 통하지 않는다")
    void poisonedMonkFailsToProtect() {
        GameState game = fixture.build();
        fixture.agent("Emma").choose("Michael");
        fixture.agent("John").choose("Emma");
        fixture.agent("Susan").choose("Michael");

        monk.resolve(game, game.findPlayer("Emma"));
        poisoner.resolve(game, game.findPlayer("John"));
        imp.resolve(game, game.findPlayer("Susan"));

        assertThat(game.findPlayer("Michael").isAlive()).isFalse();
    }

    @Test
    @DisplayName("정상 상태의 솔저는 임프의 공격에 죽지 않는다")
    void soldierIsImmune() {
        GameState game = fixture.build();
        fixture.agent("Susan").choose("Olivia");

        imp.resolve(game, game.findPlayer("Susan"));

        assertThat(game.findPlayer("Olivia").isAlive()).isTrue();
    }

    @Test
    @DisplayName("중독된 임프의 공격은 효과가 없다")
    void poisonedImpFails() {
        GameState game = fixture.build();
        game.getPoisonGraph().addPoisoner(game.findPlayer("Susan"), game.findPlayer("John"));
        fixture.agent("Susan").choose("Michael");

        AbilityResult result = imp.resolve(game, game.findPlayer("Susan"));

        assertThat(result.isImpaired()).isTrue();
        assertThat(game.findPlayer("Michael").isAlive()).isTrue();
    }

    @Test
    @DisplayName("정상 상태의 시장을 노리면 우선순위 목록의 첫 생존자가 대신 죽는다")
    void mayorDeflectsKill() {
        GameFixture mayorFixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", POISONER)
                .seat("Emma", MAYOR)
                .seat("Michael", EMPATH)
                .seat("Olivia", CHEF);
        GameState game = mayorFixture.build();
        mayorFixture.agent("Susan").choose("Emma");

        AbilityResult result = imp.resolve(game, game.findPlayer("Susan"));

        assertThat(game.findPlayer("Emma").isAlive()).isTrue();
        assertThat(game.findPlayer("Olivia").isAlive()).isFalse();
        assertThat(game.findPlayer("Michael").isAlive()).isTrue();
        assertThat(result.getMetadata()).containsEntry("victim", "Olivia");
    }

    @Test
    @DisplayName("임프가 자신을 죽이면 살아 있는 Minion 이 새 임프가 된다")
    void selfKillPromotesMinion() {
        GameFixture selfFixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", CHEF)
                .seat("Emma", SPY)
                .seat("Michael", EMPATH);
        GameState game = selfFixture.build();
        selfFixture.agent("Susan").choose("Susan");

        imp.resolve(game, game.findPlayer("Susan"));

        assertThat(game.findPlayer("Susan").isAlive()).isFalse();
        assertThat(game.findPlayer("Emma").getCharacter()).isEqualTo(IMP);
    }

    @Test
    @DisplayName("자살 시 스칼렛 우먼이 계승하면 다른 Minion 은 승격되지 않는다")
    void scarletWomanTakesPrecedenceOverPromotion() {
        GameFixture selfFixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", POISONER)
                .seat("Emma", SCARLET_WOMAN)
                .seat("Michael", EMPATH)
                .seat("Olivia", CHEF);
        GameState game = selfFixture.build();
        selfFixture.agent("Susan").choose("Susan");

        imp.resolve(game, game.findPlayer("Susan"));

        assertThat(game.findPlayer("Emma").getCharacter()).isEqualTo(IMP);
        assertThat(game.findPlayer("John").getCharacter()).isEqualTo(POISONER);
    }

    @Test
    @DisplayName("포이즈너는 새 대상을 고르기 전에 이전 중독을 푼다")
    void poisonerMovesPoison() {
        GameState game = fixture.build();
        fixture.agent("John").choose("Michael").choose("James");

        poisoner.resolve(game, game.findPlayer("John"));
        assertThat(statusResolver.isImpaired(game, game.findPlayer("Michael"))).isTrue();

        poisoner.resolve(game, game.findPlayer("John"));
        assertThat(statusResolver.isImpaired(game, game.findPlayer("Michael"))).isFalse();
        assertThat(statusResolver.isImpaired(game, game.findPlayer("James"))).isTrue();
    }
}
