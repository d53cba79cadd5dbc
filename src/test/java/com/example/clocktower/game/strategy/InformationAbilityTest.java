package com.example.clocktower.game.strategy;

import com.example.clocktower.agent.DecisionGateway;
import com.example.clocktower.game.GameFixture;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.service.DeathCause;
import com.example.clocktower.game.service.DeathService;
import com.example.clocktower.game.service.StatusResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.example.clocktower.game.domain.Character.CHEF;
import static com.example.clocktower.game.domain.Character.EMPATH;
import static com.example.clocktower.game.domain.Character.FORTUNE_TELLER;
import static com.example.clocktower.game.domain.Character.IMP;
import static com.example.clocktower.game.domain.Character.LIBRARIAN;
import static com.example.clocktower.game.domain.Character.MONK;
import static com.example.clocktower.game.domain.Character.POISONER;
import static com.example.clocktower.game.domain.Character.RAVENKEEPER;
import static com.example.clocktower.game.domain.Character.RECLUSE;
import static com.example.clocktower.game.domain.Character.SPY;
import static com.example.clocktower.game.domain.Character.UNDERTAKER;
import static com.example.clocktower.game.domain.Character.WASHERWOMAN;
import static org.assertj.core.api.Assertions.assertThat;

class InformationAbilityTest {

    private final StatusResolver statusResolver = new StatusResolver();
    private final DecisionGateway gateway = GameFixture.gateway();
    private final AbilitySupport support = new AbilitySupport();

    @Nested
    @DisplayName("셰프")
    class Chef {

        private final ChefAbility chef = new ChefAbility(statusResolver);

        // Imp-Poisoner 한 쌍, Recluse-Imp 가 좌석을 한 바퀴 돌아 한 쌍
        private GameState game() {
            return GameFixture.create()
                    .seat("Susan", IMP)
                    .seat("John", POISONER)
                    .seat("Emma", CHEF)
                    .seat("Michael", EMPATH)
                    .seat("Olivia", RECLUSE)
                    .build();
        }

        @Test
        @DisplayName("원형 좌석으로 이웃한 악 쌍을 센다 (레클루스는 악으로 보인다)")
        void countsAdjacentEvilPairsCircularly() {
            GameState game = game();

            AbilityResult result = chef.resolve(game, game.findPlayer("Emma"));

            assertThat(result.getMetadata().get("pairs")).isEqualTo(2);
            assertThat(result.getInfo()).contains("There are 2 pairs");
        }

        @Test
        @DisplayName("무력화되면 (참값 + 1) % 3 을 받는다")
        void impairedCountIsOffset() {
            GameState game = game();
            game.getPoisonGraph().addPoisoner(game.findPlayer("Emma"), game.findPlayer("John"));

            AbilityResult result = chef.resolve(game, game.findPlayer("Emma"));

            assertThat(result.getMetadata().get("pairs")).isEqualTo(0);
            assertThat(result.isImpaired()).isTrue();
        }
    }

    @Nested
    @DisplayName("엠패스")
    class Empath {

        private final EmpathAbility empath = new EmpathAbility(statusResolver);

        @Test
        @DisplayName("가장 가까운 살아 있는 이웃만 센다 (스파이는 선으로 보인다)")
        void countsNearestLivingNeighbours() {
            GameState game = GameFixture.create()
                    .seat("Susan", CHEF)
                    .seat("John", IMP)
                    .seat("Emma", EMPATH)
                    .seat("Michael", SPY)
                    .seat("Olivia", POISONER)
                    .build();
            GamePlayer empathPlayer = game.findPlayer("Emma");

            assertThat(empath.resolve(game, empathPlayer).getMetadata().get("evilNeighbours")).isEqualTo(1);

            game.findPlayer("Michael").setAlive(false);
            assertThat(empath.resolve(game, empathPlayer).getMetadata().get("evilNeighbours")).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("포춘텔러")
    class FortuneTeller {

        private final FortuneTellerAbility fortuneTeller = new FortuneTellerAbility(statusResolver, gateway, support);

        private final GameFixture fixture = GameFixture.create()
                .seat("Susan", FORTUNE_TELLER)
                .seat("John", IMP)
                .seat("Emma", CHEF)
                .seat("Michael", RECLUSE)
                .seat("Olivia", MONK)
                .seat("James", POISONER);

        @Test
        @DisplayName("Demon, Demon 으로 보이는 레클루스, 레드 헤링에 예라고 답한다")
        void detectsDemonRegistrations() {
            GameState game = fixture.build();
            GamePlayer actor = game.findPlayer("Susan");
            game.getTokens().place(ReminderToken.RED_HERRING, game.findPlayer("Olivia"));
            fixture.agent("Susan")
                    .choose("Emma", "James")
                    .choose("John", "Emma")
                    .choose("Michael", "Emma")
                    .choose("Olivia", "Emma");

            assertThat(fortuneTeller.resolve(game, actor).getMetadata().get("demonSeen")).isEqualTo(false);
            assertThat(fortuneTeller.resolve(game, actor).getMetadata().get("demonSeen")).isEqualTo(true);
            assertThat(fortuneTeller.resolve(game, actor).getMetadata().get("demonSeen")).isEqualTo(true);
            assertThat(fortuneTeller.resolve(game, actor).getMetadata().get("demonSeen")).isEqualTo(true);
        }

        @Test
        @DisplayName("무력화되면 반대로 답한다")
        void impairedAnswerIsNegated() {
            GameState game = fixture.build();
            GamePlayer actor = game.findPlayer("Susan");
            game.getPoisonGraph().addPoisoner(actor, game.findPlayer("James"));
            fixture.agent("Susan").choose("John", "Emma");

            AbilityResult result = fortuneTeller.resolve(game, actor);

            assertThat(result.getMetadata().get("demonSeen")).isEqualTo(false);
            assertThat(result.getInfo()).startsWith("Storyteller: No");
        }

        @Test
        @DisplayName("레드 헤링은 선 플레이어 중에서 정해진다")
        void redHerringIsGood() {
            GameState game = fixture.build();

            fortuneTeller.setup(game, game.findPlayer("Susan"));

            assertThat(game.getTokens().get(ReminderToken.RED_HERRING))
                    .hasValueSatisfying(player -> assertThat(player.isEvil()).isFalse());
        }
    }

    @Nested
    @DisplayName("언더테이커와 레이븐키퍼")
    class DeadInformation {

        private final GameFixture fixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", POISONER)
                .seat("Emma", UNDERTAKER)
                .seat("Michael", RAVENKEEPER)
                .seat("Olivia", MONK);

        @Test
        @DisplayName("처형이 없었으면 언더테이커는 아무 정보도 받지 않는다")
        void undertakerSilentWithoutExecution() {
            GameState game = fixture.build();
            UndertakerAbility undertaker = new UndertakerAbility(statusResolver, support);

            AbilityResult result = undertaker.resolve(game, game.findPlayer("Emma"));

            assertThat(result.hasInfo()).isFalse();
        }

        @Test
        @DisplayName("처형된 플레이어의 캐릭터를 알려주고 토큰을 소모한다")
        void undertakerLearnsExecutedCharacter() {
            GameState game = fixture.build();
            UndertakerAbility undertaker = new UndertakerAbility(statusResolver, support);
            new DeathService(statusResolver).execute(game, game.findPlayer("John"));

            AbilityResult result = undertaker.resolve(game, game.findPlayer("Emma"));

            assertThat(result.getInfo()).contains("John").contains("Poisoner");
            assertThat(game.getTokens().has(ReminderToken.UNDERTAKER_EXECUTED)).isFalse();
        }

        @Test
        @DisplayName("밤에 Demon 에게 죽은 레이븐키퍼만 깨어나 한 명의 캐릭터를 알게 된다")
        void ravenkeeperWakesOnlyAfterDemonKill() {
            GameState game = fixture.build();
            RavenkeeperAbility ravenkeeper = new RavenkeeperAbility(statusResolver, gateway, support);
            GamePlayer actor = game.findPlayer("Michael");
            assertThat(ravenkeeper.wakesWhenDead(game, actor)).isFalse();

            new DeathService(statusResolver).kill(game, actor, DeathCause.DEMON);
            fixture.agent("Michael").choose("Susan");

            assertThat(ravenkeeper.wakesWhenDead(game, actor)).isTrue();
            AbilityResult result = ravenkeeper.resolve(game, actor);
            assertThat(result.getInfo()).isEqualTo("Storyteller: Susan is the Imp.");
            assertThat(ravenkeeper.wakesWhenDead(game, actor)).isFalse();
        }
    }

    @Nested
    @DisplayName("워셔우먼과 라이브러리언")
    class PairReveal {

        @Test
        @DisplayName("준비 때 정한 실제 보유자와 미끼를 보여준다")
        void washerwomanShowsHolderAndDecoy() {
            GameState game = GameFixture.create()
                    .seat("Susan", WASHERWOMAN)
                    .seat("John", IMP)
                    .seat("Emma", CHEF)
                    .seat("Michael", POISONER)
                    .seat("Olivia", RECLUSE)
                    .build();
            WasherwomanAbility washerwoman = new WasherwomanAbility(statusResolver, support);
            GamePlayer actor = game.findPlayer("Susan");

            washerwoman.setup(game, actor);
            AbilityResult result = washerwoman.resolve(game, actor);

            GamePlayer decoy = game.getTokens().get(ReminderToken.WASHERWOMAN_OTHER).orElseThrow();
            assertThat(game.getTokens().marks(ReminderToken.WASHERWOMAN_TOWNSFOLK, game.findPlayer("Emma"))).isTrue();
            assertThat(decoy).isNotIn(actor, game.findPlayer("Emma"));
            assertThat(result.getInfo()).contains("Emma").contains(decoy.getName()).endsWith("is the Chef.");
        }

        @Test
        @DisplayName("Outsider 가 없으면 라이브러리언은 0명이라고 듣는다")
        void librarianWithoutOutsiders() {
            GameState game = GameFixture.create()
                    .seat("Susan", LIBRARIAN)
                    .seat("John", IMP)
                    .seat("Emma", CHEF)
                    .seat("Michael", POISONER)
                    .build();
            LibrarianAbility librarian = new LibrarianAbility(statusResolver, support);
            GamePlayer actor = game.findPlayer("Susan");

            librarian.setup(game, actor);

            assertThat(librarian.resolve(game, actor).getInfo()).contains("no Outsider");
        }

        @Test
        @DisplayName("무력화되면 자신을 제외한 무작위 두 명을 보여준다")
        void impairedWasherwomanShowsRandomPair() {
            GameState game = GameFixture.create()
                    .drunk("Susan", WASHERWOMAN)
                    .seat("John", IMP)
                    .seat("Emma", CHEF)
                    .seat("Michael", POISONER)
                    .build();
            WasherwomanAbility washerwoman = new WasherwomanAbility(statusResolver, support);
            GamePlayer actor = game.findPlayer("Susan");

            AbilityResult result = washerwoman.resolve(game, actor);

            assertThat(result.isImpaired()).isTrue();
            assertThat(result.getTargetNames()).hasSize(2).doesNotContain("Susan");
        }
    }

    @Test
    @DisplayName("스파이는 그리모어 전체를 본다")
    void spySeesGrimoire() {
        GameState game = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", SPY)
                .seat("Emma", POISONER)
                .drunk("Michael", CHEF)
                .build();
        game.getPoisonGraph().addPoisoner(game.findPlayer("John"), game.findPlayer("Emma"));

        AbilityResult result = new SpyAbility().resolve(game, game.findPlayer("John"));

        assertThat(result.getInfo())
                .contains("Susan: Imp (alive)")
                .contains("Michael: Drunk (alive), believes they are the Chef")
                .contains("John: Spy (alive), poisoned by Emma");
    }
}
