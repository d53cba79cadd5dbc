package com.example.clocktower.game.state;

import com.example.clocktower.agent.Decision;
import com.example.clocktower.agent.DecisionGateway;
import com.example.clocktower.event.EventType;
import com.example.clocktower.game.GameFixture;
import com.example.clocktower.game.domain.ChoppingBlock;
import com.example.clocktower.game.domain.GameOutcome;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.Phase;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.service.DeathService;
import com.example.clocktower.game.service.NominationService;
import com.example.clocktower.game.service.SlayerService;
import com.example.clocktower.game.service.StatusResolver;
import com.example.clocktower.game.service.WinConditionEvaluator;
import com.example.clocktower.global.config.GameProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.clocktower.game.domain.Character.CHEF;
import static com.example.clocktower.game.domain.Character.EMPATH;
import static com.example.clocktower.game.domain.Character.IMP;
import static com.example.clocktower.game.domain.Character.MAYOR;
import static com.example.clocktower.game.domain.Character.MONK;
import static com.example.clocktower.game.domain.Character.POISONER;
import static com.example.clocktower.game.domain.Character.SAINT;
import static com.example.clocktower.game.domain.Character.SLAYER;
import static com.example.clocktower.game.domain.Character.SOLDIER;
import static com.example.clocktower.game.domain.Character.VIRGIN;
import static com.example.clocktower.game.domain.Character.WASHERWOMAN;
import static org.assertj.core.api.Assertions.assertThat;

class DayPhaseStateTest {

    private final StatusResolver statusResolver = new StatusResolver();
    private final DecisionGateway gateway = GameFixture.gateway();
    private final DeathService deathService = new DeathService(statusResolver);
    private final WinConditionEvaluator winConditionEvaluator = new WinConditionEvaluator();
    private GameProperties properties;
    private DayPhaseState dayPhase;

    @BeforeEach
    void setUp() {
        properties = new GameProperties();
        dayPhase = new DayPhaseState(properties, gateway,
                new NominationService(gateway, statusResolver, deathService),
                new SlayerService(statusResolver, deathService),
                deathService, statusResolver, winConditionEvaluator);
    }

    @Test
    @DisplayName("생존자 3명, 처형 없이 낮이 끝나면 정상 상태의 시장이 선 승리를 가져온다")
    void mayorWinsWithThreeAlive() {
        GameFixture fixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", MAYOR)
                .seat("Emma", CHEF)
                .seat("Michael", EMPATH)
                .seat("Olivia", SOLDIER);
        GameState game = fixture.build();
        game.findPlayer("Michael").setAlive(false);
        game.findPlayer("Olivia").setAlive(false);
        game.setRoundNumber(3);

        dayPhase.process(game);

        assertThat(game.getPhase()).isEqualTo(Phase.DAY);
        assertThat(game.getOutcome()).isEqualTo(GameOutcome.GOOD_WINS);
        assertThat(game.getEventLog().getEventsByType(EventType.MAYOR_WIN)).hasSize(1);
    }

    @Test
    @DisplayName("처형이 없어도 생존자가 3명이 아니면 시장 승리는 없다")
    void noMayorWinWithFourAlive() {
        GameFixture fixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", MAYOR)
                .seat("Emma", CHEF)
                .seat("Michael", EMPATH);
        GameState game = fixture.build();
        game.setRoundNumber(2);

        dayPhase.process(game);

        assertThat(game.getOutcome()).isEqualTo(GameOutcome.IN_PROGRESS);
    }

    @Test
    @DisplayName("정상 상태의 성자가 처형되면 악이 즉시 승리한다")
    void saintExecutionEndsGame() {
        properties.getDay().setNominationsOpenRound(1);
        GameFixture fixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", SAINT)
                .seat("Emma", CHEF)
                .seat("Michael", EMPATH)
                .seat("Olivia", MONK);
        GameState game = fixture.build();
        game.setRoundNumber(2);
        fixture.agent("Emma").onDay(new Decision.Nominate("John", "", "I do not trust John"));
        fixture.agent("John").votesYes(1);
        fixture.agent("Emma").votesYes(1);
        fixture.agent("Michael").votesYes(1);

        dayPhase.process(game);

        assertThat(game.findPlayer("John").isAlive()).isFalse();
        assertThat(game.getOutcome()).isEqualTo(GameOutcome.EVIL_WINS);
        assertThat(game.getEventLog().getEventsByType(EventType.SAINT_EXECUTED)).hasSize(1);
        assertThat(game.getTokens().get(ReminderToken.UNDERTAKER_EXECUTED))
                .contains(game.findPlayer("John"));
    }

    @Test
    @DisplayName("슬레이어가 임프를 쏘면 낮 도중 선 승리로 끝난다")
    void slayerKillsDemon() {
        GameFixture fixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", SLAYER)
                .seat("Emma", CHEF)
                .seat("Michael", EMPATH)
                .seat("Olivia", MONK);
        GameState game = fixture.build();
        game.setRoundNumber(2);
        fixture.agent("John").onDay(new Decision.UseCounterAbility("Susan", "", "Susan is the Demon"));

        dayPhase.process(game);

        assertThat(game.findPlayer("Susan").isAlive()).isFalse();
        assertThat(game.getOutcome()).isEqualTo(GameOutcome.GOOD_WINS);
    }

    @Test
    @DisplayName("응답 실패가 계속되면 낮이 끝나고 게임은 계속된다")
    void failingProviderEndsDay() {
        GameFixture fixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", MAYOR)
                .seat("Emma", CHEF)
                .seat("Michael", EMPATH);
        GameState game = fixture.build();
        game.setRoundNumber(2);
        game.getPlayerList().forEach(player -> player.setAgent(request -> {
            throw new IllegalStateException("provider offline");
        }));

        dayPhase.process(game);

        assertThat(game.getOutcome()).isEqualTo(GameOutcome.IN_PROGRESS);
        assertThat(game.getEventLog().getEventsByType(EventType.INVALID_ACTION)).hasSize(3);
        assertThat(game.isNominationsOpen()).isFalse();
    }

    @Test
    @DisplayName("하루 메시지 한도를 넘긴 메시지는 거부된다")
    void messageLimit() {
        GameFixture fixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", MAYOR)
                .seat("Emma", CHEF)
                .seat("Michael", EMPATH);
        GameState game = fixture.build();
        game.setRoundNumber(2);
        fixture.agent("Emma").onDay(
                new Decision.SendMessage(List.of("John"), "I am the Chef"),
                new Decision.SendMessage(List.of("John", "John", "Michael"), "Zero pairs"),
                new Decision.SendMessage(List.of("Susan"), "One more"));

        dayPhase.process(game);

        assertThat(game.getEventLog().getEventsByType(EventType.MESSAGE)).hasSize(2);
        assertThat(game.findPlayer("Emma").getMessagesLeft()).isZero();
        assertThat(game.findPlayer("Michael").getHistory())
                .containsOnlyOnce("Message from Emma to John, Michael: Zero pairs");
        assertThat(game.findPlayer("Emma").getHistory()).contains("Message from Emma to John: I am the Chef");
        assertThat(game.findPlayer("Susan").getHistory()).noneMatch(info -> info.contains("One more"));
        assertThat(game.getEventLog().getEventsByType(EventType.INVALID_ACTION)).hasSize(1);
    }

    @Test
    @DisplayName("버진 능력으로 처형이 일어나면 처형대에 오른 플레이어는 처형되지 않는다")
    void virginExecutionIsTheOnlyExecution() {
        properties.getDay().setNominationsOpenRound(1);
        GameFixture fixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", VIRGIN)
                .seat("Emma", CHEF)
                .seat("Michael", EMPATH)
                .seat("Olivia", MONK)
                .seat("James", SOLDIER)
                .seat("Sophia", WASHERWOMAN);
        GameState game = fixture.build();
        game.setRoundNumber(2);
        fixture.agent("Emma").onDay(new Decision.Nominate("Michael", "", "Michael is lying"));
        fixture.agent("Olivia").onDay(new Decision.Nominate("John", "", "John is the Demon"));
        List.of("John", "Emma", "Michael", "James", "Sophia")
                .forEach(name -> fixture.agent(name).votesYes(1));

        dayPhase.process(game);

        assertThat(game.getEventLog().getEventsByType(EventType.EXECUTION)).hasSize(1);
        assertThat(game.findPlayer("Olivia").isAlive()).isFalse();
        assertThat(game.findPlayer("Michael").isAlive()).isTrue();
        assertThat(game.getOutcome()).isEqualTo(GameOutcome.IN_PROGRESS);
    }

    @Test
    @DisplayName("버진 능력으로 처형된 날에는 생존자가 3명이어도 시장 승리가 없다")
    void noMayorWinAfterVirginExecution() {
        properties.getDay().setNominationsOpenRound(1);
        GameFixture fixture = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", VIRGIN)
                .seat("Emma", CHEF)
                .seat("Michael", MAYOR);
        GameState game = fixture.build();
        game.setRoundNumber(2);
        fixture.agent("Emma").onDay(new Decision.Nominate("John", "", "Testing the Virgin"));

        dayPhase.process(game);

        assertThat(game.findPlayer("Emma").isAlive()).isFalse();
        assertThat(game.getPlayers().countAlive()).isEqualTo(3);
        assertThat(game.getEventLog().getEventsByType(EventType.MAYOR_WIN)).isEmpty();
        assertThat(game.getOutcome()).isEqualTo(GameOutcome.IN_PROGRESS);
    }

    @Test
    @DisplayName("악끼리만 남은 지명 조합은 의미가 없으므로 낮을 끝낼 수 있다")
    void noProductivePairLeft() {
        GameState game = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", POISONER)
                .seat("Emma", CHEF)
                .build();
        game.findPlayer("Emma").setUsedNomination(true);
        game.findPlayer("Emma").setNominatedToday(true);

        assertThat(dayPhase.noProductiveNominationLeft(game)).isTrue();

        game.findPlayer("Emma").setNominatedToday(false);
        assertThat(dayPhase.noProductiveNominationLeft(game)).isFalse();
    }

    @Test
    @DisplayName("남은 투표 가능 인원으로 처형대를 넘거나 동률을 만들 수 없으면 낮을 끝낼 수 있다")
    void choppingBlockCannotBeChallenged() {
        GameState game = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", CHEF)
                .seat("Emma", EMPATH)
                .seat("Michael", MONK)
                .seat("Olivia", SOLDIER)
                .build();
        List.of("John", "Emma").forEach(name -> {
            game.findPlayer(name).setAlive(false);
            game.findPlayer(name).setUsedGhostVote(true);
        });

        game.setChoppingBlock(new ChoppingBlock(3, game.findPlayer("Michael")));
        assertThat(dayPhase.noProductiveNominationLeft(game)).isFalse();

        game.setChoppingBlock(new ChoppingBlock(4, game.findPlayer("Michael")));
        assertThat(dayPhase.noProductiveNominationLeft(game)).isTrue();
    }

    @Test
    @DisplayName("첫 라운드가 아닌 라운드에서 생존자 전원이 패스하면 낮이 끝난다")
    void everyonePassingEndsDay() {
        GameState game = GameFixture.create()
                .seat("Susan", IMP)
                .seat("John", MAYOR)
                .seat("Emma", CHEF)
                .seat("Michael", EMPATH)
                .build();
        game.setRoundNumber(2);

        dayPhase.process(game);

        // 첫 라운드의 전원 패스로는 끝나지 않고 둘째 라운드에서 끝난다
        assertThat(game.getEventLog().getEventsByType(EventType.PLAYER_PASS)).hasSize(8);
        assertThat(game.getEventLog().getEventsByType(EventType.NOMINATION)).isEmpty();
        assertThat(game.getOutcome()).isEqualTo(GameOutcome.IN_PROGRESS);
    }
}
