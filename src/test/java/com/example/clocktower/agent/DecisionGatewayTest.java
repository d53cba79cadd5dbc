package com.example.clocktower.agent;

import com.example.clocktower.event.EventType;
import com.example.clocktower.game.GameFixture;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.global.error.DecisionFailedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static com.example.clocktower.game.domain.Character.CHEF;
import static com.example.clocktower.game.domain.Character.EMPATH;
import static com.example.clocktower.game.domain.Character.IMP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionGatewayTest {

    private final DecisionGateway gateway = GameFixture.gateway();

    private final GameFixture fixture = GameFixture.create()
            .seat("Susan", IMP)
            .seat("John", CHEF)
            .seat("Emma", EMPATH);

    private final DecisionRequest.VoteContext voteContext =
            new DecisionRequest.VoteContext("John", 0, 2, null, List.of());

    @Test
    @DisplayName("없는 이름을 고르면 다시 물어보고 올바른 응답을 받는다")
    void retriesUnknownName() {
        GameState game = fixture.build();
        fixture.agent("Susan").choose("Nobody").choose("Emma");

        Optional<List<GamePlayer>> targets = gateway.requestNightTargets(game, game.findPlayer("Susan"),
                "Choose a player", 1, GamePlayer::isAlive);

        assertThat(targets).isPresent();
        assertThat(targets.get()).containsExactly(game.findPlayer("Emma"));
        assertThat(game.getEventLog().getEventsByType(EventType.INVALID_ACTION)).hasSize(1);
        assertThat(game.findPlayer("Susan").getHistory())
                .anyMatch(info -> info.startsWith("Storyteller: your last answer was invalid"));
    }

    @Test
    @DisplayName("대상 수가 틀린 응답만 계속 오면 밤 능력을 건너뛴다")
    void nightChoiceGivesUp() {
        GameState game = fixture.build();
        fixture.agent("Susan").choose("John", "Emma").choose("John", "Emma").choose("John", "Emma");

        Optional<List<GamePlayer>> targets = gateway.requestNightTargets(game, game.findPlayer("Susan"),
                "Choose a player", 1, GamePlayer::isAlive);

        assertThat(targets).isEmpty();
        assertThat(game.getEventLog().getEventsByType(EventType.INVALID_ACTION)).hasSize(3);
    }

    @Test
    @DisplayName("허용되지 않은 대상은 잘못된 응답으로 처리된다")
    void rejectsDisallowedTarget() {
        GameState game = fixture.build();
        game.findPlayer("Emma").setAlive(false);
        fixture.agent("Susan").choose("Emma").choose("John");

        Optional<List<GamePlayer>> targets = gateway.requestNightTargets(game, game.findPlayer("Susan"),
                "Choose a player", 1, GamePlayer::isAlive);

        assertThat(targets.orElseThrow()).containsExactly(game.findPlayer("John"));
    }

    @Test
    @DisplayName("후보가 부족하면 묻지 않고 빈 값을 돌려준다")
    void notEnoughCandidates() {
        GameState game = fixture.build();

        Optional<List<GamePlayer>> targets = gateway.requestNightTargets(game, game.findPlayer("Susan"),
                "Choose two players", 2, player -> player.getName().equals("John"));

        assertThat(targets).isEmpty();
        assertThat(game.getEventLog().getEvents()).isEmpty();
    }

    @Test
    @DisplayName("낮 행동 응답이 계속 실패하면 DecisionFailedException")
    void dayActionExhausted() {
        GameState game = fixture.build();
        GamePlayer susan = game.findPlayer("Susan");
        susan.setAgent(request -> {
            throw new IllegalStateException("offline");
        });

        assertThatThrownBy(() -> gateway.requestDayAction(game, susan, EnumSet.of(DayActionType.PASS)))
                .isInstanceOf(DecisionFailedException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("지금 할 수 없는 낮 행동은 거부되고 다시 묻는다")
    void rejectsUnavailableAction() {
        GameState game = fixture.build();
        fixture.agent("John").onDay(new Decision.Nominate("Susan", "", ""));

        Decision decision = gateway.requestDayAction(game, game.findPlayer("John"),
                Set.of(DayActionType.PASS, DayActionType.SEND_MESSAGE));

        assertThat(decision).isInstanceOf(Decision.Pass.class);
        assertThat(game.getEventLog().getEventsByType(EventType.INVALID_ACTION)).hasSize(1);
    }

    @Test
    @DisplayName("투표 대신 다른 응답만 오면 반대표로 처리된다")
    void voteFallsBackToNo() {
        GameState game = fixture.build();
        GamePlayer emma = game.findPlayer("Emma");
        emma.setAgent(request -> new Decision.Pass("not voting"));

        Decision.CastVote vote = gateway.requestVote(game, emma, voteContext);

        assertThat(vote.yes()).isFalse();
        assertThat(game.getEventLog().getEventsByType(EventType.INVALID_ACTION)).hasSize(3);
    }

    @Test
    @DisplayName("올바른 찬성표는 그대로 돌려준다")
    void validVote() {
        GameState game = fixture.build();
        fixture.agent("Emma").votesYes(1);

        assertThat(gateway.requestVote(game, game.findPlayer("Emma"), voteContext).yes()).isTrue();
    }
}
