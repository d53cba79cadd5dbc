package com.example.clocktower.game.domain;

import com.example.clocktower.event.EventType;
import com.example.clocktower.event.GameEventLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 게임 한 판의 전체 상태. 엔진 서비스는 상태를 갖지 않고 이 객체를 넘겨받는다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameState {

    private String gameId;

    private Script script;

    private Players players;

    // 좌석 배치, 이름 배정, 거짓 정보 생성 등 모든 무작위는 이 객체에서만 뽑는다
    private Random random;

    private GameEventLog eventLog;

    @Builder.Default
    private int roundNumber = 1;

    @Builder.Default
    private Phase phase = Phase.SETUP;

    @Builder.Default
    private ReminderTokens tokens = new ReminderTokens();

    @Builder.Default
    private PoisonGraph poisonGraph = new PoisonGraph();

    private ChoppingBlock choppingBlock;

    @Builder.Default
    private boolean nominationsOpen = false;

    // 하루 처형은 한 번뿐이다 (버진 능력 포함)
    @Builder.Default
    private boolean executedToday = false;

    @Builder.Default
    private GameOutcome outcome = GameOutcome.IN_PROGRESS;

    public GamePlayer findPlayer(String name) {
        return players.findByName(name);
    }

    public List<GamePlayer> getPlayerList() {
        return players.getAsList();
    }

    public boolean isOver() {
        return outcome != GameOutcome.IN_PROGRESS;
    }

    public void clearChoppingBlock() {
        this.choppingBlock = null;
    }

    // ==================== 이벤트 / 정보 전달 ====================

    public void record(EventType type, String description, List<String> participants, Map<String, Object> metadata) {
        eventLog.add(type, description, roundNumber, phase, participants, metadata);
    }

    public void record(EventType type, String description, List<String> participants) {
        record(type, description, participants, Map.of());
    }

    /**
     * 특정 플레이어에게만 비공개 정보를 전달한다.
     */
    public void tellPrivately(GamePlayer player, String info) {
        player.giveInfo(info);
    }

    /**
     * 모든 플레이어(사망자 포함)에게 공개 정보를 전달한다.
     */
    public void broadcast(String info) {
        players.getAsList().forEach(player -> player.giveInfo(info));
        record(EventType.INFO_BROADCAST, info, List.of());
    }
}
