package com.example.clocktower.game.domain;

import com.example.clocktower.agent.DecisionProvider;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 좌석에 앉은 플레이어 한 명. 동일성은 객체 참조로 판단한다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GamePlayer {

    private String name;

    private Character character;

    private Alignment alignment;

    // 드렁크가 자신이라고 믿는 Townsfolk
    private Character drunkCharacter;

    @Builder.Default
    private boolean alive = true;

    @Builder.Default
    private boolean nominatedToday = false;

    @Builder.Default
    private boolean usedNomination = false;

    @Builder.Default
    private boolean usedGhostVote = false;

    // 슬레이어 능력 시도 여부 (누구나 한 번 시도 가능)
    @Builder.Default
    private boolean usedCounterAbility = false;

    @Builder.Default
    private int messagesLeft = 0;

    @Builder.Default
    private List<String> history = new ArrayList<>();

    @JsonIgnore
    private DecisionProvider agent;

    public static GamePlayer of(String name, Character character) {
        return GamePlayer.builder()
                .name(name)
                .character(character)
                .alignment(character.getDefaultAlignment())
                .build();
    }

    public CharacterType getType() {
        return character.getType();
    }

    /**
     * 자신이 알고 있는 캐릭터 (드렁크는 믿고 있는 캐릭터)
     */
    public Character getBelievedCharacter() {
        return drunkCharacter != null ? drunkCharacter : character;
    }

    /**
     * 해당 캐릭터로서 밤에 깨어나는지 여부
     */
    public boolean actsAs(Character target) {
        return character == target || drunkCharacter == target;
    }

    /**
     * 다른 플레이어의 능력에 보이는 진영
     */
    public Alignment getApparentAlignment() {
        if (character == Character.RECLUSE) {
            return Alignment.EVIL;
        }
        if (character == Character.SPY) {
            return Alignment.GOOD;
        }
        return alignment;
    }

    public boolean isEvil() {
        return alignment == Alignment.EVIL;
    }

    public boolean isApparentlyEvil() {
        return getApparentAlignment() == Alignment.EVIL;
    }

    /**
     * 정보 능력에 대해 해당 분류로 보이는지 여부
     */
    public boolean registersAs(CharacterType type) {
        if (character.getType() == type) {
            return true;
        }
        return switch (character) {
            case RECLUSE -> type == CharacterType.MINION || type == CharacterType.DEMON;
            case SPY -> type == CharacterType.TOWNSFOLK || type == CharacterType.OUTSIDER;
            default -> false;
        };
    }

    public boolean canVoteYes() {
        return alive || !usedGhostVote;
    }

    public void giveInfo(String info) {
        history.add(info);
    }

    public List<String> getHistory() {
        return Collections.unmodifiableList(history);
    }

    public void startOfDay(int messagesPerDay) {
        this.nominatedToday = false;
        this.usedNomination = false;
        this.messagesLeft = messagesPerDay;
    }

    @Override
    public String toString() {
        return name;
    }
}
