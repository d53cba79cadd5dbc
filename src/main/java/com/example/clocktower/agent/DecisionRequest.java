package com.example.clocktower.agent;

import com.example.clocktower.game.domain.Alignment;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.VoteRecord;
import lombok.Builder;

import java.util.List;
import java.util.Set;

/**
 * 의사결정 제공자에게 넘기는 읽기 전용 요청
 */
@Builder
public record DecisionRequest(
        DecisionKind kind,
        PlayerView self,
        PublicGameState publicState,
        String prompt,
        Set<DayActionType> availableActions,
        List<String> candidates,
        int targetCount,
        VoteContext voteContext) {

    /**
     * 요청 대상 플레이어 본인이 알고 있는 정보
     */
    public record PlayerView(
            String name,
            Character character,
            Alignment alignment,
            boolean alive,
            boolean usedGhostVote,
            boolean usedNomination,
            int messagesLeft,
            List<String> history) {

        public static PlayerView of(GamePlayer player) {
            return new PlayerView(
                    player.getName(),
                    player.getBelievedCharacter(),
                    player.getAlignment(),
                    player.isAlive(),
                    player.isUsedGhostVote(),
                    player.isUsedNomination(),
                    player.getMessagesLeft(),
                    List.copyOf(player.getHistory()));
        }
    }

    public record VoteContext(
            String nominee,
            int currentTally,
            int requiredToNominate,
            Integer requiredToTie,
            List<VoteRecord> previousVotes) {
    }
}
