package com.example.clocktower.game.service;

import com.example.clocktower.agent.Decision;
import com.example.clocktower.agent.DecisionGateway;
import com.example.clocktower.agent.DecisionRequest;
import com.example.clocktower.event.EventType;
import com.example.clocktower.game.domain.Character;
import com.example.clocktower.game.domain.CharacterType;
import com.example.clocktower.game.domain.ChoppingBlock;
import com.example.clocktower.game.domain.GamePlayer;
import com.example.clocktower.game.domain.GameState;
import com.example.clocktower.game.domain.ReminderToken;
import com.example.clocktower.game.domain.Vote;
import com.example.clocktower.game.domain.VoteRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 지명 한 건을 처리한다: 검증, 버진 능력, 투표, 처형대 갱신
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NominationService {

    private final DecisionGateway decisionGateway;
    private final StatusResolver statusResolver;
    private final DeathService deathService;

    /**
     * @return 버진 능력으로 지명자가 처형되어 낮이 즉시 끝났는지 여부
     */
    public boolean runNomination(GameState gameState, GamePlayer nominator, GamePlayer nominee, String publicReasoning) {
        Optional<String> rejection = validate(gameState, nominator, nominee);
        if (rejection.isPresent()) {
            log.warn("[지명] 거부: nominator={}, nominee={}, reason={}", nominator, nominee, rejection.get());
            gameState.record(EventType.NOMINATION_REJECTED, "Nomination rejected: " + rejection.get(),
                    participants(nominator, nominee));
            return false;
        }

        nominee.setNominatedToday(true);
        nominator.setUsedNomination(true);

        if (nominee.actsAs(Character.VIRGIN) && !gameState.getTokens().has(ReminderToken.VIRGIN_POWER_USED)) {
            if (resolveVirgin(gameState, nominator, nominee)) {
                return true;
            }
        }

        ChoppingBlock block = gameState.getChoppingBlock();
        gameState.broadcast("Storyteller: " + nominator.getName() + " has nominated " + nominee.getName()
                + " for execution. Their reason is: " + nullToEmpty(publicReasoning) + " " + describeBlock(block));
        gameState.record(EventType.NOMINATION, nominator.getName() + " nominated " + nominee.getName(),
                List.of(nominator.getName(), nominee.getName()),
                Map.of("nominator", nominator.getName(), "nominee", nominee.getName()));

        int requiredToNominate;
        Integer requiredToTie;
        if (block == null) {
            int aliveCount = gameState.getPlayers().countAlive();
            requiredToNominate = (aliveCount + 1) / 2;
            requiredToTie = null;
        } else {
            requiredToNominate = block.voteCount() + 1;
            requiredToTie = block.voteCount();
        }

        List<VoteRecord> votes = collectVotes(gameState, nominee, requiredToNominate, requiredToTie);
        int yesCount = (int) votes.stream().filter(vote -> vote.vote() == Vote.YES).count();
        tally(gameState, nominee, yesCount, requiredToNominate, requiredToTie, votes);
        return false;
    }

    private Optional<String> validate(GameState gameState, GamePlayer nominator, GamePlayer nominee) {
        if (nominator == null || nominee == null) {
            return Optional.of("unknown player");
        }
        if (!gameState.isNominationsOpen()) {
            return Optional.of("nominations are not open");
        }
        if (!nominator.isAlive()) {
            return Optional.of(nominator.getName() + " is dead and cannot nominate");
        }
        if (!nominee.isAlive()) {
            return Optional.of(nominee.getName() + " is already dead");
        }
        if (nominator.isUsedNomination()) {
            return Optional.of(nominator.getName() + " has already nominated today");
        }
        if (nominee.isNominatedToday()) {
            return Optional.of(nominee.getName() + " has already been nominated today");
        }
        return Optional.empty();
    }

    /**
     * 버진 능력은 처음 지명될 때 결과와 관계없이 소모된다.
     *
     * @return 지명자가 처형되었는지 여부
     */
    private boolean resolveVirgin(GameState gameState, GamePlayer nominator, GamePlayer virgin) {
        gameState.getTokens().place(ReminderToken.VIRGIN_POWER_USED, virgin);
        boolean triggers = !statusResolver.isImpaired(gameState, virgin)
                && nominator.registersAs(CharacterType.TOWNSFOLK);

        gameState.record(EventType.VIRGIN_POWER,
                virgin.getName() + " (Virgin) was nominated by " + nominator.getName()
                        + (triggers ? ", the nominator is executed" : ", nothing happens"),
                List.of(virgin.getName(), nominator.getName()), Map.of("triggered", triggers));
        if (!triggers) {
            return false;
        }

        log.info("[버진] 지명자 즉시 처형: nominator={}, virgin={}", nominator.getName(), virgin.getName());
        gameState.broadcast("Storyteller: " + nominator.getName() + " nominated " + virgin.getName()
                + " and was immediately executed. The day is over.");
        deathService.execute(gameState, nominator);
        gameState.clearChoppingBlock();
        return true;
    }

    private List<VoteRecord> collectVotes(GameState gameState, GamePlayer nominee, int requiredToNominate,
                                          Integer requiredToTie) {
        List<VoteRecord> votes = new ArrayList<>();
        Map<GamePlayer, Vote> castBy = new HashMap<>();
        int count = 0;

        for (GamePlayer voter : gameState.getPlayers().inSeatingOrderFrom(nominee)) {
            Vote vote;
            String reasoning = "";
            if (!voter.canVoteYes()) {
                vote = Vote.CANT_VOTE;
            } else {
                DecisionRequest.VoteContext context = new DecisionRequest.VoteContext(
                        nominee.getName(), count, requiredToNominate, requiredToTie, List.copyOf(votes));
                Decision.CastVote cast = decisionGateway.requestVote(gameState, voter, context);
                reasoning = nullToEmpty(cast.publicReasoning());
                vote = cast.yes() ? Vote.YES : Vote.NO;

                if (vote == Vote.YES && isBoundButler(gameState, voter)
                        && !masterVotedYes(gameState, castBy)) {
                    log.debug("[버틀러] 주인이 찬성하지 않아 반대 처리: butler={}", voter.getName());
                    gameState.tellPrivately(voter, "Storyteller: Your master has not voted yes, so your vote is NO.");
                    vote = Vote.NO;
                }
                if (vote == Vote.YES) {
                    count++;
                    if (!voter.isAlive()) {
                        voter.setUsedGhostVote(true);
                    }
                }
            }

            castBy.put(voter, vote);
            votes.add(new VoteRecord(voter.getName(), vote, reasoning));
            gameState.record(EventType.VOTING, voter.getName() + " voted " + vote + " on " + nominee.getName(),
                    List.of(voter.getName(), nominee.getName()), Map.of("vote", vote.name()));
        }

        gameState.getTokens().consume(ReminderToken.BUTLER_MASTER);
        return votes;
    }

    private boolean isBoundButler(GameState gameState, GamePlayer voter) {
        return voter.getCharacter() == Character.BUTLER
                && gameState.getTokens().has(ReminderToken.BUTLER_MASTER)
                && !statusResolver.isImpaired(gameState, voter);
    }

    private boolean masterVotedYes(GameState gameState, Map<GamePlayer, Vote> castBy) {
        return gameState.getTokens().get(ReminderToken.BUTLER_MASTER)
                .map(master -> castBy.get(master) == Vote.YES)
                .orElse(true);
    }

    private void tally(GameState gameState, GamePlayer nominee, int yesCount, int requiredToNominate,
                       Integer requiredToTie, List<VoteRecord> votes) {
        String record = formatVotes(votes);
        String outcome;
        if (yesCount >= requiredToNominate) {
            gameState.setChoppingBlock(new ChoppingBlock(yesCount, nominee));
            outcome = "placed";
            gameState.broadcast("Storyteller: " + nominee.getName() + " has been nominated for execution with "
                    + yesCount + " votes. They will die at the end of the day if no one else is nominated. "
                    + "Vote record: " + record);
        } else if (requiredToTie != null && yesCount == requiredToTie) {
            gameState.clearChoppingBlock();
            outcome = "tied";
            gameState.broadcast("Storyteller: " + nominee.getName() + " has received " + yesCount
                    + " votes. This ties the previous nominee. The chopping block is now empty. Vote record: "
                    + record);
        } else {
            outcome = "failed";
            gameState.broadcast("Storyteller: " + nominee.getName() + " has received " + yesCount
                    + " votes, which is not enough. Vote record: " + record);
        }

        log.info("[지명결과] nominee={}, yes={}, required={}, tie={}, outcome={}",
                nominee.getName(), yesCount, requiredToNominate, requiredToTie, outcome);
        gameState.record(EventType.NOMINATION_RESULT,
                nominee.getName() + " received " + yesCount + " votes (" + outcome + ")",
                List.of(nominee.getName()),
                Map.of("votes", yesCount, "required", requiredToNominate, "outcome", outcome));
    }

    private String describeBlock(ChoppingBlock block) {
        if (block == null) {
            return "The chopping block is empty.";
        }
        return block.nominee().getName() + " is on the chopping block with " + block.voteCount() + " votes.";
    }

    private String formatVotes(List<VoteRecord> votes) {
        return votes.stream()
                .map(vote -> vote.voter() + ": " + vote.vote())
                .collect(Collectors.joining(", "));
    }

    private List<String> participants(GamePlayer nominator, GamePlayer nominee) {
        List<String> names = new ArrayList<>();
        if (nominator != null) {
            names.add(nominator.getName());
        }
        if (nominee != null) {
            names.add(nominee.getName());
        }
        return names;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
