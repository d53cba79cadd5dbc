package com.example.clocktower.agent;

import com.example.clocktower.game.domain.VoteRecord;
import com.example.clocktower.global.client.GeminiApiClient;
import com.example.clocktower.global.error.ErrorCode;
import com.example.clocktower.global.error.InvalidDecisionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Gemini 로 결정을 내리는 플레이어. 응답은 JSON 객체 하나여야 한다.
 */
@Slf4j
@RequiredArgsConstructor
public class GeminiDecisionProvider implements DecisionProvider {

    private final GeminiApiClient geminiApiClient;
    private final ObjectMapper objectMapper;

    @Override
    public Decision decide(DecisionRequest request) {
        String answer = geminiApiClient.generateJson(buildPrompt(request));
        if (answer == null || answer.isBlank()) {
            throw new InvalidDecisionException(ErrorCode.MALFORMED_DECISION, "empty LLM answer");
        }
        try {
            return parse(request.kind(), objectMapper.readTree(answer));
        } catch (JsonProcessingException e) {
            throw new InvalidDecisionException(ErrorCode.MALFORMED_DECISION, "not JSON: " + answer, e);
        }
    }

    Decision parse(DecisionKind kind, JsonNode node) {
        String privateReasoning = node.path("private_reasoning").asText("");
        String publicReasoning = node.path("public_reasoning").asText("");
        return switch (kind) {
            case VOTE -> {
                String vote = node.path("vote").asText("");
                if (!vote.equalsIgnoreCase("YES") && !vote.equalsIgnoreCase("NO")) {
                    throw new InvalidDecisionException(ErrorCode.MALFORMED_DECISION, "vote=" + vote);
                }
                yield new Decision.CastVote(vote.equalsIgnoreCase("YES"), privateReasoning, publicReasoning);
            }
            case NIGHT_CHOICE -> new Decision.ChooseNightTargets(names(node.path("players")), privateReasoning);
            case DAY_ACTION -> switch (node.path("action").asText("")) {
                case "send_message" -> new Decision.SendMessage(names(node.path("recipients")),
                        node.path("message").asText(""));
                case "nominate" -> new Decision.Nominate(node.path("player").asText(null),
                        privateReasoning, publicReasoning);
                case "slayer_power" -> new Decision.UseCounterAbility(node.path("target").asText(null),
                        privateReasoning, publicReasoning);
                case "pass" -> new Decision.Pass(privateReasoning);
                default -> throw new InvalidDecisionException(ErrorCode.MALFORMED_DECISION,
                        "unknown action " + node.path("action").asText(""));
            };
        };
    }

    private List<String> names(JsonNode array) {
        List<String> names = new ArrayList<>();
        array.forEach(element -> names.add(element.asText()));
        return names;
    }

    private String buildPrompt(DecisionRequest request) {
        DecisionRequest.PlayerView self = request.self();
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are playing Blood on the Clocktower (Trouble Brewing).\n")
                .append("Your name is ").append(self.name())
                .append(". Your character is ").append(self.character().getDisplayName())
                .append(" (").append(self.character().getAbility()).append(")")
                .append(". You are on the ").append(self.alignment()).append(" team")
                .append(self.alive() ? ".\n" : " and you are dead.\n");
        prompt.append("Round ").append(request.publicState().roundNumber())
                .append(", phase ").append(request.publicState().phase()).append(".\n");
        prompt.append("Players in seating order: ")
                .append(request.publicState().players().stream()
                        .map(p -> p.name() + (p.alive() ? "" : " (dead)"))
                        .collect(Collectors.joining(", ")))
                .append("\n");
        if (request.publicState().choppingBlockNominee() != null) {
            prompt.append("On the chopping block: ").append(request.publicState().choppingBlockNominee())
                    .append(" with ").append(request.publicState().choppingBlockVotes()).append(" votes.\n");
        }
        prompt.append("What you have learned so far:\n");
        self.history().forEach(line -> prompt.append("- ").append(line).append("\n"));
        prompt.append("\n").append(request.prompt()).append("\n");

        switch (request.kind()) {
            case DAY_ACTION -> prompt.append("Available actions: ").append(request.availableActions())
                    .append(". Answer with one JSON object, one of:\n")
                    .append("{\"action\":\"send_message\",\"recipients\":[names],\"message\":text}\n")
                    .append("{\"action\":\"nominate\",\"player\":name,\"private_reasoning\":text,\"public_reasoning\":text}\n")
                    .append("{\"action\":\"slayer_power\",\"target\":name,\"private_reasoning\":text,\"public_reasoning\":text}\n")
                    .append("{\"action\":\"pass\",\"private_reasoning\":text}\n");
            case VOTE -> {
                DecisionRequest.VoteContext vote = request.voteContext();
                prompt.append(vote.requiredToNominate()).append(" votes are required to execute.");
                if (vote.requiredToTie() != null) {
                    prompt.append(" ").append(vote.requiredToTie()).append(" votes tie the current nominee.");
                }
                prompt.append("\nVotes so far:\n");
                for (VoteRecord previous : vote.previousVotes()) {
                    prompt.append("- ").append(previous.voter()).append(": ").append(previous.vote())
                            .append(" (").append(previous.publicReasoning()).append(")\n");
                }
                prompt.append("Answer {\"vote\":\"YES\"|\"NO\",\"private_reasoning\":text,\"public_reasoning\":text}\n");
            }
            case NIGHT_CHOICE -> prompt.append("Choose exactly ").append(request.targetCount())
                    .append(" of ").append(request.candidates())
                    .append(". Answer {\"players\":[names],\"private_reasoning\":text}\n");
        }
        return prompt.toString();
    }
}
