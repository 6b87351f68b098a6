package com.agentorchestra.orchestrator.capability.claude;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the structured answer out of a Claude reply.
 *
 * Agents are told to wrap their JSON in {@code <result>...</result>};
 * some reply with a fenced {@code ```json} block instead, so both are
 * recognised.
 */
public class ResponseParser {

    // Matches ```json ... ``` or ``` ... ``` (with optional language label)
    private static final Pattern JSON_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n```",
            Pattern.DOTALL
    );

    // Matches <result>...</result>
    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Extract the first fenced block from a reply.
     * Returns Optional.empty() if the reply contains no fence.
     */
    public static Optional<String> extractJsonBlock(String response) {
        Matcher m = JSON_BLOCK.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /**
     * Extract the content of the first {@code <result>} tag.
     *
     * Example reply:
     *   "Here is the analysis:
     *    <result>{"summary": "Spring Boot service", "structure": {...}}</result>"
     */
    public static Optional<String> extractResult(String response) {
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /**
     * Best candidate for the JSON payload: the result tag, else the first
     * fenced block, else the whole reply stripped.
     */
    public static String extractPayload(String response) {
        if (response == null) {
            return "";
        }
        return extractResult(response)
                .or(() -> extractJsonBlock(response))
                .orElse(response.strip());
    }
}
