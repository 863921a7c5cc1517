package com.deepansh.foundry.tool;

import com.deepansh.foundry.config.McpProperties;
import com.deepansh.foundry.exception.InvalidToolArgumentsException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses raw tool-call arguments and repairs known model quirks before dispatch.
 *
 * Only one repair exists today: some completions send {@code search_repositories}
 * a sort-only query such as "sort:updated-desc", which the GitHub search endpoint
 * rejects as invalid syntax. Sort tokens are stripped, and if nothing is left the
 * query becomes a recency filter ({@code pushed:>=YYYY-MM-DD}).
 *
 * Every other tool passes through unchanged.
 */
@Component
@Slf4j
public class ArgumentNormalizer {

    static final String QUERY_FIELD = "query";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int recencyWindowDays;
    private final Set<String> strippedSortTokens;

    public ArgumentNormalizer(ObjectMapper objectMapper, McpProperties props, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.recencyWindowDays = props.getNormalizer().getRecencyWindowDays();
        this.strippedSortTokens = props.getNormalizer().getStrippedSortTokens().stream()
                .map(token -> token.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @param toolName     tool the arguments belong to (may be unknown to the catalog)
     * @param rawArguments JSON text as emitted by the model; blank means "no arguments"
     * @return parsed, repaired arguments
     * @throws InvalidToolArgumentsException if rawArguments is not parseable JSON
     */
    public JsonNode normalize(String toolName, String rawArguments) {
        JsonNode arguments = parse(toolName, rawArguments);

        if (GitHubTools.SEARCH_REPOSITORIES.equals(toolName) && arguments.isObject()) {
            repairSearchQuery((ObjectNode) arguments);
        }
        return arguments;
    }

    private JsonNode parse(String toolName, String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode parsed = objectMapper.readTree(rawArguments);
            return parsed != null ? parsed : objectMapper.createObjectNode();
        } catch (JsonProcessingException e) {
            throw new InvalidToolArgumentsException(toolName,
                    "Arguments for '" + toolName + "' are not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private void repairSearchQuery(ObjectNode arguments) {
        JsonNode queryNode = arguments.get(QUERY_FIELD);
        String original = queryNode != null && queryNode.isTextual() ? queryNode.asText() : "";

        String cleaned = stripSortTokens(original);
        if (cleaned.isEmpty()) {
            cleaned = defaultRecencyQuery();
        }

        if (!cleaned.equals(original)) {
            log.warn("Rewrote [{}] query: sort-only or empty query replaced", GitHubTools.SEARCH_REPOSITORIES);
            arguments.put(QUERY_FIELD, cleaned);
        }
    }

    String stripSortTokens(String query) {
        List<String> kept = Arrays.stream(query.trim().split("\\s+"))
                .filter(token -> !token.isEmpty())
                .filter(token -> !strippedSortTokens.contains(token.toLowerCase(Locale.ROOT)))
                .toList();
        return String.join(" ", kept).trim();
    }

    String defaultRecencyQuery() {
        LocalDate since = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(recencyWindowDays);
        return "pushed:>=" + since.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }
}
