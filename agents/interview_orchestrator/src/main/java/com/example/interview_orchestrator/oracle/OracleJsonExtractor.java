package com.example.interview_orchestrator.oracle;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Optional;

/**
 * Finds the first well-formed JSON value in free text. Models like to wrap their JSON in prose
 * or markdown fences, so opening brackets are tried as candidate starts.
 */
@Slf4j
@Component
public class OracleJsonExtractor {

    // each failed candidate may read to the end of the text, so the number of tries is capped
    static final int MAX_CANDIDATES = 32;

    private final ObjectMapper objectMapper;

    public OracleJsonExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public OracleReply extract(String text) {
        if (!StringUtils.hasText(text)) {
            return OracleReply.malformed("oracle returned no text");
        }
        return firstValue(text, '{')
                .map(node -> OracleReply.ok((ObjectNode) node))
                .orElseGet(() -> OracleReply.malformed("no JSON object in oracle output"));
    }

    public Optional<ArrayNode> extractArray(String text) {
        if (!StringUtils.hasText(text)) {
            return Optional.empty();
        }
        return firstValue(text, '[').map(node -> (ArrayNode) node);
    }

    private Optional<JsonNode> firstValue(String text, char opening) {
        char[] chars = text.toCharArray();
        int from = text.indexOf(opening);
        for (int tries = 0; from >= 0 && tries < MAX_CANDIDATES; tries++) {
            try (JsonParser parser = objectMapper.getFactory().createParser(chars, from, chars.length - from)) {
                JsonNode node = objectMapper.readTree(parser);
                if (node != null && (opening == '{' ? node.isObject() : node.isArray())) {
                    return Optional.of(node);
                }
            } catch (IOException e) {
                log.trace("No JSON value at offset {}: {}", from, e.getMessage());
            }
            from = text.indexOf(opening, from + 1);
        }
        if (from >= 0) {
            log.debug("Gave up looking for JSON after {} candidates", MAX_CANDIDATES);
        }
        return Optional.empty();
    }
}
