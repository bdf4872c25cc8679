package com.example.interview_orchestrator.oracle;

import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Performs exactly one oracle call and reduces the outcome to an {@link OracleReply}.
 * Transport errors never propagate past this class.
 */
@Slf4j
@Service
public class OracleGateway {

    private final TextGenerationOracle oracle;
    private final OracleJsonExtractor extractor;

    public OracleGateway(TextGenerationOracle oracle, OracleJsonExtractor extractor) {
        this.oracle = oracle;
        this.extractor = extractor;
    }

    public OracleReply call(String purpose, String prompt) {
        String raw;
        try {
            raw = oracle.generate(prompt);
        } catch (RuntimeException e) {
            log.warn("Oracle unavailable for {}: {}", purpose, e.getMessage());
            return OracleReply.unavailable(e.getMessage());
        }
        log.debug("Oracle output for {}: {}", purpose, raw);
        OracleReply reply = extractor.extract(raw);
        if (!reply.isOk()) {
            log.warn("Malformed oracle output for {}: {}", purpose, reply.detail());
        }
        return reply;
    }

    /**
     * Same contract as {@link #call} for prompts that ask for a bare JSON list. Empty on any failure.
     */
    public Optional<ArrayNode> callForList(String purpose, String prompt) {
        String raw;
        try {
            raw = oracle.generate(prompt);
        } catch (RuntimeException e) {
            log.warn("Oracle unavailable for {}: {}", purpose, e.getMessage());
            return Optional.empty();
        }
        log.debug("Oracle output for {}: {}", purpose, raw);
        Optional<ArrayNode> list = extractor.extractArray(raw);
        if (list.isEmpty()) {
            log.warn("Malformed oracle output for {}: no JSON list", purpose);
        }
        return list;
    }
}
