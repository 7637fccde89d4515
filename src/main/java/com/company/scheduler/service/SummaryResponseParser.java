package com.company.scheduler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Objects;
import java.util.Optional;

/**
 * Strict parser for the upstream summary reply. Anything that is not a JSON
 * object with a non-blank executiveSummary yields an empty result, which
 * callers treat as "use the raw text".
 */
@Component
@Slf4j
public class SummaryResponseParser {

    private final ObjectMapper objectMapper;

    public SummaryResponseParser() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Optional<SummaryResponse> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        String clean = stripCodeFences(raw);
        try {
            SummaryResponse response = objectMapper.readValue(clean, SummaryResponse.class);
            if (response == null
                    || response.getExecutiveSummary() == null
                    || response.getExecutiveSummary().isBlank()) {
                log.debug("Summary reply has no executive summary, using raw text");
                return Optional.empty();
            }
            if (response.getAreasOfConcern() == null) {
                response.setAreasOfConcern(new ArrayList<>());
            } else {
                response.getAreasOfConcern().removeIf(Objects::isNull);
            }
            return Optional.of(response);
        } catch (JsonProcessingException e) {
            log.debug("Summary reply is not valid JSON, using raw text: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static String stripCodeFences(String raw) {
        return raw.replace("```json", "")
                .replace("```", "")
                .trim();
    }
}
