package com.company.scheduler.service;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryResponseParserTest {

    private final SummaryResponseParser parser = new SummaryResponseParser();

    @Test
    void shouldParseFencedJson() {
        String raw = """
                ```json
                {"executiveSummary": "Mostly on track.",
                 "a3Summary": "Two cases open.",
                 "areasOfConcern": [{"metricName": "Uptime", "groupName": "Ops",
                                     "issue": "Missed 3 periods", "suggestion": "Open a case"}],
                 "extra": true}
                ```""";

        Optional<SummaryResponse> parsed = parser.parse(raw);

        assertThat(parsed).isPresent();
        assertThat(parsed.get().getExecutiveSummary()).isEqualTo("Mostly on track.");
        assertThat(parsed.get().getCaseSummary()).isEqualTo("Two cases open.");
        assertThat(parsed.get().getAreasOfConcern()).singleElement()
                .extracting(SummaryResponse.Concern::getMetricName).isEqualTo("Uptime");
    }

    @Test
    void shouldDefaultMissingConcernsToEmptyList() {
        Optional<SummaryResponse> parsed = parser.parse("{\"executiveSummary\": \"Fine\", \"areasOfConcern\": null}");

        assertThat(parsed).isPresent();
        assertThat(parsed.get().getAreasOfConcern()).isEmpty();
        assertThat(parsed.get().hasCaseSummary()).isFalse();
    }

    @Test
    void shouldRejectReplyWithoutExecutiveSummary() {
        assertThat(parser.parse("{\"a3Summary\": \"x\"}")).isEmpty();
        assertThat(parser.parse("{\"executiveSummary\": \"   \"}")).isEmpty();
    }

    @Test
    void shouldRejectNonObjectReplies() {
        assertThat(parser.parse("Here is your summary: all good")).isEmpty();
        assertThat(parser.parse("[1, 2, 3]")).isEmpty();
        assertThat(parser.parse("null")).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }
}
