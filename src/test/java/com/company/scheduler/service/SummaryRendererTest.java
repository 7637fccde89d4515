package com.company.scheduler.service;

import com.company.scheduler.domain.PerformanceRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryRendererTest {

    private final SummaryRenderer renderer = new SummaryRenderer();

    private static PerformanceRow failingRow() {
        return PerformanceRow.builder()
                .groupName("Ops")
                .metricName("Uptime <core>")
                .metricId("m1")
                .latestMet(false)
                .latestActualDisplay("91%")
                .fail2(true)
                .fail3(true)
                .achievementRate(50.0)
                .linkedCaseCount(0)
                .build();
    }

    private static PerformanceRow healthyRow() {
        return PerformanceRow.builder()
                .groupName("Ops")
                .metricName("Latency")
                .metricId("m2")
                .latestMet(true)
                .latestActualDisplay("120ms")
                .achievementRate(100.0)
                .build();
    }

    private static SummaryResponse summary(List<SummaryResponse.Concern> concerns) {
        return SummaryResponse.builder()
                .executiveSummary("Overall stable.")
                .caseSummary("One case in flight.")
                .areasOfConcern(new ArrayList<>(concerns))
                .build();
    }

    @Test
    void textShouldContainSectionsInOrder() {
        SummaryResponse summary = summary(List.of(
                new SummaryResponse.Concern("Uptime", "Ops", "Missed three periods", "Open a case")));

        String text = renderer.renderText(summary, List.of(failingRow(), healthyRow()));

        assertThat(text).startsWith("Executive Overview:\nOverall stable.\n\n");
        assertThat(text.indexOf("Remediation Case Summary:"))
                .isLessThan(text.indexOf("Statistical Table:"));
        assertThat(text.indexOf("Statistical Table:"))
                .isLessThan(text.indexOf("Areas of Concern & Recommendations:"));
        assertThat(text).contains("Ops | Uptime <core> | 91% | Failing | Failing | 0 | 50%");
        assertThat(text).contains("Ops | Latency | 120ms | — | — | — | 100%");
        assertThat(text).contains("- Uptime (Ops): Missed three periods\n  Suggestion: Open a case");
    }

    @Test
    void textShouldOmitEmptySections() {
        SummaryResponse summary = SummaryResponse.builder().executiveSummary("Quiet month.").build();

        String text = renderer.renderText(summary, List.of());

        assertThat(text).isEqualTo("Executive Overview:\nQuiet month.\n\n");
    }

    @Test
    void htmlShouldEscapeAndStyleCells() {
        String html = renderer.renderHtml(summary(List.of()), List.of(failingRow(), healthyRow()));

        assertThat(html).startsWith("<!doctype html>");
        assertThat(html).contains("Uptime &lt;core&gt;");
        assertThat(html).doesNotContain("Uptime <core>");
        assertThat(html).contains("<span class=\"status-pill status-fail\">91%</span>");
        assertThat(html).contains("<span class=\"status-pill status-ok\">120ms</span>");
        assertThat(html).contains("<span class=\"circle-badge circle-badge-fail\">0</span>");
        assertThat(html).contains("<span class=\"status-pill status-fail\">50%</span>");
        assertThat(html).contains("<span class=\"status-pill status-ok\">100%</span>");
        assertThat(html).contains("No major areas of concern identified.");
    }

    @Test
    void htmlShouldShowLinkedCaseCountAsOkBadge() {
        PerformanceRow row = failingRow();
        row.setLinkedCaseCount(3);

        String html = renderer.renderHtml(summary(List.of()), List.of(row));

        assertThat(html).contains("<span class=\"circle-badge circle-badge-ok\">3</span>");
    }

    @Test
    void achievementJustBelowTwoThirdsShouldBeFlagged() {
        PerformanceRow row = healthyRow();
        row.setAchievementRate(66.6);

        String html = renderer.renderHtml(summary(List.of()), List.of(row));

        assertThat(html).contains("<span class=\"status-pill status-fail\">67%</span>");
    }

    @Test
    void fallbackHtmlShouldEscapeAndBreakLines() {
        String html = renderer.renderFallbackHtml("line <1>\r\nline 2");

        assertThat(html).contains("line &lt;1&gt;<br />line 2");
        assertThat(renderer.renderFallbackHtml(null)).contains("<body>");
    }
}
