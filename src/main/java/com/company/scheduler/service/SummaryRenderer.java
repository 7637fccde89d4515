package com.company.scheduler.service;

import com.company.scheduler.domain.PerformanceRow;
import com.company.scheduler.util.HtmlEscaper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

import static com.company.scheduler.util.HtmlEscaper.escape;

/**
 * Renders a parsed summary plus the statistics table as plain text and HTML.
 */
@Component
public class SummaryRenderer {

    static final String EMPTY_CELL = "—";
    static final double AT_RISK_ACHIEVEMENT = 200.0 / 3.0;

    private static final String TABLE_HEADER =
            "Group | Metric | Latest period | Last 2 periods | Last 3 periods | Linked cases | Target achievement %";
    private static final String TABLE_RULE =
            "----- | ------ | ------------- | -------------- | -------------- | ------------ | --------------------";

    public String renderText(SummaryResponse summary, List<PerformanceRow> rows) {
        StringBuilder text = new StringBuilder();
        text.append("Executive Overview:\n")
                .append(summary.getExecutiveSummary())
                .append("\n\n");

        if (summary.hasCaseSummary()) {
            text.append("Remediation Case Summary:\n")
                    .append(summary.getCaseSummary())
                    .append("\n\n");
        }

        if (!rows.isEmpty()) {
            text.append("Statistical Table:\n")
                    .append(TABLE_HEADER).append('\n')
                    .append(TABLE_RULE).append('\n');
            for (PerformanceRow row : rows) {
                text.append(row.getGroupName()).append(" | ")
                        .append(row.getMetricName()).append(" | ")
                        .append(row.hasLatestValue() ? row.getLatestActualDisplay() : EMPTY_CELL).append(" | ")
                        .append(row.isFail2() ? "Failing" : EMPTY_CELL).append(" | ")
                        .append(row.isFail3() ? "Failing" : EMPTY_CELL).append(" | ")
                        .append(row.isAtRisk() ? String.valueOf(row.getLinkedCaseCount()) : EMPTY_CELL).append(" | ")
                        .append(formatRate(row))
                        .append('\n');
            }
            text.append('\n');
        }

        if (!summary.getAreasOfConcern().isEmpty()) {
            text.append("Areas of Concern & Recommendations:\n");
            for (SummaryResponse.Concern concern : summary.getAreasOfConcern()) {
                text.append("- ").append(nullToEmpty(concern.getMetricName()))
                        .append(" (").append(nullToEmpty(concern.getGroupName())).append("): ")
                        .append(nullToEmpty(concern.getIssue()))
                        .append("\n  Suggestion: ").append(nullToEmpty(concern.getSuggestion()))
                        .append('\n');
            }
        }

        return text.toString();
    }

    public String renderHtml(SummaryResponse summary, List<PerformanceRow> rows) {
        StringBuilder html = new StringBuilder();
        html.append(HTML_HEAD)
                .append("<div class=\"summary-root\">\n")
                .append("<header class=\"summary-header\"><h1 class=\"summary-title\">Performance Summary &amp; Insights</h1>")
                .append("<div class=\"summary-tag\">Consecutive failing metrics</div></header>\n");

        html.append("<section class=\"card card-executive\"><h2 class=\"card-title\">Executive Overview</h2><p>")
                .append(escape(summary.getExecutiveSummary()))
                .append("</p></section>\n");

        if (!rows.isEmpty()) {
            html.append("<section class=\"card\"><h2 class=\"card-title\">Statistical Table</h2>")
                    .append("<table class=\"stats-table\"><thead><tr>")
                    .append("<th>Group</th><th>Metric</th><th>Latest period</th><th>Last 2 periods</th>")
                    .append("<th>Last 3 periods</th><th>Linked cases</th><th>Target achievement %</th>")
                    .append("</tr></thead><tbody>\n");
            for (PerformanceRow row : rows) {
                html.append("<tr>")
                        .append("<td>").append(escape(row.getGroupName())).append("</td>")
                        .append("<td>").append(escape(row.getMetricName())).append("</td>")
                        .append("<td>").append(latestCell(row)).append("</td>")
                        .append("<td>").append(row.isFail2() ? pill("status-warn", "Failing") : EMPTY_CELL).append("</td>")
                        .append("<td>").append(row.isFail3() ? pill("status-fail", "Failing") : EMPTY_CELL).append("</td>")
                        .append("<td>").append(linkedCell(row)).append("</td>")
                        .append("<td>").append(achievementCell(row)).append("</td>")
                        .append("</tr>\n");
            }
            html.append("</tbody></table></section>\n");
        }

        if (summary.hasCaseSummary()) {
            html.append("<section class=\"card card-cases\"><h2 class=\"card-title\">Remediation Case Summary</h2><p>")
                    .append(escape(summary.getCaseSummary()))
                    .append("</p></section>\n");
        }

        html.append("<section class=\"card card-concerns\"><h2 class=\"card-title\">Areas of Concern &amp; Recommendations</h2>\n");
        if (summary.getAreasOfConcern().isEmpty()) {
            html.append("<p class=\"empty-text\">No major areas of concern identified.</p>\n");
        } else {
            for (SummaryResponse.Concern concern : summary.getAreasOfConcern()) {
                html.append("<div class=\"concern-card\"><div class=\"concern-header\">")
                        .append("<span class=\"concern-metric\">").append(escape(concern.getMetricName())).append("</span>")
                        .append("<span class=\"concern-group\">").append(escape(concern.getGroupName())).append("</span>")
                        .append("</div><p class=\"concern-issue\">").append(escape(concern.getIssue())).append("</p>")
                        .append("<p class=\"concern-suggestion\">").append(escape(concern.getSuggestion())).append("</p>")
                        .append("</div>\n");
            }
        }
        html.append("</section>\n</div>\n</body>\n</html>");
        return html.toString();
    }

    /**
     * Minimal document wrapping escaped text with line breaks.
     */
    public String renderFallbackHtml(String text) {
        return "<!doctype html>\n<html lang=\"en\">\n<head>\n<meta charset=\"utf-8\" />\n"
                + "<title>Performance Summary</title>\n</head>\n<body>\n"
                + "<div style=\"font-family: system-ui, sans-serif; font-size: 14px; line-height: 1.6;\">\n"
                + HtmlEscaper.escapeWithLineBreaks(text == null ? "" : text)
                + "\n</div>\n</body>\n</html>";
    }

    private String latestCell(PerformanceRow row) {
        if (!row.hasLatestValue()) {
            return EMPTY_CELL;
        }
        String cssClass = Boolean.FALSE.equals(row.getLatestMet()) ? "status-fail" : "status-ok";
        return "<span class=\"status-pill " + cssClass + "\">" + escape(row.getLatestActualDisplay()) + "</span>";
    }

    private String linkedCell(PerformanceRow row) {
        if (!row.isAtRisk()) {
            return EMPTY_CELL;
        }
        if (row.getLinkedCaseCount() == 0) {
            return "<span class=\"circle-badge circle-badge-fail\">0</span>";
        }
        return "<span class=\"circle-badge circle-badge-ok\">" + row.getLinkedCaseCount() + "</span>";
    }

    private String achievementCell(PerformanceRow row) {
        if (row.getAchievementRate() == null) {
            return EMPTY_CELL;
        }
        String cssClass = row.getAchievementRate() < AT_RISK_ACHIEVEMENT ? "status-fail" : "status-ok";
        return "<span class=\"status-pill " + cssClass + "\">" + formatRate(row) + "</span>";
    }

    private static String pill(String cssClass, String label) {
        return "<span class=\"status-pill " + cssClass + "\"><span class=\"status-dot\"></span>" + label + "</span>";
    }

    static String formatRate(PerformanceRow row) {
        if (row.getAchievementRate() == null) {
            return EMPTY_CELL;
        }
        return String.format(Locale.ROOT, "%.0f%%", row.getAchievementRate());
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static final String HTML_HEAD = """
            <!doctype html>
            <html lang="en">
            <head>
              <meta charset="utf-8" />
              <title>Performance Summary &amp; Insights</title>
              <meta name="viewport" content="width=device-width, initial-scale=1" />
              <style>
                body { margin: 0; padding: 24px; background: #f3f4f6; color: #111827;
                       font-family: system-ui, -apple-system, "Segoe UI", sans-serif; }
                .summary-root { max-width: 1100px; margin: 0 auto; }
                .summary-header { padding: 16px 20px; border-radius: 16px; background: #eef2ff;
                                  border: 1px solid #e0e7ff; margin-bottom: 20px; }
                .summary-title { font-size: 18px; font-weight: 700; margin: 0; }
                .summary-tag { display: inline-block; margin-top: 4px; padding: 4px 8px; border-radius: 999px;
                               background: #ecfdf3; color: #166534; font-size: 11px; }
                .card { background: #ffffff; border-radius: 16px; border: 1px solid #e5e7eb;
                        padding: 20px 24px; margin-bottom: 20px; }
                .card-title { margin: 0 0 12px 0; font-size: 16px; font-weight: 700; color: #4f46e5; }
                .card p { margin: 0; font-size: 14px; line-height: 1.6; color: #6b7280; }
                .card-concerns { background: #fef2f2; border-color: #fecaca; }
                .concern-card { background: #ffffff; border-radius: 12px; border: 1px solid #fee2e2;
                                padding: 12px 14px; margin-bottom: 10px; }
                .concern-metric { font-size: 13px; font-weight: 700; margin-right: 6px; }
                .concern-group { font-size: 11px; padding: 2px 6px; border-radius: 999px; background: #f3f4f6; }
                .concern-issue { font-size: 13px; color: #b91c1c; }
                .concern-suggestion { font-size: 13px; font-style: italic; }
                .empty-text { font-size: 13px; color: #9ca3af; font-style: italic; }
                .stats-table { width: 100%; border-collapse: collapse; font-size: 12px; }
                .stats-table th, .stats-table td { padding: 8px 10px; border-bottom: 1px solid #e5e7eb; text-align: left; }
                .status-pill { display: inline-block; padding: 2px 8px; border-radius: 999px; font-size: 11px; }
                .status-dot { display: inline-block; width: 6px; height: 6px; border-radius: 999px;
                              margin-right: 4px; background: currentColor; }
                .status-ok { background: #ecfdf3; color: #166534; }
                .status-fail { background: #fef2f2; color: #b91c1c; }
                .status-warn { background: #fffbeb; color: #92400e; }
                .circle-badge { display: inline-block; width: 28px; height: 28px; line-height: 28px;
                                text-align: center; border-radius: 999px; font-size: 11px; font-weight: 600; }
                .circle-badge-ok { background: #ecfdf3; color: #166534; }
                .circle-badge-fail { background: #fef2f2; color: #b91c1c; }
              </style>
            </head>
            <body>
            """;
}
