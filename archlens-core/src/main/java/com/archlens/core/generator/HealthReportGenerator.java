package com.archlens.core.generator;

import com.archlens.core.model.AnalysisIssue;
import com.archlens.core.model.ArchitectureGraph;
import com.archlens.core.model.IssueSeverity;
import com.archlens.core.model.Node;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes analysis issues as a Markdown health report.
 *
 * <p>Critical and high issues come first, critical before high, each with links that
 * focus the implicated nodes ({@code command:archlens.focusNode?<url-encoded JSON id>}).
 * Medium and low issues follow as a flat list tagged with their kind. A graph without
 * issues gets a clean bill.
 *
 * <p>The timestamp is read from the injected {@link Clock}.
 */
public class HealthReportGenerator {

    public static final String FOCUS_COMMAND = "command:archlens.focusNode?";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private static final String TITLE = "# ArchLens Architecture Health Report\n\n";
    private static final String CLEAN_BILL = "✅ No architecture defects found. The structure is clean.\n";
    private static final String FOOTER = "\n---\n*Generated by the ArchLens graph health analyzer.*\n";

    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HealthReportGenerator() {
        this(Clock.systemDefaultZone());
    }

    public HealthReportGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Generates the report.
     *
     * @param issues issues in analyzer order
     * @param graph analyzed graph, used to label node links
     * @return Markdown report
     */
    public String generateReport(List<AnalysisIssue> issues, ArchitectureGraph graph) {
        Objects.requireNonNull(issues, "issues must not be null");
        Objects.requireNonNull(graph, "graph must not be null");

        StringBuilder sb = new StringBuilder(TITLE);
        sb.append("Generated: ").append(ZonedDateTime.now(clock).format(TIMESTAMP_FORMAT)).append("\n\n");

        if (issues.isEmpty()) {
            sb.append(CLEAN_BILL);
            sb.append(FOOTER);
            return sb.toString();
        }

        List<AnalysisIssue> criticals = withSeverity(issues, IssueSeverity.CRITICAL);
        List<AnalysisIssue> highs = withSeverity(issues, IssueSeverity.HIGH);
        List<AnalysisIssue> others = issues.stream()
            .filter(issue -> issue.severity() != IssueSeverity.CRITICAL && issue.severity() != IssueSeverity.HIGH)
            .toList();

        sb.append("## 🚨 Major Risks (").append(criticals.size() + highs.size()).append(")\n\n");
        appendMajor(sb, criticals, "🔴", graph);
        appendMajor(sb, highs, "🟠", graph);

        if (!others.isEmpty()) {
            sb.append("## ⚠️ Notes and Bottlenecks (").append(others.size()).append(")\n\n");
            for (AnalysisIssue issue : others) {
                sb.append("- [").append(issue.kind().value().toUpperCase(Locale.ROOT)).append("] ")
                    .append(issue.message()).append('\n');
            }
        }

        sb.append(FOOTER);
        return sb.toString();
    }

    private void appendMajor(StringBuilder sb, List<AnalysisIssue> issues, String icon, ArchitectureGraph graph) {
        for (AnalysisIssue issue : issues) {
            sb.append("### ").append(icon).append(' ').append(issue.message()).append('\n');
            String links = issue.nodeIds().stream()
                .map(id -> "[`" + graph.findNode(id).map(Node::label).orElse(id) + "`](" + focusLink(id) + ")")
                .collect(Collectors.joining(", "));
            sb.append("- Related nodes: ").append(links.isEmpty() ? "none" : links).append("\n\n");
        }
    }

    /**
     * Returns the focus link of a node id.
     *
     * @param nodeId node id
     * @return {@code command:archlens.focusNode?} followed by the URL-encoded JSON string of the id
     */
    public String focusLink(String nodeId) {
        try {
            return FOCUS_COMMAND + encodeComponent(objectMapper.writeValueAsString(nodeId));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode node id: " + nodeId, e);
        }
    }

    private static List<AnalysisIssue> withSeverity(List<AnalysisIssue> issues, IssueSeverity severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).toList();
    }

    // URI component encoding: URLEncoder form encoding, minus '+' for spaces and with !'()~ left as is.
    private static String encodeComponent(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("%21", "!")
            .replace("%27", "'")
            .replace("%28", "(")
            .replace("%29", ")")
            .replace("%7E", "~");
    }
}
