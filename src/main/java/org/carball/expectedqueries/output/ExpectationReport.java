package org.carball.expectedqueries.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.expectedqueries.analyzer.ExpectationEvaluator;
import org.carball.expectedqueries.analyzer.StatisticsAggregator;
import org.carball.expectedqueries.model.expectation.Violation;
import org.carball.expectedqueries.model.query.Query;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the outcome of one expectation check, as the text handed to the assertion sink
 * or as JSON for build artefacts.
 */
@Slf4j
public class ExpectationReport {

    public static final String TITLE = "Expected queries for tables";

    private final List<Query> queries;
    private final List<Violation> violations;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public ExpectationReport(List<Query> queries, List<Violation> violations) {
        this.queries = List.copyOf(queries);
        this.violations = List.copyOf(violations);
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public boolean isPassed() {
        return violations.isEmpty();
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public List<Query> getUnknownQueries() {
        return StatisticsAggregator.unknownQueries(queries);
    }

    /**
     * The message for the assertion sink. Unknown queries are listed in both outcomes.
     */
    public String toText() {
        if (isPassed()) {
            return TITLE + unknownWarning();
        }
        return TITLE + ":\n\n" + failureMessage() + unknownWarning();
    }

    /**
     * One block per violated table: its violation lines, then every query seen on it.
     */
    public String failureMessage() {
        StringBuilder message = new StringBuilder();
        for (Map.Entry<String, List<Violation>> table : violationsByTable().entrySet()) {
            message.append("* Table: ").append(table.getKey()).append('\n');
            message.append(table.getValue().stream()
                    .map(Violation::message)
                    .collect(Collectors.joining("\n")));
            message.append("\nActually executed SQL queries on table '").append(table.getKey()).append("':\n");
            message.append(StatisticsAggregator.queriesForTable(queries, table.getKey()).stream()
                    .map(Query::displaySql)
                    .collect(Collectors.joining("\n")));
            message.append("\n\n");
        }
        return message.toString();
    }

    public String unknownWarning() {
        List<Query> unknown = getUnknownQueries();
        if (unknown.isEmpty()) {
            return "";
        }
        return "\n\nWarning: unknown queries:\n"
                + unknown.stream().map(Query::displaySql).collect(Collectors.joining("\n"))
                + "\n";
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (Exception e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    private Map<String, List<Violation>> violationsByTable() {
        return violations.stream()
                .collect(Collectors.groupingBy(Violation::table, LinkedHashMap::new, Collectors.toList()));
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setTimestamp(timestamp);
        report.setPassed(isPassed());
        report.setTotalQueries(queries.size());

        report.setViolations(violations.stream()
                .map(violation -> {
                    ViolationEntry entry = new ViolationEntry();
                    entry.setTable(violation.table());
                    entry.setOperation(violation.operation().key());
                    entry.setStatistic(violation.statistic().key());
                    entry.setExpected(violation.expectedOutcome());
                    entry.setActual(ExpectationEvaluator.formatValue(violation.actualValue()));
                    entry.setMessage(violation.message());
                    entry.setQueries(StatisticsAggregator.queriesForTable(queries, violation.table()).stream()
                            .map(Query::sql)
                            .collect(Collectors.toList()));
                    return entry;
                })
                .collect(Collectors.toList()));

        report.setUnknownQueries(getUnknownQueries().stream()
                .map(Query::sql)
                .collect(Collectors.toList()));

        return report;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private LocalDateTime timestamp;
        private boolean passed;
        private int totalQueries;
        private List<ViolationEntry> violations;
        private List<String> unknownQueries;
    }

    @lombok.Data
    private static class ViolationEntry {
        private String table;
        private String operation;
        private String statistic;
        private String expected;
        private String actual;
        private String message;
        private List<String> queries;
    }
}
