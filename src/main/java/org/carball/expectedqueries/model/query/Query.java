package org.carball.expectedqueries.model.query;

import java.util.Locale;
import java.util.Optional;

/**
 * One observed SQL statement with its classification and timing.
 * Operation and table are either both present or both absent.
 */
public record Query(
        String sql,
        Classification classification,
        double durationSeconds,
        String stackTrace
) {

    public Query {
        sql = sql == null ? "" : chomp(sql);
        classification = classification == null ? Classification.unclassified() : classification;
        if (durationSeconds < 0 || Double.isNaN(durationSeconds)) {
            durationSeconds = 0;
        }
        stackTrace = stackTrace == null ? "" : stackTrace;
    }

    public Optional<SqlOperation> operation() {
        return classification instanceof Classification.Classified classified
                ? Optional.of(classified.operation())
                : Optional.empty();
    }

    public Optional<String> table() {
        return classification instanceof Classification.Classified classified
                ? Optional.of(classified.table())
                : Optional.empty();
    }

    public boolean isClassified() {
        return classification.isClassified();
    }

    /**
     * Case-insensitive table match; unclassified queries never match.
     */
    public boolean isOnTable(String tableName) {
        return tableName != null && table()
                .map(t -> t.toLowerCase(Locale.ROOT).equals(tableName.toLowerCase(Locale.ROOT)))
                .orElse(false);
    }

    /**
     * SQL as shown in diagnostics, followed by the captured stack trace if there is one.
     */
    public String displaySql() {
        StringBuilder display = new StringBuilder("SQL: ").append(sql);
        if (!stackTrace.isBlank()) {
            display.append('\n');
            stackTrace.lines().forEach(line -> display.append("    ").append(line).append('\n'));
            display.setLength(display.length() - 1);
        }
        return display.toString();
    }

    private static String chomp(String sql) {
        if (sql.endsWith("\r\n")) {
            return sql.substring(0, sql.length() - 2);
        }
        if (sql.endsWith("\n")) {
            return sql.substring(0, sql.length() - 1);
        }
        return sql;
    }
}
