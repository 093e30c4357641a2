package org.carball.expectedqueries.model.expectation;

import lombok.extern.slf4j.Slf4j;
import org.carball.expectedqueries.model.query.SqlOperation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Expected outcomes per table and operation, plus defaults under the {@value #ALL_TABLES} key.
 */
@Slf4j
public final class ExpectationSpec {

    public static final String ALL_TABLES = "_all_";

    private final Map<String, Map<String, ExpectedOutcome>> tables;

    private ExpectationSpec(Map<String, Map<String, ExpectedOutcome>> tables) {
        this.tables = tables;
    }

    public static ExpectationSpec empty() {
        return new ExpectationSpec(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a spec from a nested {@code table -> operation -> outcome} map, the shape
     * produced by hand-written map literals and by YAML/JSON loading.
     */
    public static ExpectationSpec fromMap(Map<String, ?> expected) {
        Builder builder = builder();
        if (expected == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> tableEntry : expected.entrySet()) {
            String table = tableEntry.getKey();
            Object operations = tableEntry.getValue();
            if (operations == null) {
                builder.table(table);
                continue;
            }
            if (!(operations instanceof Map<?, ?> operationMap)) {
                throw new InvalidExpectationException(String.format(
                        "expectations for table '%s' must map operation names to outcomes, got %s",
                        table, operations.getClass().getSimpleName()));
            }
            builder.table(table);
            for (Map.Entry<?, ?> operationEntry : operationMap.entrySet()) {
                builder.expect(table, String.valueOf(operationEntry.getKey()), operationEntry.getValue());
            }
        }
        return builder.build();
    }

    /**
     * Resolves the outcome for an observed table operation: the table's own entry, then the
     * {@value #ALL_TABLES} entry, then "exactly 0".
     */
    public ExpectedOutcome resolve(String table, SqlOperation operation) {
        String operationKey = operation.key();
        Optional<Map<String, ExpectedOutcome>> tableEntries = findTable(table);
        if (tableEntries.isPresent() && tableEntries.get().containsKey(operationKey)) {
            return tableEntries.get().get(operationKey);
        }
        Map<String, ExpectedOutcome> defaults = tables.get(ALL_TABLES);
        if (defaults != null && defaults.containsKey(operationKey)) {
            return defaults.get(operationKey);
        }
        return ExpectedOutcome.none();
    }

    /**
     * Exact table key first, then a case-insensitive match.
     */
    public Optional<Map<String, ExpectedOutcome>> findTable(String table) {
        if (table == null) {
            return Optional.empty();
        }
        Map<String, ExpectedOutcome> exact = tables.get(table);
        if (exact != null) {
            return Optional.of(exact);
        }
        return tables.entrySet().stream()
                .filter(entry -> !ALL_TABLES.equals(entry.getKey()))
                .filter(entry -> entry.getKey().equalsIgnoreCase(table))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    public Set<String> getTableNames() {
        return tables.keySet();
    }

    public boolean isEmpty() {
        return tables.isEmpty();
    }

    @Override
    public String toString() {
        return "ExpectationSpec" + tables;
    }

    public static final class Builder {

        private final Map<String, Map<String, ExpectedOutcome>> tables = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Declares a table with no operation entries yet.
         */
        public Builder table(String table) {
            if (table == null || table.isBlank()) {
                throw new InvalidExpectationException("table name must not be blank");
            }
            tables.computeIfAbsent(table, t -> new LinkedHashMap<>());
            return this;
        }

        /**
         * Adds an outcome: a number, a comparison string, a statistic map or {@code null} for don't care.
         */
        public Builder expect(String table, String operation, Object outcome) {
            table(table);
            String operationKey = operation == null ? "" : operation.trim().toLowerCase(Locale.ROOT);
            if (SqlOperation.fromKey(operationKey).isEmpty()) {
                log.warn("Expectation for table '{}' names unknown operation '{}'; it will never match",
                        table, operation);
            }
            tables.get(table).put(operationKey, ExpectedOutcome.fromValue(outcome));
            return this;
        }

        public Builder expect(String table, SqlOperation operation, Object outcome) {
            return expect(table, operation.key(), outcome);
        }

        public Builder dontCare(String table, String operation) {
            return expect(table, operation, null);
        }

        /**
         * Default outcome for any table without its own entry for this operation.
         */
        public Builder expectForAllTables(String operation, Object outcome) {
            return expect(ALL_TABLES, operation, outcome);
        }

        public ExpectationSpec build() {
            Map<String, Map<String, ExpectedOutcome>> copy = new LinkedHashMap<>();
            tables.forEach((table, operations) ->
                    copy.put(table, Collections.unmodifiableMap(new LinkedHashMap<>(operations))));
            return new ExpectationSpec(Collections.unmodifiableMap(copy));
        }
    }
}
