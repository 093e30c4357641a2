package org.carball.expectedqueries.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.expectedqueries.model.query.Classification;
import org.carball.expectedqueries.model.query.Query;
import org.carball.expectedqueries.model.statistics.StatSample;
import org.carball.expectedqueries.model.statistics.TableOperation;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Groups classified queries by table and operation and collects their durations.
 */
@Slf4j
public final class StatisticsAggregator {

    private StatisticsAggregator() {
        // Utility class - prevent instantiation
    }

    /**
     * Aggregates every classified query; unclassified queries are left out.
     * Table names that differ only in case form one group, named by the first spelling seen.
     * The result is sorted by table name, then operation name.
     */
    public static SortedMap<TableOperation, StatSample> aggregate(List<Query> queries) {
        SortedMap<TableOperation, StatSample> statistics = new TreeMap<>();
        Map<String, String> spellings = new HashMap<>();

        for (Query query : queries) {
            if (query.classification() instanceof Classification.Classified classified) {
                String table = spellings.computeIfAbsent(
                        classified.table().toLowerCase(Locale.ROOT), lower -> classified.table());
                TableOperation key = new TableOperation(table, classified.operation());
                statistics.computeIfAbsent(key, k -> new StatSample()).add(query.durationSeconds());
            }
        }

        log.debug("Aggregated {} queries into {} table operations", queries.size(), statistics.size());
        return Collections.unmodifiableSortedMap(statistics);
    }

    /**
     * Queries no rule could attribute to a table, in observation order.
     */
    public static List<Query> unknownQueries(List<Query> queries) {
        return queries.stream()
                .filter(query -> !query.isClassified())
                .collect(Collectors.toList());
    }

    /**
     * Queries on the given table (case-insensitive), in observation order.
     */
    public static List<Query> queriesForTable(List<Query> queries, String table) {
        return queries.stream()
                .filter(query -> query.isOnTable(table))
                .collect(Collectors.toList());
    }
}
