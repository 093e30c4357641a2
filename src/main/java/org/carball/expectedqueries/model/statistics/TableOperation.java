package org.carball.expectedqueries.model.statistics;

import org.carball.expectedqueries.model.query.SqlOperation;

import java.util.Comparator;
import java.util.Locale;

/**
 * Grouping key for aggregated statistics. Sorts by table name ignoring case, then operation name.
 */
public record TableOperation(String table, SqlOperation operation) implements Comparable<TableOperation> {

    private static final Comparator<TableOperation> ORDER = Comparator
            .comparing((TableOperation key) -> key.table().toLowerCase(Locale.ROOT))
            .thenComparing(TableOperation::table)
            .thenComparing(key -> key.operation().key());

    @Override
    public int compareTo(TableOperation other) {
        return ORDER.compare(this, other);
    }
}
