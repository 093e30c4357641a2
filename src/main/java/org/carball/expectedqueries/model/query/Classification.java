package org.carball.expectedqueries.model.query;

import java.util.Objects;

/**
 * Result of classifying one SQL statement: either a (table, operation) pair or nothing.
 */
public sealed interface Classification permits Classification.Classified, Classification.Unclassified {

    /**
     * Table name used when a SELECT reads from a nested sub-select and the classifier
     * was not asked to look inside it.
     */
    String SUBSELECT_TABLE = "select";

    static Classification of(SqlOperation operation, String table) {
        return new Classified(operation, table);
    }

    static Classification unclassified() {
        return Unclassified.INSTANCE;
    }

    boolean isClassified();

    record Classified(SqlOperation operation, String table) implements Classification {
        public Classified {
            Objects.requireNonNull(operation, "operation");
            Objects.requireNonNull(table, "table");
        }

        @Override
        public boolean isClassified() {
            return true;
        }

        /**
         * True for the degenerate sub-select marker.
         */
        public boolean isSubselectMarker() {
            return SUBSELECT_TABLE.equals(table);
        }
    }

    final class Unclassified implements Classification {
        private static final Unclassified INSTANCE = new Unclassified();

        private Unclassified() {
        }

        @Override
        public boolean isClassified() {
            return false;
        }

        @Override
        public String toString() {
            return "Unclassified";
        }
    }
}
