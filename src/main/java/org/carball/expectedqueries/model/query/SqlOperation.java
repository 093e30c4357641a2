package org.carball.expectedqueries.model.query;

import java.util.Locale;
import java.util.Optional;

/**
 * Table operations a classified statement can be attributed to.
 */
public enum SqlOperation {
    SELECT,
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Lowercase name as used in expectation specs and report messages.
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<SqlOperation> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        for (SqlOperation operation : values()) {
            if (operation.key().equalsIgnoreCase(key.trim())) {
                return Optional.of(operation);
            }
        }
        return Optional.empty();
    }
}
