package org.carball.expectedqueries.parser;

import org.carball.expectedqueries.config.RecorderConfig;
import org.carball.expectedqueries.model.query.Classification;

/**
 * Attributes a raw SQL statement to one table and operation. Implementations never throw:
 * anything they cannot attribute is {@link Classification#unclassified()}.
 */
public interface SqlClassifier {

    Classification classify(String sql);

    static SqlClassifier forConfig(RecorderConfig config) {
        RegexSqlClassifier lexical = new RegexSqlClassifier(config.isLookInsideSubselect());
        return switch (config.getClassifierMode()) {
            case REGEX -> lexical;
            case PARSER -> new ParsingSqlClassifier(lexical, config.isLookInsideSubselect());
        };
    }
}
