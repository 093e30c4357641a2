package org.carball.expectedqueries.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.util.TablesNamesFinder;
import org.carball.expectedqueries.model.query.Classification;
import org.carball.expectedqueries.model.query.SqlOperation;

import java.util.List;

/**
 * Classifies SQL by parsing it with JSqlParser, which also handles CTEs, joins and
 * sub-selects. Statements JSqlParser rejects or does not map to a table operation go
 * through the lexical rules instead.
 * <p>
 * A select whose top-level FROM is a sub-select is attributed to the
 * {@link Classification#SUBSELECT_TABLE} marker unless looking inside sub-selects is enabled.
 */
@Slf4j
public class ParsingSqlClassifier implements SqlClassifier {

    private final SqlClassifier fallback;
    private final boolean lookInsideSubselect;

    public ParsingSqlClassifier() {
        this(false);
    }

    public ParsingSqlClassifier(boolean lookInsideSubselect) {
        this(new RegexSqlClassifier(lookInsideSubselect), lookInsideSubselect);
    }

    public ParsingSqlClassifier(SqlClassifier fallback, boolean lookInsideSubselect) {
        this.fallback = fallback;
        this.lookInsideSubselect = lookInsideSubselect;
    }

    @Override
    public Classification classify(String sql) {
        if (sql == null || sql.isBlank()) {
            return Classification.unclassified();
        }

        try {
            Statement statement = CCJSqlParserUtil.parse(sql);
            Classification classification = classifyStatement(statement);
            if (classification.isClassified()) {
                log.debug("Parsed [{}] as {}", sql, classification);
                return classification;
            }
        } catch (JSQLParserException | RuntimeException e) {
            log.debug("JSqlParser could not parse [{}], using lexical rules: {}", sql, e.getMessage());
        }

        return fallback.classify(sql);
    }

    private Classification classifyStatement(Statement statement) {
        if (statement instanceof Insert insert) {
            return of(SqlOperation.INSERT, insert.getTable());
        }
        if (statement instanceof Update update) {
            return of(SqlOperation.UPDATE, update.getTable());
        }
        if (statement instanceof Delete delete) {
            return of(SqlOperation.DELETE, delete.getTable());
        }
        if (statement instanceof Select) {
            if (!lookInsideSubselect && statement instanceof PlainSelect plain
                    && plain.getFromItem() instanceof ParenthesedSelect) {
                return Classification.of(SqlOperation.SELECT, Classification.SUBSELECT_TABLE);
            }
            List<String> tables = new TablesNamesFinder().getTableList(statement);
            if (!tables.isEmpty()) {
                return Classification.of(SqlOperation.SELECT, RegexSqlClassifier.normalizeTarget(tables.get(0)));
            }
        }
        return Classification.unclassified();
    }

    private static Classification of(SqlOperation operation, Table table) {
        if (table == null) {
            return Classification.unclassified();
        }
        return Classification.of(operation, RegexSqlClassifier.normalizeTarget(table.getFullyQualifiedName()));
    }
}
