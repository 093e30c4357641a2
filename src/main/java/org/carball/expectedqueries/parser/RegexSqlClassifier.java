package org.carball.expectedqueries.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.expectedqueries.model.query.Classification;
import org.carball.expectedqueries.model.query.SqlOperation;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies SQL with lexical rules instead of a grammar. Rules are tried in order
 * (SELECT, INSERT, UPDATE, DELETE) and the first match wins.
 * <p>
 * A SELECT whose first FROM is followed by a parenthesis reads from a sub-select. Unless
 * {@code lookInsideSubselect} is set, such statements are attributed to the table
 * {@value Classification#SUBSELECT_TABLE}.
 */
@Slf4j
public class RegexSqlClassifier implements SqlClassifier {

    // One name part: bare identifier, or wrapped in backticks, quotes or brackets
    private static final String NAME_PART = "(?:`[^`]+`|\"[^\"]+\"|'[^']+'|\\[[^\\]]+]|[\\w$]+)";

    private static final String TARGET = "(" + NAME_PART + "(?:\\s*\\.\\s*" + NAME_PART + ")*)";

    private static final Pattern NAME_PART_PATTERN = Pattern.compile(NAME_PART);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final Pattern SELECT_PATTERN = Pattern.compile("^\\s*SELECT\\b", FLAGS);

    private static final Pattern FROM_PATTERN = Pattern.compile("\\bFROM\\b\\s*(?:(\\()|" + TARGET + ")", FLAGS);

    private static final Pattern INSERT_PATTERN = Pattern.compile("^\\s*INSERT\\s+INTO\\s+" + TARGET, FLAGS);

    private static final Pattern UPDATE_PATTERN = Pattern.compile("^\\s*UPDATE\\s+" + TARGET + "\\s+SET\\b", FLAGS);

    private static final Pattern DELETE_PATTERN = Pattern.compile("^\\s*DELETE\\s+FROM\\s+" + TARGET, FLAGS);

    private final boolean lookInsideSubselect;

    public RegexSqlClassifier() {
        this(false);
    }

    public RegexSqlClassifier(boolean lookInsideSubselect) {
        this.lookInsideSubselect = lookInsideSubselect;
    }

    @Override
    public Classification classify(String sql) {
        if (sql == null || sql.isBlank()) {
            return Classification.unclassified();
        }

        Classification classification = classifySelect(sql);
        if (!classification.isClassified()) {
            classification = classifySimple(sql, INSERT_PATTERN, SqlOperation.INSERT);
        }
        if (!classification.isClassified()) {
            classification = classifySimple(sql, UPDATE_PATTERN, SqlOperation.UPDATE);
        }
        if (!classification.isClassified()) {
            classification = classifySimple(sql, DELETE_PATTERN, SqlOperation.DELETE);
        }

        log.debug("Classified [{}] as {}", sql, classification);
        return classification;
    }

    private Classification classifySelect(String sql) {
        Matcher select = SELECT_PATTERN.matcher(sql);
        if (!select.find()) {
            return Classification.unclassified();
        }
        return selectTarget(sql, select.end(), false);
    }

    /**
     * Finds the first FROM at or after {@code start}. A sub-select either yields the
     * marker table or, when configured, the first table inside it.
     */
    private Classification selectTarget(String sql, int start, boolean nested) {
        Matcher from = FROM_PATTERN.matcher(sql);
        if (!from.find(start)) {
            return nested
                    ? Classification.of(SqlOperation.SELECT, Classification.SUBSELECT_TABLE)
                    : Classification.unclassified();
        }
        if (from.group(1) == null) {
            return Classification.of(SqlOperation.SELECT, normalizeTarget(from.group(2)));
        }
        if (!lookInsideSubselect) {
            return Classification.of(SqlOperation.SELECT, Classification.SUBSELECT_TABLE);
        }
        return selectTarget(sql, from.end(), true);
    }

    private static Classification classifySimple(String sql, Pattern pattern, SqlOperation operation) {
        Matcher matcher = pattern.matcher(sql);
        if (matcher.find()) {
            return Classification.of(operation, normalizeTarget(matcher.group(1)));
        }
        return Classification.unclassified();
    }

    /**
     * Strips one layer of quoting from each dot-separated part, keeping {@code schema.table}
     * as one compound name.
     */
    static String normalizeTarget(String target) {
        StringBuilder normalized = new StringBuilder();
        Matcher part = NAME_PART_PATTERN.matcher(target);
        while (part.find()) {
            if (normalized.length() > 0) {
                normalized.append('.');
            }
            normalized.append(unquote(part.group()));
        }
        return normalized.toString();
    }

    private static String unquote(String name) {
        if (name.length() >= 2) {
            char first = name.charAt(0);
            char last = name.charAt(name.length() - 1);
            if ((first == '`' && last == '`')
                    || (first == '"' && last == '"')
                    || (first == '\'' && last == '\'')
                    || (first == '[' && last == ']')) {
                return name.substring(1, name.length() - 1);
            }
        }
        return name;
    }
}
