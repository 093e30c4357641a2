package org.carball.expectedqueries.analyzer;

import org.carball.expectedqueries.model.query.Classification;
import org.carball.expectedqueries.model.query.Query;
import org.carball.expectedqueries.model.query.SqlOperation;
import org.carball.expectedqueries.model.statistics.StatSample;
import org.carball.expectedqueries.model.statistics.TableOperation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;

class StatisticsAggregatorTest {

    @Test
    void shouldGroupByTableAndOperation() {
        // Given
        List<Query> queries = List.of(
                query("select * from book", SqlOperation.SELECT, "book", 0.2),
                query("insert into author", SqlOperation.INSERT, "author", 0.1),
                query("select * from book where id = 1", SqlOperation.SELECT, "book", 0.4),
                new Query("SHOW TABLES", Classification.unclassified(), 0.3, ""));

        // When
        SortedMap<TableOperation, StatSample> statistics = StatisticsAggregator.aggregate(queries);

        // Then
        assertThat(statistics.keySet()).containsExactly(
                new TableOperation("author", SqlOperation.INSERT),
                new TableOperation("book", SqlOperation.SELECT));
        StatSample bookSelects = statistics.get(new TableOperation("book", SqlOperation.SELECT));
        assertThat(bookSelects.count()).isEqualTo(2);
        assertThat(bookSelects.getSamples()).containsExactly(0.2, 0.4);
    }

    @Test
    void shouldExcludeUnclassifiedQueries() {
        List<Query> queries = List.of(new Query("SHOW TABLES", null, 0, ""), new Query("select 1", null, 0, ""));

        assertThat(StatisticsAggregator.aggregate(queries)).isEmpty();
        assertThat(StatisticsAggregator.unknownQueries(queries)).hasSize(2);
    }

    @Test
    void shouldGroupTableNamesIgnoringCase() {
        // Given
        List<Query> queries = List.of(
                query("SELECT * FROM Book", SqlOperation.SELECT, "Book", 0.1),
                query("select * from book", SqlOperation.SELECT, "book", 0.2),
                query("select * from BOOK", SqlOperation.SELECT, "BOOK", 0.3),
                query("insert into author", SqlOperation.INSERT, "author", 0.1));

        // When
        SortedMap<TableOperation, StatSample> statistics = StatisticsAggregator.aggregate(queries);

        // Then
        assertThat(statistics.keySet()).containsExactly(
                new TableOperation("author", SqlOperation.INSERT),
                new TableOperation("Book", SqlOperation.SELECT));
        assertThat(statistics.get(new TableOperation("Book", SqlOperation.SELECT)).count()).isEqualTo(3);
    }

    @Test
    void shouldProduceSameStatisticsForAnyQueryOrder() {
        // Given
        List<Query> queries = new ArrayList<>(List.of(
                query("select * from book", SqlOperation.SELECT, "book", 0.013),
                query("select * from book", SqlOperation.SELECT, "book", 0.7),
                query("update book set x = 1", SqlOperation.UPDATE, "book", 0.05),
                query("select * from book", SqlOperation.SELECT, "book", 1e-6),
                query("select * from genre", SqlOperation.SELECT, "genre", 0.3)));
        List<Query> shuffled = new ArrayList<>(queries);
        Collections.reverse(shuffled);
        Collections.swap(shuffled, 0, 2);

        // When
        SortedMap<TableOperation, StatSample> original = StatisticsAggregator.aggregate(queries);
        SortedMap<TableOperation, StatSample> permuted = StatisticsAggregator.aggregate(shuffled);

        // Then
        assertThat(permuted.keySet()).containsExactlyElementsOf(original.keySet());
        for (Map.Entry<TableOperation, StatSample> entry : original.entrySet()) {
            StatSample other = permuted.get(entry.getKey());
            assertThat(other.count()).isEqualTo(entry.getValue().count());
            assertThat(other.sum()).isEqualTo(entry.getValue().sum());
            assertThat(other.mean()).isEqualTo(entry.getValue().mean());
            assertThat(other.max()).isEqualTo(entry.getValue().max());
            assertThat(other.min()).isEqualTo(entry.getValue().min());
        }
    }

    @Test
    void shouldListQueriesForTableIgnoringCase() {
        List<Query> queries = List.of(
                query("select * from Book", SqlOperation.SELECT, "Book", 0),
                query("select * from author", SqlOperation.SELECT, "author", 0),
                query("delete from book", SqlOperation.DELETE, "book", 0));

        assertThat(StatisticsAggregator.queriesForTable(queries, "BOOK"))
                .extracting(Query::sql)
                .containsExactly("select * from Book", "delete from book");
    }

    static Query query(String sql, SqlOperation operation, String table, double duration) {
        return new Query(sql, Classification.of(operation, table), duration, "");
    }
}
