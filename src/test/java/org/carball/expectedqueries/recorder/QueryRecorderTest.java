package org.carball.expectedqueries.recorder;

import org.carball.expectedqueries.assertion.RecordingAssertionSink;
import org.carball.expectedqueries.config.RecorderConfig;
import org.carball.expectedqueries.model.expectation.ExpectationSpec;
import org.carball.expectedqueries.model.expectation.InvalidExpectationException;
import org.carball.expectedqueries.model.query.Query;
import org.carball.expectedqueries.model.query.SqlOperation;
import org.carball.expectedqueries.model.statistics.TableOperation;
import org.carball.expectedqueries.trace.CallbackTraceSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryRecorderTest {

    private CallbackTraceSource database;
    private RecordingAssertionSink sink;
    private QueryRecorder recorder;

    @BeforeEach
    void setUp() {
        database = new CallbackTraceSource();
        sink = new RecordingAssertionSink();
        recorder = new QueryRecorder(database, RecorderConfig.builder().captureStackTraces(false).build(), sink);
    }

    @Test
    void shouldFailForTooManySelectsAndListTheirSql() {
        // Given
        recorder.run(() -> {
            database.query("insert into author (name) values ('Iain')");
            database.query("select * from book");
            database.query("select * from book");
            database.query("select * from book");
            return null;
        });
        Map<String, Object> author = new LinkedHashMap<>();
        author.put("insert", null);
        Map<String, Object> expected = new LinkedHashMap<>();
        expected.put("author", author);
        expected.put("book", Map.of("select", "<= 2"));

        // When
        boolean passed = recorder.test(expected);

        // Then
        assertThat(passed).isFalse();
        assertThat(sink.passed).isEmpty();
        assertThat(sink.failed).containsExactly("""
                Expected queries for tables:

                * Table: book
                Expected count '<= 2' selects for table 'book', got '3'
                Actually executed SQL queries on table 'book':
                SQL: select * from book
                SQL: select * from book
                SQL: select * from book

                """);
        assertThat(sink.failed.get(0)).doesNotContain("author");
    }

    @Test
    void shouldCountTableSpellingsTogether() {
        // Given
        recorder.run(() -> {
            database.query("SELECT * FROM Book");
            database.query("select * from book");
            database.query("select * from BOOK");
            return null;
        });

        // When
        boolean passed = recorder.test(Map.of("book", Map.of("select", "<= 2")));

        // Then
        assertThat(passed).isFalse();
        assertThat(sink.failed).containsExactly("""
                Expected queries for tables:

                * Table: Book
                Expected count '<= 2' selects for table 'Book', got '3'
                Actually executed SQL queries on table 'Book':
                SQL: SELECT * FROM Book
                SQL: select * from book
                SQL: select * from BOOK

                """);
    }

    @Test
    void shouldPassAndReturnWorkUnitResult() {
        // When
        String title = recorder.run(() -> {
            database.query("select * from book where id = 34");
            return "Excession";
        });

        // Then
        assertThat(title).isEqualTo("Excession");
        assertThat(recorder.test(ExpectationSpec.builder().expect("book", "select", 1).build())).isTrue();
        assertThat(sink.passed).containsExactly("Expected queries for tables");
    }

    @Test
    void shouldWarnAboutUnknownQueriesWithoutFailing() {
        recorder.run(() -> {
            database.query("SHOW TABLES");
            database.query("select * from book");
            return null;
        });

        boolean passed = recorder.test(ExpectationSpec.builder().dontCare("book", "select").build());

        assertThat(passed).isTrue();
        assertThat(sink.passed).containsExactly(
                "Expected queries for tables\n\nWarning: unknown queries:\nSQL: SHOW TABLES\n");
    }

    @Test
    void shouldAccumulateRunsUntilTested() {
        // Given
        recorder.run(() -> {
            database.query("select * from book");
            return null;
        });
        recorder.run(() -> {
            database.query("select * from book");
            database.query("update book set title = 'x' where id = 1");
            return null;
        });

        // Then
        assertThat(recorder.getQueries()).hasSize(3);
        assertThat(recorder.getStatistics().get(new TableOperation("book", SqlOperation.SELECT)).count())
                .isEqualTo(2);

        // When
        recorder.test(ExpectationSpec.builder().expect("book", "select", 2).expect("book", "update", 1).build());

        // Then - state is cleared
        assertThat(sink.passed).hasSize(1);
        assertThat(recorder.getQueries()).isEmpty();
        assertThat(recorder.getStatistics()).isEmpty();
    }

    @Test
    void shouldRecomputeStatisticsAfterNewRun() {
        recorder.run(() -> {
            database.query("select * from book");
            return null;
        });
        assertThat(recorder.getStatistics()).hasSize(1);

        recorder.run(() -> {
            database.query("delete from author where id = 2");
            return null;
        });

        assertThat(recorder.getStatistics().keySet()).containsExactly(
                new TableOperation("author", SqlOperation.DELETE),
                new TableOperation("book", SqlOperation.SELECT));
    }

    @Test
    void shouldPropagateWorkUnitFailureUnchangedAndStopObserving() {
        // Given
        IOException failure = new IOException("disk on fire");

        // When
        assertThatThrownBy(() -> recorder.run(() -> {
            database.query("select * from book");
            throw failure;
        })).isSameAs(failure);

        // Then
        assertThat(database.isObserved()).isFalse();
        database.query("select * from book");
        assertThat(recorder.getQueries()).isEmpty();
    }

    @Test
    void shouldAbortOnInvalidExpectationWithoutReporting() {
        recorder.run(() -> {
            database.query("select * from book");
            return null;
        });

        assertThatThrownBy(() -> recorder.test(ExpectationSpec.builder().expect("book", "select", "~= 2").build()))
                .isInstanceOf(InvalidExpectationException.class);

        assertThat(sink.passed).isEmpty();
        assertThat(sink.failed).isEmpty();
        assertThat(recorder.getQueries()).hasSize(1);
    }

    @Test
    void shouldIncludeStackTracesInFailureReportWhenCaptured() {
        // Given
        QueryRecorder tracing = new QueryRecorder(database,
                RecorderConfig.builder().stackTraceIgnore(Set.of("java.", "jdk.", "org.junit.")).build(), sink);

        // When
        tracing.run(() -> {
            database.query("select * from book");
            return null;
        });
        tracing.test(ExpectationSpec.empty());

        // Then
        assertThat(sink.failed).singleElement().asString()
                .contains("SQL: select * from book\n    at ")
                .contains("QueryRecorderTest");
    }

    @Test
    void shouldCaptureFullStackTracesWhenIgnoreSetIsMissing() {
        // Given
        QueryRecorder tracing = new QueryRecorder(database,
                RecorderConfig.builder().stackTraceIgnore(null).maxStackTraceFrames(50).build(), sink);

        // When
        tracing.run(() -> {
            database.query("select * from book");
            return null;
        });

        // Then
        assertThat(tracing.getQueries()).singleElement()
                .satisfies(query -> assertThat(query.stackTrace()).contains("QueryRecorderTest"));
    }

    @Test
    void shouldAttributeSubselectsAccordingToConfiguration() {
        QueryRecorder lookingInside = new QueryRecorder(database,
                RecorderConfig.builder().captureStackTraces(false).lookInsideSubselect(true).build(), sink);

        lookingInside.run(() -> {
            database.query("SELECT abc, def from (select * from file)");
            return null;
        });
        recorder.run(() -> {
            database.query("SELECT abc, def from (select * from file)");
            return null;
        });

        assertThat(lookingInside.getQueries()).extracting(q -> q.table().orElseThrow()).containsExactly("file");
        assertThat(recorder.getQueries()).extracting(q -> q.table().orElseThrow()).containsExactly("select");
    }

    @Test
    void shouldAcceptQueriesObservedElsewhere() {
        recorder.addQueries(List.of(new Query("select * from book", null, 0, "")));

        assertThat(recorder.getUnknownQueries()).hasSize(1);
    }
}
