package com.archlens.core.extractor.impl.declarative;

import com.archlens.core.extractor.ExtractorTestBase;
import com.archlens.core.model.FileSummary;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link SqlExtractor}.
 */
class SqlExtractorTest extends ExtractorTestBase {

    private final SqlExtractor extractor = new SqlExtractor();

    @Test
    void extract_withDdl_findsTablesViewsAndRoutines() {
        // Given: A migration with tables, a view and a procedure
        String content = """
            -- CREATE TABLE commented_out (id INT);
            CREATE TABLE IF NOT EXISTS users (
                id SERIAL PRIMARY KEY
            );
            create table "audit"."events" (id int);
            CREATE OR REPLACE VIEW active_users AS SELECT * FROM users;
            CREATE PROCEDURE purge_events() BEGIN END;
            CREATE FUNCTION `count_users`() RETURNS INT RETURN 1;
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "db/schema.sql", content);

        // Then: Tables are types, views and routines functions, quotes removed
        assertThat(summary.types()).containsExactly("users", "audit.events");
        assertThat(summary.functions()).containsExactly("active_users", "purge_events", "count_users");
    }
}
