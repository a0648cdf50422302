package com.archlens.core.flow;

import com.archlens.core.model.StepTag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CallTagger}.
 */
class CallTaggerTest {

    @Test
    void classify_withDatabaseCall_tagsQuery() {
        assertThat(CallTagger.classify("const rows = db.query(sql);"))
            .hasValue(new CallTagger.TaggedStatement("db.query", StepTag.DB_QUERY));
        assertThat(CallTagger.classify("repo.findById(id)"))
            .hasValue(new CallTagger.TaggedStatement("repo.findById", StepTag.DB_QUERY));
    }

    @Test
    void classify_withHttpCall_tagsApiCall() {
        assertThat(CallTagger.classify("resp = requests.get(url)"))
            .hasValue(new CallTagger.TaggedStatement("requests.get", StepTag.API_CALL));
        assertThat(CallTagger.classify("await fetchOrders();"))
            .hasValue(new CallTagger.TaggedStatement("fetchOrders", StepTag.API_CALL));
    }

    @Test
    void classify_withLoggingCall_prefixesLabel() {
        assertThat(CallTagger.classify("print('hi')"))
            .hasValue(new CallTagger.TaggedStatement("Log: print", StepTag.LOG));
        assertThat(CallTagger.classify("logger.info(\"started\");"))
            .hasValue(new CallTagger.TaggedStatement("Log: logger.info", StepTag.LOG));
    }

    @Test
    void classify_withAssignment_usesTarget() {
        assertThat(CallTagger.classify("let total = 5;"))
            .hasValue(new CallTagger.TaggedStatement("total", StepTag.NONE));
    }

    @Test
    void classify_withDeclarationsAndKeywords_returnsEmpty() {
        assertThat(CallTagger.classify("import os")).isEmpty();
        assertThat(CallTagger.classify("return")).isEmpty();
        assertThat(CallTagger.classify("}")).isEmpty();
        assertThat(CallTagger.classify("x == y")).isEmpty();
    }
}
