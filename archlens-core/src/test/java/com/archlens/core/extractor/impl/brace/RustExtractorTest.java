package com.archlens.core.extractor.impl.brace;

import com.archlens.core.extractor.ExtractorTestBase;
import com.archlens.core.model.FileSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link RustExtractor}.
 */
class RustExtractorTest extends ExtractorTestBase {

    private RustExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new RustExtractor();
    }

    @Test
    void extract_withStructsTraitsAndImpls_findsTypesAndFunctions() {
        // Given: A Rust module with types, impl blocks and functions
        String content = """
            pub struct Parser {
                input: String,
            }

            pub trait Visitor {
                fn visit(&self);
            }

            impl Display for Token {
            }

            impl Parser {
                pub fn new(input: String) -> Self {
                    Parser { input }
                }

                pub(crate) async fn parse(&mut self) -> Result<(), Error> {
                    Ok(())
                }
            }
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "src/parser.rs", content);

        // Then: impl targets count as types
        assertThat(summary.types()).containsExactly("Parser", "Visitor", "Token");
        assertThat(summary.functions()).containsExactly("visit", "new", "parse");
    }

    @Test
    void extract_withUseDeclarations_classifiesCratesAndModules() {
        // Given: Standard, third-party and crate-local use declarations
        String content = """
            use std::collections::HashMap;
            use serde::{Deserialize, Serialize};
            use tokio::sync::Mutex as AsyncMutex;
            use crate::lexer::Token;
            use super::ast::{Expr, Stmt};
            mod codegen;
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "src/parser.rs", content);

        // Then: std is dropped, crates are external, crate paths resolve to modules
        assertThat(externalReferences(summary)).containsExactly("serde", "tokio");
        assertThat(localReferences(summary)).containsExactly("lexer", "ast", "codegen");
    }
}
