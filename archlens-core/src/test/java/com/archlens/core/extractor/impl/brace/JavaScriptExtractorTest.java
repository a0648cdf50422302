package com.archlens.core.extractor.impl.brace;

import com.archlens.core.extractor.ExtractorTestBase;
import com.archlens.core.model.FileSummary;
import com.archlens.core.model.Language;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link JavaScriptExtractor}.
 */
class JavaScriptExtractorTest extends ExtractorTestBase {

    private JavaScriptExtractor extractor;

    @BeforeEach
    void setUpExtractor() {
        extractor = new JavaScriptExtractor();
    }

    // ==================== Symbols ====================

    @Test
    void extract_withClassAndFunction_reportsBoth() {
        // Given: A file declaring a class and a function
        String content = """
            class Foo {}
            function bar() {}
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "src/app.js", content);

        // Then: Type and function are found
        assertThat(summary.types()).contains("Foo");
        assertThat(summary.functions()).contains("bar");
    }

    @Test
    void extract_withTypeScriptMembers_findsMethodsArrowsAndInterfaces() {
        // Given: TypeScript module with modifiers, async methods and arrow functions
        String content = """
            export interface Options {
              retries: number;
            }

            export default class Client {
              private async fetchUser(id: string): Promise<User> {
                if (id) {
                  return this.load(id);
                }
              }

              public static create() {
                return new Client();
              }
            }

            export const normalize = (value: string) => value.trim();
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "src/client.ts", content);

        // Then: Keywords such as 'if' are not reported as functions
        assertThat(summary.language()).isEqualTo(Language.TYPESCRIPT);
        assertThat(summary.types()).containsExactly("Options", "Client");
        assertThat(summary.functions()).contains("fetchUser", "create", "normalize");
        assertThat(summary.functions()).doesNotContain("if", "return");
    }

    @Test
    void extract_withCommentedDeclaration_ignoresIt() {
        // Given: A declaration inside a block comment
        String content = """
            /*
            function hidden() {}
            */
            // class Ghost {}
            function visible() {}
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "a.js", content);

        // Then: Only live code counts
        assertThat(summary.functions()).containsExactly("visible");
        assertThat(summary.types()).isEmpty();
    }

    // ==================== References ====================

    @Test
    void extract_withImportsAndRequires_classifiesLocalAndPackages() {
        // Given: Relative, package, scoped, built-in and dynamic imports
        String content = """
            import { db } from './db';
            import type { User } from '../models/user';
            import lodash from 'lodash/fp';
            import { Injectable } from '@nestjs/common';
            import fs from 'fs';
            import path from 'node:path';
            import './polyfills';
            export * from './types';
            const axios = require('axios');
            const lazy = await import('./lazy');
            """;

        // When: Extracting
        FileSummary summary = extract(extractor, "src/service.ts", content);

        // Then: Relative specifiers stay local, packages are reduced, built-ins dropped
        assertThat(localReferences(summary))
            .containsExactlyInAnyOrder("./db", "../models/user", "./polyfills", "./types", "./lazy");
        assertThat(externalReferences(summary))
            .containsExactlyInAnyOrder("lodash", "@nestjs/common", "axios");
    }

    @Test
    void extract_withUnsupportedLanguage_returnsEmptySummary() {
        // When: Handing a Python file to the JavaScript extractor
        FileSummary summary = extract(extractor, "app.py", "def run():\n    pass\n");

        // Then: Nothing is extracted
        assertThat(summary.hasFindings()).isFalse();
    }
}
