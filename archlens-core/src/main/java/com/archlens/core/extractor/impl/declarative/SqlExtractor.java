package com.archlens.core.extractor.impl.declarative;

import com.archlens.core.extractor.base.AbstractRegexExtractor;
import com.archlens.core.extractor.base.SummaryBuilder;
import com.archlens.core.model.Language;
import com.archlens.core.model.SourceFile;

import java.util.Set;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * Extractor for SQL scripts.
 *
 * <p>{@code CREATE TABLE} statements are reported as type symbols;
 * {@code CREATE [OR REPLACE] VIEW/PROCEDURE/FUNCTION} statements as function symbols.
 * Schema-qualified and quoted names keep their qualifier without the quotes.
 * SQL scripts produce no references.
 */
public class SqlExtractor extends AbstractRegexExtractor {
    private static final String EXTRACTOR_ID = "sql";
    private static final String EXTRACTOR_DISPLAY_NAME = "SQL Extractor";

    private static final String NAME = "((?:[`\"\\[]?[\\w$]+[`\"\\]]?\\.)?[`\"\\[]?[\\w$]+[`\"\\]]?)";

    /**
     * Regex for table definitions: CREATE TEMPORARY TABLE IF NOT EXISTS users (.
     * Captures: (1) table name, possibly quoted and schema-qualified.
     */
    private static final Pattern TABLE_PATTERN = Pattern.compile(
        "\\bCREATE\\s+(?:(?:GLOBAL|LOCAL)\\s+)?(?:TEMP(?:ORARY)?\\s+)?TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?" + NAME,
        Pattern.CASE_INSENSITIVE
    );

    /**
     * Regex for routine and view definitions: CREATE OR REPLACE VIEW active_users AS.
     * Captures: (1) routine or view name.
     */
    private static final Pattern ROUTINE_PATTERN = Pattern.compile(
        "\\bCREATE\\s+(?:OR\\s+REPLACE\\s+)?(?:MATERIALIZED\\s+)?(?:VIEW|PROCEDURE|FUNCTION)\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?" + NAME,
        Pattern.CASE_INSENSITIVE
    );

    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\n]*");

    @Override
    public String getId() {
        return EXTRACTOR_ID;
    }

    @Override
    public String getDisplayName() {
        return EXTRACTOR_DISPLAY_NAME;
    }

    @Override
    public Set<Language> getSupportedLanguages() {
        return Set.of(Language.SQL);
    }

    @Override
    protected void extractInto(SourceFile file, SummaryBuilder summary) {
        String content = LINE_COMMENT.matcher(stripCStyleComments(file.content())).replaceAll("");

        for (MatchResult match : findMatches(TABLE_PATTERN, content)) {
            summary.addType(unquote(match.group(1)));
        }
        for (MatchResult match : findMatches(ROUTINE_PATTERN, content)) {
            summary.addFunction(unquote(match.group(1)));
        }
    }

    private static String unquote(String name) {
        return name.replaceAll("[`\"\\[\\]]", "");
    }
}
