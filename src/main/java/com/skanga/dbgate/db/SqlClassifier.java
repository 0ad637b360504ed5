package com.skanga.dbgate.db;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Surface-level classification of SQL statements as read-only or mutating.
 *
 * <p>This is a keyword heuristic, not a parser. The whole normalized statement is matched
 * against anchored prefix patterns, so only the leading statement of a batch is inspected:
 * {@code SELECT 1; DROP TABLE x} is classified as read-only. Mutations hidden inside
 * procedures invoked from a SELECT are not detected either.
 */
public final class SqlClassifier {
    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\n]*");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Order matters only for readability, the first match decides
    private static final List<Pattern> MUTATING_PATTERNS = List.of(
            Pattern.compile("^\\s*INSERT\\s+INTO"),
            Pattern.compile("^\\s*UPDATE\\s+"),
            Pattern.compile("^\\s*DELETE\\s+FROM"),
            Pattern.compile("^\\s*DROP\\s+"),
            Pattern.compile("^\\s*CREATE\\s+"),
            Pattern.compile("^\\s*ALTER\\s+"),
            Pattern.compile("^\\s*TRUNCATE\\s+"),
            Pattern.compile("^\\s*GRANT\\s+"),
            Pattern.compile("^\\s*REVOKE\\s+"),
            Pattern.compile("^\\s*MERGE\\s+"),
            Pattern.compile("^\\s*EXEC\\s+"),
            Pattern.compile("^\\s*EXECUTE\\s+"),
            Pattern.compile("^\\s*CALL\\s+"),
            Pattern.compile("^\\s*SET\\s+"),
            Pattern.compile("^\\s*USE\\s+"));

    private SqlClassifier() {
    }

    /**
     * Returns false if the statement starts with a data or schema modifying keyword.
     *
     * @param sqlQuery statement text, may contain comments
     * @return true if the statement is considered read-only
     */
    public static boolean isReadOnly(String sqlQuery) {
        if (sqlQuery == null) {
            return true;
        }
        String normalizedSql = normalize(sqlQuery);
        for (Pattern mutatingPattern : MUTATING_PATTERNS) {
            if (mutatingPattern.matcher(normalizedSql).find()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Replaces comments with a space, collapses whitespace and upper-cases the statement.
     */
    static String normalize(String sqlQuery) {
        String withoutComments = LINE_COMMENT.matcher(sqlQuery).replaceAll(" ");
        withoutComments = BLOCK_COMMENT.matcher(withoutComments).replaceAll(" ");
        return WHITESPACE.matcher(withoutComments).replaceAll(" ").trim().toUpperCase(Locale.ROOT);
    }
}
