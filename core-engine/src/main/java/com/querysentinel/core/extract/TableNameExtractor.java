package com.querysentinel.core.extract;

/**
 * Heuristic extraction of the table a query reads from.
 *
 * <p>
 * Takes the text after the first occurrence of the literal {@code "FROM "}
 * (case-sensitive, one trailing space) and returns its leading
 * whitespace-delimited token. This is not a SQL parser: joins, subqueries,
 * aliases, lower-case keywords and quoted identifiers containing spaces are
 * not handled, and only one table per query is ever reported.
 * </p>
 *
 * @since 1.0.0
 */
public final class TableNameExtractor {

    static final String FROM_TOKEN = "FROM ";

    private TableNameExtractor() {
        // utility class, not instantiable
    }

    /**
     * @param queryText raw query text; may be {@code null}
     * @return the extracted table name, or {@code null} if there is none
     */
    public static String extract(String queryText) {
        if (queryText == null) {
            return null;
        }
        int idx = queryText.indexOf(FROM_TOKEN);
        if (idx < 0) {
            return null;
        }
        int start = idx + FROM_TOKEN.length();
        int end = start;
        while (end < queryText.length() && !Character.isWhitespace(queryText.charAt(end))) {
            end++;
        }
        // "FROM " followed directly by whitespace or end of text
        return end > start ? queryText.substring(start, end) : null;
    }
}
