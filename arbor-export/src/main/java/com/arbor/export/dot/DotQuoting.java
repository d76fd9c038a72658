package com.arbor.export.dot;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * DOT identifier quoting. Plain identifiers and numerals are written bare; keywords and everything else
 * are double-quoted. HTML-like labels ({@code <...>}) are written as they are.
 */
public final class DotQuoting {

    private static final Pattern ID = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*|-?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)");
    private static final Pattern HTML_STRING = Pattern.compile("<.*>", Pattern.DOTALL);
    private static final Set<String> KEYWORDS = Set.of("node", "edge", "graph", "digraph", "subgraph", "strict");

    private DotQuoting() {
    }

    /** Quotes a node, graph or attribute identifier. HTML-like text is not special here. */
    public static String quoteId(String id) {
        if (ID.matcher(id).matches() && !KEYWORDS.contains(id.toLowerCase(Locale.ROOT))) {
            return id;
        }
        return '"' + escapeQuotes(id) + '"';
    }

    /** Quotes an attribute value; HTML-like labels pass through unquoted. */
    public static String quoteValue(String value) {
        if (HTML_STRING.matcher(value).matches()) {
            return value;
        }
        return quoteId(value);
    }

    public static boolean isHtmlLabel(String value) {
        return value != null && HTML_STRING.matcher(value).matches();
    }

    private static String escapeQuotes(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        int backslashes = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' && backslashes % 2 == 0) {
                sb.append('\\');
            }
            sb.append(c);
            backslashes = c == '\\' ? backslashes + 1 : 0;
        }
        // a trailing odd backslash would escape the closing quote
        if (backslashes % 2 == 1) {
            sb.append('\\');
        }
        return sb.toString();
    }
}
