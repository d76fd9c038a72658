package com.arbor.markup;

import org.jsoup.parser.Parser;

/**
 * Escaping and character-reference decoding for the HTML-like label markup.
 */
public final class HtmlText {

    private HtmlText() {
    }

    /** Escapes {@code & < > " '} so the text can be embedded in an HTML-like label. */
    public static String escape(String text) {
        if (text == null) return "";
        StringBuilder sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                case '\'' -> sb.append("&#x27;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Decodes character references: every HTML5 named entity ({@code &eacute;}, {@code &alpha;}, ...) and
     * numeric references ({@code &#NN;}, {@code &#xHH;}). Unknown references are left as they are.
     */
    public static String unescape(String text) {
        if (text == null || text.indexOf('&') < 0) return text;
        return Parser.unescapeEntities(text, false);
    }
}
