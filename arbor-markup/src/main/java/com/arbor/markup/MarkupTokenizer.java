package com.arbor.markup;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Incremental tokenizer for label markup. Input may arrive in pieces through {@link #feed};
 * an incomplete tag or character reference at the end of the buffer is held back until more input
 * arrives or {@link #finish()} is called, at which point leftovers are emitted as text.
 * <p>
 * A tag starts with {@code <} followed by a letter ({@code </} followed by a letter for a close tag)
 * and ends at the next {@code >}. Comments ({@code <!--...-->}), declarations ({@code <!DOCTYPE ...>}) and
 * processing instructions ({@code <?...?>}) are dropped. Any other {@code <} is text.
 */
public final class MarkupTokenizer {

    private final StringBuilder buffer = new StringBuilder();

    public void reset() {
        buffer.setLength(0);
    }

    /** Appends input and returns the tokens that are complete so far. */
    public List<MarkupToken> feed(String text) {
        if (text != null) {
            buffer.append(text);
        }
        return drain(false);
    }

    /** Returns all remaining tokens, treating anything incomplete as text. */
    public List<MarkupToken> finish() {
        return drain(true);
    }

    /** Tokenizes a complete input in one go. */
    public static List<MarkupToken> tokenize(String text) {
        MarkupTokenizer tokenizer = new MarkupTokenizer();
        List<MarkupToken> tokens = new ArrayList<>(tokenizer.feed(text));
        tokens.addAll(tokenizer.finish());
        return tokens;
    }

    private List<MarkupToken> drain(boolean atEnd) {
        List<MarkupToken> tokens = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        int i = 0;
        int n = buffer.length();
        while (i < n) {
            char c = buffer.charAt(i);
            if (c != '<') {
                text.append(c);
                i++;
                continue;
            }
            if (i + 1 >= n || buffer.charAt(i + 1) == '/' && i + 2 >= n) {
                if (!atEnd) break;
                text.append(buffer, i, n);
                i = n;
                break;
            }
            char next = buffer.charAt(i + 1);
            if (next == '!' || next == '?') {
                int skipTo = markupDeclarationEnd(i, n);
                if (skipTo < 0) {
                    if (!atEnd) break;
                    text.append(buffer, i, n);
                    i = n;
                    break;
                }
                i = skipTo;
                continue;
            }
            boolean closing = next == '/';
            int nameStart = closing ? i + 2 : i + 1;
            if (!Character.isLetter(buffer.charAt(nameStart))) {
                text.append(c);
                i++;
                continue;
            }
            int end = buffer.indexOf(">", nameStart);
            if (end < 0) {
                if (!atEnd) break;
                text.append(buffer, i, n);
                i = n;
                break;
            }
            flushText(text, tokens);
            tokens.add(parseTag(buffer.substring(nameStart, end), closing));
            i = end + 1;
        }
        if (!atEnd && i >= n) {
            i = holdUnterminatedReference(text, i);
        }
        flushText(text, tokens);
        buffer.delete(0, i);
        return tokens;
    }

    /**
     * End (exclusive) of the comment {@code <!--...-->}, declaration {@code <!...>} or processing instruction
     * {@code <?...>} starting at {@code start}, or -1 while it is incomplete.
     */
    private int markupDeclarationEnd(int start, int n) {
        String opener = "<!--";
        int avail = Math.min(n - start, opener.length());
        if (buffer.substring(start, start + avail).equals(opener.substring(0, avail))) {
            if (avail < opener.length()) return -1;
            int close = buffer.indexOf("-->", start + opener.length());
            return close < 0 ? -1 : close + 3;
        }
        int close = buffer.indexOf(">", start + 2);
        return close < 0 ? -1 : close + 1;
    }

    // a trailing "&..." without ';' may be the start of a reference split across feeds
    private static int holdUnterminatedReference(StringBuilder text, int consumed) {
        int amp = text.lastIndexOf("&");
        if (amp < 0) return consumed;
        for (int k = amp + 1; k < text.length(); k++) {
            char c = text.charAt(k);
            if (c == ';' || Character.isWhitespace(c)) return consumed;
        }
        int held = text.length() - amp;
        text.setLength(amp);
        return consumed - held;
    }

    private static void flushText(StringBuilder text, List<MarkupToken> tokens) {
        if (text.length() > 0) {
            tokens.add(MarkupToken.text(HtmlText.unescape(text.toString())));
            text.setLength(0);
        }
    }

    private static MarkupToken parseTag(String inner, boolean closing) {
        int k = 0;
        while (k < inner.length() && !Character.isWhitespace(inner.charAt(k)) && inner.charAt(k) != '/') {
            k++;
        }
        String name = inner.substring(0, k).toLowerCase(Locale.ROOT);
        if (closing) {
            return MarkupToken.close(name);
        }
        String rest = inner.substring(k).strip();
        boolean selfClosing = rest.endsWith("/");
        if (selfClosing) {
            rest = rest.substring(0, rest.length() - 1).strip();
        }
        boolean hasAttributes = !rest.isEmpty();
        return selfClosing ? MarkupToken.selfClosing(name, hasAttributes) : MarkupToken.open(name, hasAttributes);
    }
}
