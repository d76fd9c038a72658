package com.arbor.markup;

/**
 * One lexical unit of label markup. For tags {@code text} is the lower-cased tag name;
 * for {@link Kind#TEXT} it is the character data with references already decoded.
 */
public record MarkupToken(Kind kind, String text, boolean hasAttributes) {

    public enum Kind {
        TEXT,
        OPEN,
        CLOSE,
        /** {@code <tag/>}: an open immediately followed by its close. */
        SELF_CLOSING
    }

    public static MarkupToken text(String text) {
        return new MarkupToken(Kind.TEXT, text, false);
    }

    public static MarkupToken open(String name, boolean hasAttributes) {
        return new MarkupToken(Kind.OPEN, name, hasAttributes);
    }

    public static MarkupToken close(String name) {
        return new MarkupToken(Kind.CLOSE, name, false);
    }

    public static MarkupToken selfClosing(String name, boolean hasAttributes) {
        return new MarkupToken(Kind.SELF_CLOSING, name, hasAttributes);
    }
}
