package com.arbor.markup;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed tag vocabulary of node labels and values, with its LaTeX rendering.
 * Every tag closes with a closing brace; math-requiring tags must sit inside {@code $...$}.
 */
public enum MarkupTag {
    BOLD("b", "\\textbf{", false, null),
    ITALIC("i", "\\textit{", false, null),
    UNDERLINE("u", "\\underline{", false, null),
    SUPERSCRIPT("sup", "^{", true, null),
    SUBSCRIPT("sub", "_{", true, null),
    NULL("null", "{\\O", true, "Null"),
    PRIME("bar", "^{\\prime", true, "Bar");

    public static final String CLOSE = "}";
    public static final String MATH_DELIMITER = "$";

    private static final Map<String, MarkupTag> BY_NAME = new HashMap<>();

    static {
        for (MarkupTag tag : values()) {
            BY_NAME.put(tag.tagName, tag);
        }
    }

    private final String tagName;
    private final String open;
    private final boolean mathRequired;
    private final String identifierWord;

    MarkupTag(String tagName, String open, boolean mathRequired, String identifierWord) {
        this.tagName = tagName;
        this.open = open;
        this.mathRequired = mathRequired;
        this.identifierWord = identifierWord;
    }

    /** Looks up a tag by its (case-insensitive) markup name. */
    public static Optional<MarkupTag> forName(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
    }

    /** Name used in the markup, e.g. {@code sup}. */
    public String getTagName() {
        return tagName;
    }

    /** LaTeX emitted when the tag opens. */
    public String getOpen() {
        return open;
    }

    public boolean isMathRequired() {
        return mathRequired;
    }

    /** Word contributed to the identifier-safe text (null for purely typographic tags). */
    public String getIdentifierWord() {
        return identifierWord;
    }
}
