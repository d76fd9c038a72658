package com.arbor.markup;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Single-pass translator from label markup ({@code b i u sup sub null bar}) to LaTeX.
 * <p>
 * Consumes the token stream of {@link MarkupTokenizer} and keeps:
 * <ul>
 *   <li>a stack of open tags (last opened, first closed)</li>
 *   <li>the math depth: number of open math-requiring tags. {@code $} is emitted when it goes from 0 to 1
 *       and again when it returns to 0, so nested math tags share one pair of delimiters</li>
 *   <li>the LaTeX text and the plain identifier-safe text</li>
 *   <li>a validity flag that, once cleared, stays cleared until {@link #reset()}</li>
 * </ul>
 * Never throws on content; callers check {@link Translation#valid()} and fall back to the raw input.
 * Not thread-safe; use one instance per thread or the static {@link #translate(String)}.
 */
public final class MarkupTranslator {

    private final MarkupTokenizer tokenizer = new MarkupTokenizer();
    private final Deque<MarkupTag> tagStack = new ArrayDeque<>();
    private final StringBuilder tex = new StringBuilder();
    private final StringBuilder plain = new StringBuilder();
    private int mathDepth;
    private boolean valid = true;

    /** Translates one complete input with a fresh translator. */
    public static Translation translate(String text) {
        return new MarkupTranslator().feed(text).close();
    }

    /** Clears all state; call before each independent input. */
    public MarkupTranslator reset() {
        tokenizer.reset();
        tagStack.clear();
        tex.setLength(0);
        plain.setLength(0);
        mathDepth = 0;
        valid = true;
        return this;
    }

    /** Appends input. A null input is treated as empty. */
    public MarkupTranslator feed(String text) {
        for (MarkupToken token : tokenizer.feed(text)) {
            accept(token);
        }
        return this;
    }

    /**
     * Ends the input: flushes held-back text and marks the input invalid if tags are still open.
     * The translator keeps its state until {@link #reset()}.
     */
    public Translation close() {
        for (MarkupToken token : tokenizer.finish()) {
            accept(token);
        }
        if (!tagStack.isEmpty()) {
            valid = false;
        }
        return current();
    }

    /** Snapshot of the state so far, without ending the input. */
    public Translation current() {
        return new Translation(tex.toString(), plain.toString(), valid);
    }

    public boolean isValid() {
        return valid;
    }

    public int getMathDepth() {
        return mathDepth;
    }

    /** Number of currently open recognized tags. */
    public int getOpenTagCount() {
        return tagStack.size();
    }

    void accept(MarkupToken token) {
        switch (token.kind()) {
            case TEXT -> {
                tex.append(token.text());
                plain.append(token.text());
            }
            case OPEN -> open(token.text(), token.hasAttributes());
            case CLOSE -> close(token.text());
            case SELF_CLOSING -> {
                open(token.text(), token.hasAttributes());
                close(token.text());
            }
        }
    }

    private void open(String name, boolean hasAttributes) {
        if (hasAttributes) {
            valid = false;
        }
        Optional<MarkupTag> known = MarkupTag.forName(name);
        if (known.isEmpty()) {
            valid = false;
            tex.append('<').append(name).append('>');
            return;
        }
        MarkupTag tag = known.get();
        tagStack.push(tag);
        if (tag.isMathRequired()) {
            if (mathDepth == 0) {
                tex.append(MarkupTag.MATH_DELIMITER);
            }
            mathDepth++;
        }
        tex.append(tag.getOpen());
        if (tag.getIdentifierWord() != null) {
            plain.append(tag.getIdentifierWord());
        }
    }

    private void close(String name) {
        Optional<MarkupTag> known = MarkupTag.forName(name);
        if (known.isEmpty()) {
            valid = false;
            tex.append("</").append(name).append('>');
            return;
        }
        MarkupTag tag = known.get();
        MarkupTag top = tagStack.poll();
        if (top != tag) {
            valid = false;
        }
        tex.append(MarkupTag.CLOSE);
        if (tag.isMathRequired() && mathDepth > 0) {
            mathDepth--;
            if (mathDepth == 0) {
                tex.append(MarkupTag.MATH_DELIMITER);
            }
        }
    }
}
