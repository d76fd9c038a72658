package com.arbor.markup;

/**
 * Result of translating one input.
 *
 * @param tex   LaTeX rendering; only meaningful when {@code valid}
 * @param plain character data plus identifier words of {@code null}/{@code bar} tags, without markup
 * @param valid false if any tag was unknown, carried attributes, was mismatched or left open
 */
public record Translation(String tex, String plain, boolean valid) {

    /** The LaTeX text when valid, otherwise {@code raw} unchanged. */
    public String texOr(String raw) {
        return valid ? tex : raw;
    }
}
