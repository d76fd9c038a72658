/**
 * Label markup: tokenizer, LaTeX translator and HTML text helpers.
 *
 * <ul>
 *   <li>{@link com.arbor.markup.MarkupTag} – the fixed tag table and its LaTeX rendering</li>
 *   <li>{@link com.arbor.markup.MarkupTokenizer} – incremental text/open/close/self-closing tokenizer</li>
 *   <li>{@link com.arbor.markup.MarkupTranslator} – stack and math-depth state machine producing a {@link com.arbor.markup.Translation}</li>
 *   <li>{@link com.arbor.markup.HtmlText} – escaping for HTML-like labels</li>
 * </ul>
 */
package com.arbor.markup;
