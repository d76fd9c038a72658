package com.arbor.tree;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;

/**
 * Localized user-facing strings (placeholders, export headers, error messages).
 * Backed by the {@code com.arbor.tree.messages} resource bundle; a missing key resolves to the key itself.
 */
public final class Messages {

    private static final String BUNDLE = "com.arbor.tree.messages";

    public static final String UNLABELLED = "node.unlabelled";
    public static final String QTREE_HEADER = "qtree.header";
    public static final String CONTAINER_UNREADABLE = "container.unreadable";
    public static final String CONTAINER_TOO_NEW = "container.tooNew";

    private final Locale locale;
    private final ResourceBundle bundle;

    private Messages(Locale locale) {
        this.locale = locale;
        this.bundle = ResourceBundle.getBundle(BUNDLE, locale);
    }

    /** Messages for the JVM default locale. */
    public static Messages defaults() {
        return new Messages(Locale.getDefault());
    }

    public static Messages forLocale(Locale locale) {
        return new Messages(Objects.requireNonNull(locale, "locale"));
    }

    public Locale getLocale() {
        return locale;
    }

    /** Returns the text for {@code key} verbatim (no pattern processing). */
    public String get(String key) {
        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return key;
        }
    }

    /** Returns the text for {@code key} with {@link MessageFormat} placeholders filled from {@code args}. */
    public String format(String key, Object... args) {
        return new MessageFormat(get(key), locale).format(args);
    }
}
