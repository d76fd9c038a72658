package com.arbor.document;

import com.arbor.tree.ArborException;

/**
 * Thrown when a document cannot be saved, e.g. {@link Document#save()} on a document that was never
 * saved or opened.
 */
public final class SaveException extends ArborException {

    public SaveException(String message) {
        super(message);
    }

    public SaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
