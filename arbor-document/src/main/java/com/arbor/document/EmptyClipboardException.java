package com.arbor.document;

import com.arbor.tree.ArborException;

/**
 * Thrown by paste when nothing has been copied yet.
 */
public final class EmptyClipboardException extends ArborException {

    public EmptyClipboardException(String message) {
        super(message);
    }
}
