package com.arbor.document;

import com.arbor.tree.ArborException;

/**
 * Thrown when an edit needs a selected node and nothing is selected.
 */
public final class NoSelectionException extends ArborException {

    public NoSelectionException(String message) {
        super(message);
    }
}
