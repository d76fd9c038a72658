package com.arbor.document;

import com.arbor.tree.ArborException;

/**
 * Thrown when moving the root node among siblings it cannot have.
 */
public final class RootImmutableException extends ArborException {

    public RootImmutableException(String message) {
        super(message);
    }
}
