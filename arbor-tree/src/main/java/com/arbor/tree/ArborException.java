package com.arbor.tree;

/**
 * Base type of every error raised by Arbor. All of them are recoverable by the caller:
 * a failed edit leaves the tree unchanged and a failed load leaves no document behind.
 */
public class ArborException extends RuntimeException {

    public ArborException(String message) {
        super(message);
    }

    public ArborException(String message, Throwable cause) {
        super(message, cause);
    }
}
