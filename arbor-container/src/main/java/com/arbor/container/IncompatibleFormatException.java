package com.arbor.container;

import com.arbor.tree.ArborException;

/**
 * Thrown when a container cannot be loaded. Two situations share this type:
 * the file is unreadable (not a zip, damaged, missing an entry, malformed JSON), in which case
 * {@link #getRequiredVersion()} is null; or its major version is newer than this codec supports,
 * in which case the required and running versions are both set. Nothing is loaded in either case.
 */
public final class IncompatibleFormatException extends ArborException {

    private final String requiredVersion;
    private final String runningVersion;

    public IncompatibleFormatException(String message, Throwable cause) {
        super(message, cause);
        this.requiredVersion = null;
        this.runningVersion = null;
    }

    public IncompatibleFormatException(String message, String requiredVersion, String runningVersion) {
        super(message);
        this.requiredVersion = requiredVersion;
        this.runningVersion = runningVersion;
    }

    /** Minimum version able to read the file (e.g. {@code 2.0.0}); null when the file is simply unreadable. */
    public String getRequiredVersion() {
        return requiredVersion;
    }

    /** Version of the codec that rejected the file; null when the file is simply unreadable. */
    public String getRunningVersion() {
        return runningVersion;
    }

    public boolean isTooNew() {
        return requiredVersion != null;
    }
}
