package com.arbor.document;

/** Where a new or pasted node goes relative to the selection. */
public enum Location {
    /** Appended as the selection's last child. */
    CHILD,
    /** Spliced in between the selection and its parent; becomes the root when the selection is the root. */
    PARENT,
    /** Appended as the last child of the selection's parent. */
    SIBLING
}
