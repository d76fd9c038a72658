/**
 * Durable storage of a document: a zip container with {@code manifest.json} and {@code tree.json}.
 * {@link com.arbor.container.ContainerCodec} gates loading on the major component of
 * {@link com.arbor.container.FormatVersion}; all read failures surface as
 * {@link com.arbor.container.IncompatibleFormatException}.
 */
package com.arbor.container;
