/**
 * The editable document: {@link com.arbor.document.Document} with its edit operations, the shared
 * {@link com.arbor.document.Clipboard}, and extension-based file routing in
 * {@link com.arbor.document.DocumentFiles}.
 */
package com.arbor.document;
