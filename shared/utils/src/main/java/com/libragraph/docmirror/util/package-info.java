/**
 * Shared utilities for all Document Mirror modules.
 *
 * <p>Contains {@link com.libragraph.docmirror.util.ContentHash} (SHA-256) and
 * {@link com.libragraph.docmirror.util.HashingInputStream}, which digests a stream while it is
 * being copied. No framework dependencies beyond Commons Codec.
 */
package com.libragraph.docmirror.util;
