package com.libragraph.docmirror.core.ingest;

import java.io.InputStream;

/**
 * One file of a multi-file ingest. The caller owns and closes the stream.
 */
public record Upload(String filename, InputStream content) {}
