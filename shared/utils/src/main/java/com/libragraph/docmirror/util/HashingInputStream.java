package com.libragraph.docmirror.util;

import org.apache.commons.codec.digest.DigestUtils;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;

/**
 * Input stream that feeds every byte it passes through into a SHA-256 digest and counts them.
 *
 * <p>Lets a caller spool an upload to disk and learn its {@link ContentHash} in the same pass.
 * {@link #hash()} is only meaningful once the stream has been read to EOF.
 */
public class HashingInputStream extends FilterInputStream {

    private final MessageDigest digest = DigestUtils.getSha256Digest();
    private long count;

    public HashingInputStream(InputStream in) {
        super(in);
    }

    @Override
    public int read() throws IOException {
        int b = super.read();
        if (b != -1) {
            digest.update((byte) b);
            count++;
        }
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        int n = super.read(b, off, len);
        if (n > 0) {
            digest.update(b, off, n);
            count += n;
        }
        return n;
    }

    @Override
    public long skip(long n) throws IOException {
        // Skipped bytes would never reach the digest.
        throw new IOException("skip is not supported on a hashing stream");
    }

    @Override
    public boolean markSupported() {
        return false;
    }

    /** Number of bytes read so far. */
    public long count() {
        return count;
    }

    /** Finalizes the digest. Call once, after EOF. */
    public ContentHash hash() {
        return new ContentHash(digest.digest());
    }
}
