package com.instaclustr.hasher.impl.hash;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Running SHA-256 over buffers fed in file order.
 *
 * <p>Nothing checks that fed buffers cover a file without gaps, a skipped range silently yields a wrong digest.
 * An accumulator is consumed by {@link #finish()}, it can not be fed nor finished again afterwards.</p>
 */
public final class DigestAccumulator {

    private final MessageDigest digest;
    private boolean finished;

    private DigestAccumulator(final MessageDigest digest) {
        this.digest = digest;
    }

    public static DigestAccumulator sha256() {
        try {
            return new DigestAccumulator(MessageDigest.getInstance(HashSpec.ALGORITHM));
        } catch (final NoSuchAlgorithmException ex) {
            // every Java platform is required to support SHA-256
            throw new IllegalStateException(ex);
        }
    }

    /**
     * Folds remaining bytes of the buffer into the digest, the buffer is fully consumed.
     */
    public void update(final ByteBuffer buffer) {
        checkNotNull(buffer, "buffer to hash can not be null");
        checkState(!finished, "digest was already finished");
        digest.update(buffer);
    }

    /**
     * @return lowercase hexadecimal digest of all bytes fed so far
     */
    public String finish() {
        checkState(!finished, "digest was already finished");
        finished = true;

        final StringBuilder sb = new StringBuilder();

        for (final byte aByte : digest.digest()) {
            sb.append(Integer.toString((aByte & 0xff) + 0x100, 16).substring(1));
        }

        return sb.toString();
    }
}
