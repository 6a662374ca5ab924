package com.instaclustr.hasher.impl.read;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;

import com.google.common.collect.AbstractIterator;
import com.instaclustr.hasher.impl.HashingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.instaclustr.hasher.impl.FailureKind.METADATA;
import static com.instaclustr.hasher.impl.FailureKind.OPEN;
import static com.instaclustr.hasher.impl.FailureKind.READ;
import static java.lang.String.format;

/**
 * Reads a file as a one-shot sequence of buffers.
 *
 * <p>The size of a file is taken from file system metadata when it is opened and it is authoritative: buffers
 * are yielded in file order, each at most {@code chunkSize} bytes long, the last one holding exactly the remainder,
 * and their lengths sum to that size. A file which ends sooner, or which does not have that size anymore once
 * everything was read, fails with {@link HashingException} of kind {@code READ}. A buffer is never yielded partially
 * filled.</p>
 *
 * <p>Reads are blocking, an instance is meant to be iterated from a dedicated reader thread.</p>
 */
public class ChunkedReader extends AbstractIterator<ByteBuffer> implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ChunkedReader.class);

    private final Path path;
    private final FileChannel channel;
    private final int chunkSize;
    private final long size;

    private long remaining;

    private ChunkedReader(final Path path, final FileChannel channel, final int chunkSize, final long size) {
        this.path = path;
        this.channel = channel;
        this.chunkSize = chunkSize;
        this.size = size;
        this.remaining = size;
    }

    public static ChunkedReader open(final Path path, final int chunkSize) throws HashingException {
        checkArgument(chunkSize > 0, "chunk size has to be greater than 0 but was %s", chunkSize);

        final FileChannel channel;

        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        } catch (final IOException | SecurityException | UnsupportedOperationException ex) {
            throw new HashingException(OPEN, format("Unable to open %s for reading: %s", path, ex.getMessage()), ex);
        }

        try {
            final long size = Files.readAttributes(path, BasicFileAttributes.class).size();
            return new ChunkedReader(path, channel, chunkSize, size);
        } catch (final IOException | SecurityException ex) {
            closeQuietly(channel, path);
            throw new HashingException(METADATA, format("Unable to read size of %s: %s", path, ex.getMessage()), ex);
        }
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return size of the file as captured on opening
     */
    public long size() {
        return size;
    }

    @Override
    protected ByteBuffer computeNext() {
        if (remaining == 0) {
            verifySizeUnchanged();
            return endOfData();
        }

        final int length = (int) Math.min(chunkSize, remaining);
        final ByteBuffer buffer = ByteBuffer.allocate(length);

        try {
            while (buffer.hasRemaining()) {
                if (channel.read(buffer) < 0) {
                    throw new HashingException(READ, format("Unexpected end of %s, expected %s more bytes",
                                                            path,
                                                            remaining - buffer.position()));
                }
            }
        } catch (final IOException ex) {
            throw new HashingException(READ, format("Unable to read %s: %s", path, ex.getMessage()), ex);
        }

        remaining -= length;
        buffer.flip();

        return buffer;
    }

    private void verifySizeUnchanged() {
        final long currentSize;

        try {
            currentSize = channel.size();
        } catch (final IOException ex) {
            throw new HashingException(READ, format("Unable to read size of %s: %s", path, ex.getMessage()), ex);
        }

        if (currentSize != size) {
            throw new HashingException(READ, format("Size of %s changed from %s to %s bytes while it was read",
                                                    path,
                                                    size,
                                                    currentSize));
        }
    }

    @Override
    public void close() {
        closeQuietly(channel, path);
    }

    private static void closeQuietly(final FileChannel channel, final Path path) {
        try {
            channel.close();
        } catch (final IOException ex) {
            logger.warn("Unable to close {}", path, ex);
        }
    }
}
