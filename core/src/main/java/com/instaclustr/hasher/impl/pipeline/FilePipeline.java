package com.instaclustr.hasher.impl.pipeline;

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import com.instaclustr.hasher.impl.FileState;
import com.instaclustr.hasher.impl.FileTask;
import com.instaclustr.hasher.impl.HashingException;
import com.instaclustr.hasher.impl.hash.DigestAccumulator;
import com.instaclustr.hasher.impl.hash.HashSpec;
import com.instaclustr.hasher.impl.progress.ProgressTracker;
import com.instaclustr.hasher.impl.read.ChunkedReader;
import com.instaclustr.hasher.measure.DataSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.instaclustr.hasher.impl.FailureKind.READ;
import static java.lang.String.format;

/**
 * Hashes one file in two stages joined by a bounded queue.
 *
 * <p>The reader stage runs on the reader executor and puts chunks of the file into the queue, the hashing stage runs
 * on the calling thread, folds chunks into the digest and sends progress to the sink. At most {@code queueCapacity}
 * chunks are held in memory at once.</p>
 *
 * <p>Events are sent in order: {@code InProgress(0)} once the file is opened (skipped for an empty file), further
 * {@code InProgress} events as progress is made and finally {@code Completed}. A failure ends the pipeline without
 * further events, it is sent as {@code Failed} only if {@link HashSpec#reportFailures} is set.
 * The pipeline stops reading and hashing as soon as its task is cancelled or the sink is disconnected, both are
 * checked between chunks and before every send. A reader still running when hashing stops is interrupted.</p>
 */
public class FilePipeline implements Callable<Void> {

    private static final Logger logger = LoggerFactory.getLogger(FilePipeline.class);

    static final long POLL_MILLIS = 100;

    private final FileTask task;
    private final HashSpec hashSpec;
    private final EventSink sink;
    private final ExecutorService readerExecutor;
    private final AtomicBoolean shouldCancel;

    // set once the hashing stage exits for whatever reason so the reader stage does not wait on a full queue forever
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public FilePipeline(final FileTask task,
                        final HashSpec hashSpec,
                        final EventSink sink,
                        final ExecutorService readerExecutor) {
        this.task = task;
        this.hashSpec = hashSpec;
        this.sink = sink;
        this.readerExecutor = readerExecutor;
        this.shouldCancel = task.getShouldCancel();
    }

    @Override
    public Void call() {
        final Path path = task.getIdentity();

        if (isCancelled()) {
            logger.debug("Hashing of {} was cancelled before it started.", path);
            return null;
        }

        ChunkedReader reader = null;
        Future<?> reading = null;

        try {
            reader = ChunkedReader.open(path, hashSpec.getChunkSizeInBytes());

            task.captureSize(reader.size());

            if (reader.size() == 0) {
                complete(DigestAccumulator.sha256().finish());
                return null;
            }

            logger.info("Hashing {} ({})", path, DataSize.bytesToHumanReadable(reader.size()));

            if (!send(FileState.inProgress(0))) {
                return null;
            }

            final ChunkedReader opened = reader;
            final BlockingQueue<Chunk> queue = new ArrayBlockingQueue<>(hashSpec.queueCapacity);

            try {
                reading = readerExecutor.submit(() -> read(opened, queue));
            } catch (final RejectedExecutionException ex) {
                throw new HashingException(READ, "Reader of " + path + " could not be started", ex);
            }

            hash(reader.size(), queue, reading);
        } catch (final HashingException ex) {
            fail(ex);
        } finally {
            stopped.set(true);

            // a read blocked on a stalled device would otherwise hold its reader thread for good
            if (reading != null) {
                reading.cancel(true);
            }

            // the reader stage may not have started at all, closing twice is harmless
            if (reader != null) {
                reader.close();
            }
        }

        return null;
    }

    private void read(final ChunkedReader reader, final BlockingQueue<Chunk> queue) {
        try (reader) {
            while (reader.hasNext()) {
                if (!handOff(queue, Chunk.of(reader.next()))) {
                    logger.debug("Reading of {} stopped.", reader.getPath());
                    return;
                }
            }
            handOff(queue, Chunk.END);
            logger.debug("Reading of {} finished.", reader.getPath());
        } catch (final HashingException ex) {
            handOff(queue, Chunk.failure(ex));
        } catch (final RuntimeException | OutOfMemoryError ex) {
            handOff(queue, Chunk.failure(new HashingException(READ, format("Reading of %s failed: %s", reader.getPath(), ex), ex)));
        }
    }

    private boolean handOff(final BlockingQueue<Chunk> queue, final Chunk chunk) {
        try {
            while (!stopped.get() && !isCancelled()) {
                if (queue.offer(chunk, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private void hash(final long size, final BlockingQueue<Chunk> queue, final Future<?> reading) {
        final DigestAccumulator digest = DigestAccumulator.sha256();
        final ProgressTracker tracker = new ProgressTracker(size, hashSpec.progressStep);

        try {
            while (true) {
                if (isCancelled()) {
                    logger.info("Hashing of {} was cancelled.", task.getIdentity());
                    return;
                }

                final Chunk chunk = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);

                if (chunk == null) {
                    // everything a finished reader handed off is in the queue already
                    if (reading.isDone() && queue.isEmpty()) {
                        throw new HashingException(READ, format("Reader of %s stopped without reaching the end", task.getIdentity()));
                    }
                    continue;
                }

                if (chunk.failure != null) {
                    throw chunk.failure;
                }

                if (chunk == Chunk.END) {
                    break;
                }

                final int length = chunk.data.remaining();

                digest.update(chunk.data);

                final Optional<Float> percent = tracker.advance(length);

                if (percent.isPresent() && !send(FileState.inProgress(percent.get()))) {
                    return;
                }
            }
        } catch (final InterruptedException ex) {
            Thread.currentThread().interrupt();
            logger.info("Hashing of {} was interrupted.", task.getIdentity());
            return;
        }

        complete(digest.finish());
    }

    private void complete(final String digest) {
        if (send(FileState.completed(digest))) {
            logger.info("Hashing of {} finished: {}", task.getIdentity(), digest);
        }
    }

    private void fail(final HashingException ex) {
        logger.warn("Hashing of {} failed ({}): {}", task.getIdentity(), ex.getKind(), ex.getMessage());

        if (hashSpec.reportFailures) {
            send(FileState.failed(ex.getKind(), ex.getMessage()));
        }
    }

    private boolean send(final FileState state) {
        if (isCancelled() || !sink.send(state)) {
            logger.info("Nobody listens to events of {} anymore, stopping.", task.getIdentity());
            return false;
        }
        return true;
    }

    private boolean isCancelled() {
        return shouldCancel.get() || sink.isDisconnected();
    }

    private static final class Chunk {

        static final Chunk END = new Chunk(null, null);

        final ByteBuffer data;
        final HashingException failure;

        private Chunk(final ByteBuffer data, final HashingException failure) {
            this.data = data;
            this.failure = failure;
        }

        static Chunk of(final ByteBuffer data) {
            return new Chunk(data, null);
        }

        static Chunk failure(final HashingException failure) {
            return new Chunk(null, failure);
        }
    }
}
