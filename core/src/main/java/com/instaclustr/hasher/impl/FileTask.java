package com.instaclustr.hasher.impl;

import java.nio.file.Path;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static java.lang.String.format;

/**
 * Unit of hashing work for one file.
 *
 * <p>Identity is fixed at creation. Size is captured exactly once, by the pipeline, before the first chunk is read.</p>
 */
public class FileTask {

    public static final long UNKNOWN_SIZE = -1;

    private final Path identity;
    private final AtomicBoolean shouldCancel = new AtomicBoolean(false);
    private final AtomicLong size = new AtomicLong(UNKNOWN_SIZE);

    private volatile FileState state = FileState.pending();
    private volatile Future<?> future;

    public FileTask(final Path identity) {
        this.identity = checkNotNull(identity, "identity can not be null");
    }

    public Path getIdentity() {
        return identity;
    }

    public long getSize() {
        return size.get();
    }

    public void captureSize(final long size) {
        checkArgument(size >= 0, "size of %s can not be negative: %s", identity, size);

        if (!this.size.compareAndSet(UNKNOWN_SIZE, size)) {
            throw new IllegalStateException(format("size of %s was already captured as %s", identity, this.size.get()));
        }
    }

    public FileState getState() {
        return state;
    }

    public void setState(final FileState state) {
        this.state = checkNotNull(state, "state can not be null");
    }

    public AtomicBoolean getShouldCancel() {
        return shouldCancel;
    }

    public void setFuture(final Future<?> future) {
        this.future = future;
    }

    /**
     * @return true until the pipeline of this task exited, for whatever reason
     */
    public boolean isActive() {
        final Future<?> submitted = future;
        return submitted == null || !submitted.isDone();
    }

    public void cancel() {
        shouldCancel.set(true);

        final Future<?> submitted = future;

        // only drops a pipeline which has not started yet, a running one stops on its next check of shouldCancel
        if (submitted != null) {
            submitted.cancel(false);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("identity", identity)
            .add("size", size.get())
            .add("state", state)
            .add("shouldCancel", shouldCancel.get())
            .toString();
    }
}
