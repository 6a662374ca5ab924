package com.instaclustr.hasher.impl.scheduler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.AbstractIdleService;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.Inject;
import com.instaclustr.hasher.impl.FileEvent;
import com.instaclustr.hasher.impl.FileState;
import com.instaclustr.hasher.impl.FileTask;
import com.instaclustr.hasher.impl.hash.HashSpec;
import com.instaclustr.hasher.impl.pipeline.EventSink;
import com.instaclustr.hasher.impl.pipeline.FilePipeline;
import com.instaclustr.hasher.threading.Executors.ExecutorServiceSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Runs one {@link FilePipeline} per tracked file and multiplexes their events into one {@link EventStream}.
 *
 * <p>A file is tracked from {@link #begin(Path)} until {@link #remove(Path)}. Completed files are never hashed
 * again while tracked, a file whose pipeline stopped without a digest is hashed again on an explicit
 * {@link #begin(Path)}. At most
 * {@link HashSpec#getMaxConcurrentFiles()} files are hashed at once, others stay pending.</p>
 */
public class HashingScheduler extends AbstractIdleService {

    private static final Logger logger = LoggerFactory.getLogger(HashingScheduler.class);

    private final HashSpec hashSpec;
    private final ListeningExecutorService pipelineExecutorService;
    private final ListeningExecutorService readerExecutorService;
    private final EventStream events;

    private final Map<Path, FileTask> tasks = new ConcurrentHashMap<>();

    @Inject
    public HashingScheduler(final HashSpec hashSpec,
                            final ExecutorServiceSupplier executorServiceSupplier) {
        this.hashSpec = hashSpec.validate();
        this.pipelineExecutorService = executorServiceSupplier.get(hashSpec.getMaxConcurrentFiles(), "hasher-pipeline-%d");
        // every running pipeline has exactly one reader
        this.readerExecutorService = executorServiceSupplier.get(hashSpec.getMaxConcurrentFiles(), "hasher-reader-%d");
        this.events = new EventStream(hashSpec.outputCapacity);
    }

    @Override
    protected void startUp() throws Exception {
        logger.info("Starting hashing scheduler with {}", hashSpec);
    }

    @Override
    protected void shutDown() throws Exception {
        logger.info("Shutting down hashing scheduler ...");

        cancelAll();
        events.close();

        MoreExecutors.shutdownAndAwaitTermination(pipelineExecutorService, 1, TimeUnit.MINUTES);
        MoreExecutors.shutdownAndAwaitTermination(readerExecutorService, 1, TimeUnit.MINUTES);

        logger.info("Hashing scheduler terminated.");
    }

    /**
     * Starts hashing a file unless it is already tracked.
     *
     * @return true if hashing of the file was started, false if the file is being hashed or was hashed already, or
     * it is not a regular file
     */
    public synchronized boolean begin(final Path file) {
        checkNotNull(file, "file to hash can not be null");
        checkState(isRunning(), "hashing scheduler is not running, it is %s", state());

        final Path identity = file.toAbsolutePath().normalize();

        if (!Files.isRegularFile(identity)) {
            logger.warn("Not hashing {}, it is not a regular file.", identity);
            return false;
        }

        final FileTask existing = tasks.get(identity);

        if (existing != null && (existing.isActive() || existing.getState() instanceof FileState.Completed)) {
            logger.debug("Not hashing {} again, it is already {}.", identity, existing.getState());
            return false;
        }

        final FileTask task = new FileTask(identity);
        tasks.put(identity, task);

        final ListenableFuture<Void> future = pipelineExecutorService.submit(new FilePipeline(task,
                                                                                              hashSpec,
                                                                                              new TaskSink(task),
                                                                                              readerExecutorService));
        task.setFuture(future);

        Futures.addCallback(future, new FutureCallback<Void>() {
            @Override
            public void onSuccess(final Void result) {
                logger.debug("Pipeline of {} exited.", identity);
            }

            @Override
            public void onFailure(final Throwable t) {
                if (!future.isCancelled()) {
                    logger.error("Pipeline of {} failed unexpectedly.", identity, t);
                }
            }
        }, MoreExecutors.directExecutor());

        logger.debug("Submitted {} for hashing.", identity);

        return true;
    }

    /**
     * Stops tracking a file, its events are not forwarded anymore and its pipeline stops on its next check.
     */
    public synchronized void remove(final Path file) {
        checkNotNull(file, "file to remove can not be null");

        final FileTask task = tasks.remove(file.toAbsolutePath().normalize());

        if (task != null) {
            task.cancel();
            events.purgeDisconnected();
            logger.debug("Removed {} in state {}.", task.getIdentity(), task.getState());
        }
    }

    public synchronized void cancelAll() {
        for (final Path identity : new ArrayList<>(tasks.keySet())) {
            remove(identity);
        }
    }

    /**
     * @return true while a pipeline hashes the file, false once it completed, failed or was never tracked
     */
    public boolean isHashing(final Path file) {
        checkNotNull(file, "file can not be null");

        final FileTask task = tasks.get(file.toAbsolutePath().normalize());

        return task != null && task.isActive();
    }

    public EventStream events() {
        return events;
    }

    /**
     * @return snapshot of states of all tracked files
     */
    public Map<Path, FileState> tasks() {
        return tasks.entrySet()
            .stream()
            .collect(ImmutableMap.toImmutableMap(Entry::getKey, entry -> entry.getValue().getState()));
    }

    private final class TaskSink implements EventSink {

        private final FileTask task;

        private TaskSink(final FileTask task) {
            this.task = task;
        }

        @Override
        public boolean send(final FileState state) {
            if (isDisconnected()) {
                return false;
            }

            // recorded before delivery so a consumer seeing the event sees the same state in tasks()
            task.setState(state);

            return events.send(new FileEvent(task.getIdentity(), state), this::isDisconnected);
        }

        @Override
        public boolean isDisconnected() {
            return events.isClosed() || task.getShouldCancel().get() || tasks.get(task.getIdentity()) != task;
        }
    }
}
