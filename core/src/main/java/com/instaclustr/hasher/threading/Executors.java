package com.instaclustr.hasher.threading;

import java.util.concurrent.ThreadFactory;

import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

public abstract class Executors {

    public static final Integer DEFAULT_CONCURRENT_FILES = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);

    public static final class FixedTasksExecutorSupplier extends ExecutorServiceSupplier {

        @Override
        public ListeningExecutorService get(final Integer concurrentTasks, final String nameFormat) {
            final int threads = concurrentTasks != null ? concurrentTasks : DEFAULT_CONCURRENT_FILES;

            return MoreExecutors.listeningDecorator(java.util.concurrent.Executors.newFixedThreadPool(threads, threadFactory(nameFormat)));
        }
    }

    public static abstract class ExecutorServiceSupplier {

        public abstract ListeningExecutorService get(final Integer concurrentTasks, final String nameFormat);

        // daemon threads, a stuck read must not keep the JVM alive
        protected ThreadFactory threadFactory(final String nameFormat) {
            return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
        }
    }
}
