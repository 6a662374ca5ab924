package com.instaclustr.hasher.threading;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.instaclustr.hasher.threading.Executors.FixedTasksExecutorSupplier;

public class ExecutorsModule extends AbstractModule {

    @Provides
    @Singleton
    Executors.ExecutorServiceSupplier getHashingExecutorSupplier() {
        return new FixedTasksExecutorSupplier();
    }
}
