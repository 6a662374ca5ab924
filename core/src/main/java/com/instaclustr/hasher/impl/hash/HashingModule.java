package com.instaclustr.hasher.impl.hash;

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.instaclustr.hasher.impl.scheduler.HashingScheduler;

public class HashingModule extends AbstractModule {

    private final HashSpec hashSpec;

    public HashingModule(final HashSpec hashSpec) {
        this.hashSpec = hashSpec;
    }

    @Override
    protected void configure() {
        bind(HashSpec.class).toInstance(this.hashSpec.validate());
        bind(HashingScheduler.class).in(Singleton.class);
    }
}
