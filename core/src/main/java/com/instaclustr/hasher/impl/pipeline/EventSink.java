package com.instaclustr.hasher.impl.pipeline;

import com.instaclustr.hasher.impl.FileState;

/**
 * Where a pipeline proposes state changes of its file.
 */
public interface EventSink {

    /**
     * Delivers a state, waiting while the consumer is not keeping up.
     *
     * @return false if nobody receives events anymore, the pipeline has to stop
     */
    boolean send(FileState state);

    /**
     * @return true once nobody receives events anymore
     */
    boolean isDisconnected();
}
