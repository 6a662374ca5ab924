package com.instaclustr.hasher.impl;

import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * State change of a single file, tagged by the identity of that file.
 */
public final class FileEvent {

    private final Path identity;
    private final FileState state;

    public FileEvent(final Path identity, final FileState state) {
        this.identity = checkNotNull(identity, "identity can not be null");
        this.state = checkNotNull(state, "state can not be null");
    }

    @JsonProperty("file")
    @JsonSerialize(using = ToStringSerializer.class)
    public Path getIdentity() {
        return identity;
    }

    @JsonProperty("state")
    public FileState getState() {
        return state;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final FileEvent that = (FileEvent) o;
        return identity.equals(that.identity) && state.equals(that.state);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, state);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("identity", identity)
            .add("state", state)
            .toString();
    }
}
