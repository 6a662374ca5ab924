package com.instaclustr.hasher.impl;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * State of a hashed file as observed by a consumer of hashing events.
 *
 * <p>The lifecycle is {@code PENDING -> IN_PROGRESS* -> COMPLETED}, or {@code FAILED} from any non-terminal state.
 * Percentages reported by {@link InProgress} never decrease for one file.</p>
 */
@JsonPropertyOrder({"type"})
public abstract class FileState {

    public enum Type {
        PENDING, IN_PROGRESS, COMPLETED, FAILED;

        public static final Set<Type> TERMINAL_TYPES = EnumSet.of(COMPLETED, FAILED);

        public boolean isTerminal() {
            return TERMINAL_TYPES.contains(this);
        }
    }

    @JsonProperty("type")
    public abstract Type getType();

    @JsonIgnore
    public boolean isTerminal() {
        return getType().isTerminal();
    }

    public static Pending pending() {
        return Pending.INSTANCE;
    }

    public static InProgress inProgress(final float percent) {
        return new InProgress(percent);
    }

    public static Completed completed(final String digest) {
        return new Completed(digest);
    }

    public static Failed failed(final FailureKind kind, final String message) {
        return new Failed(kind, message);
    }

    public static final class Pending extends FileState {

        private static final Pending INSTANCE = new Pending();

        private Pending() {
        }

        @Override
        public Type getType() {
            return Type.PENDING;
        }

        @Override
        public String toString() {
            return "Pending";
        }
    }

    public static final class InProgress extends FileState {

        private final float percent;

        private InProgress(final float percent) {
            checkArgument(percent >= 0 && percent <= 100, "percent has to be in range [0, 100] but was %s", percent);
            this.percent = percent;
        }

        @Override
        public Type getType() {
            return Type.IN_PROGRESS;
        }

        @JsonProperty("percent")
        public float getPercent() {
            return percent;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return Float.compare(((InProgress) o).percent, percent) == 0;
        }

        @Override
        public int hashCode() {
            return Float.hashCode(percent);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper("InProgress").add("percent", percent).toString();
        }
    }

    public static final class Completed extends FileState {

        private final String digest;

        private Completed(final String digest) {
            this.digest = checkNotNull(digest, "digest can not be null");
        }

        @Override
        public Type getType() {
            return Type.COMPLETED;
        }

        @JsonProperty("digest")
        public String getDigest() {
            return digest;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return digest.equals(((Completed) o).digest);
        }

        @Override
        public int hashCode() {
            return digest.hashCode();
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper("Completed").add("digest", digest).toString();
        }
    }

    public static final class Failed extends FileState {

        private final FailureKind kind;
        private final String message;

        private Failed(final FailureKind kind, final String message) {
            this.kind = checkNotNull(kind, "kind of failure can not be null");
            this.message = message;
        }

        @Override
        public Type getType() {
            return Type.FAILED;
        }

        @JsonProperty("kind")
        public FailureKind getKind() {
            return kind;
        }

        @JsonProperty("message")
        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            final Failed failed = (Failed) o;
            return kind == failed.kind && Objects.equals(message, failed.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, message);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper("Failed").add("kind", kind).add("message", message).toString();
        }
    }
}
