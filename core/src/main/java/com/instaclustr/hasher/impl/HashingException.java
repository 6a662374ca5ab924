package com.instaclustr.hasher.impl;

public class HashingException extends RuntimeException {

    private final FailureKind kind;

    public HashingException(final FailureKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public HashingException(final FailureKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
