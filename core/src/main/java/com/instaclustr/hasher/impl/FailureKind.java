package com.instaclustr.hasher.impl;

/**
 * Reasons a file stopped producing events before its digest was computed.
 */
public enum FailureKind {
    /**
     * File could not be opened for reading.
     */
    OPEN,
    /**
     * Size of a file could not be read from the file system.
     */
    METADATA,
    /**
     * I/O error, premature end of file or a file which changed its size while being read.
     */
    READ
}
