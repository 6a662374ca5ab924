package com.instaclustr.hasher.impl;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Compares digests of files with the digest of a reference file. This is a display aid telling which files
 * have the same content, not a verification against known digests.
 */
public final class DigestComparison {

    public enum Outcome {
        MATCH,
        MISMATCH,
        PENDING
    }

    private DigestComparison() {
    }

    /**
     * @return outcome per file in iteration order of {@code states}, the reference itself included. Every file
     * is {@code PENDING} while the reference is not completed.
     */
    public static Map<Path, Outcome> against(final Path reference, final Map<Path, FileState> states) {
        checkNotNull(reference, "reference file can not be null");

        final FileState referenceState = states.get(reference);
        final String referenceDigest = referenceState instanceof FileState.Completed
            ? ((FileState.Completed) referenceState).getDigest()
            : null;

        final Map<Path, Outcome> outcomes = new LinkedHashMap<>();

        for (final Map.Entry<Path, FileState> entry : states.entrySet()) {
            if (referenceDigest == null || !(entry.getValue() instanceof FileState.Completed)) {
                outcomes.put(entry.getKey(), Outcome.PENDING);
            } else if (referenceDigest.equals(((FileState.Completed) entry.getValue()).getDigest())) {
                outcomes.put(entry.getKey(), Outcome.MATCH);
            } else {
                outcomes.put(entry.getKey(), Outcome.MISMATCH);
            }
        }

        return outcomes;
    }
}
