package com.instaclustr.hasher.impl;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import static java.lang.String.format;

/**
 * Overall progress of a set of files, derived purely from their states.
 */
public final class HashingProgress {

    public static final String TITLE = "hasher";

    private HashingProgress() {
    }

    /**
     * Files which did not make any progress yet do not hold the overall progress down.
     *
     * @return lowest non-zero percentage among files in progress, 0 if no file made progress
     */
    public static float overall(final Map<Path, FileState> states) {
        float lowest = 0;

        for (final FileState state : states.values()) {
            if (state instanceof FileState.InProgress) {
                final float percent = ((FileState.InProgress) state).getPercent();

                if (percent > 0) {
                    lowest = lowest == 0 ? percent : Math.min(lowest, percent);
                }
            }
        }

        return lowest;
    }

    /**
     * @return e.g. {@code "42% - hasher"}, or just {@code "hasher"} when there is no progress to show
     */
    public static String title(final Map<Path, FileState> states) {
        final float overall = overall(states);

        if (overall == 0) {
            return TITLE;
        }

        return format(Locale.ROOT, "%.0f%% - %s", overall, TITLE);
    }
}
