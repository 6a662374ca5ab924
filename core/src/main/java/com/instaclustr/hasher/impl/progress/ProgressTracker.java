package com.instaclustr.hasher.impl.progress;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Turns cumulative number of consumed bytes into a percentage worth reporting.
 *
 * <p>A percentage is reported only if it is greater than the last reported one by at least {@code step}
 * percentage points. Reaching 100 % is always reported. The tracker starts at 0 %, which is never reported
 * by it, so an empty file never produces any percentage.</p>
 */
public class ProgressTracker {

    private final long totalBytes;
    private final float step;

    private long consumedBytes;
    private float lastReported;

    public ProgressTracker(final long totalBytes, final float step) {
        checkArgument(totalBytes >= 0, "total bytes can not be negative: %s", totalBytes);
        checkArgument(step >= 0, "step can not be negative: %s", step);
        this.totalBytes = totalBytes;
        this.step = step;
    }

    /**
     * Accounts for {@code bytes} more consumed bytes.
     *
     * @return percentage to report, empty if there is nothing new worth reporting
     */
    public Optional<Float> advance(final long bytes) {
        checkArgument(bytes >= 0, "consumed bytes can not be negative: %s", bytes);

        consumedBytes += bytes;

        if (totalBytes == 0) {
            return Optional.empty();
        }

        final float percent = clamp((float) (100.0 * consumedBytes / totalBytes));

        if (percent <= lastReported) {
            return Optional.empty();
        }

        if (percent - lastReported < step && percent < 100f) {
            return Optional.empty();
        }

        lastReported = percent;

        return Optional.of(percent);
    }

    public long getConsumedBytes() {
        return consumedBytes;
    }

    public float getLastReported() {
        return lastReported;
    }

    private static float clamp(final float percent) {
        return Math.max(0f, Math.min(100f, percent));
    }
}
