package com.instaclustr.hasher.impl.hash;

import com.instaclustr.hasher.cli.typeconverter.DataSizeTypeConverter;
import com.instaclustr.hasher.measure.DataSize;
import com.instaclustr.hasher.threading.Executors;
import picocli.CommandLine.Option;

import static java.lang.String.format;

/**
 * Tunables of the hashing engine. The digest algorithm itself is fixed to SHA-256.
 */
public class HashSpec {

    public static final String ALGORITHM = "SHA-256";

    public static final DataSize DEFAULT_CHUNK_SIZE = DataSize.parse("1MiB");
    public static final int DEFAULT_QUEUE_CAPACITY = 10;
    public static final int DEFAULT_OUTPUT_CAPACITY = 3;
    public static final float DEFAULT_PROGRESS_STEP = 1.0f;

    @Option(names = {"--chunk-size"},
        description = "Size of a chunk read from a file at once, e.g. 512KiB or 1MiB. Default: 1MiB.",
        converter = DataSizeTypeConverter.class)
    public DataSize chunkSize = DEFAULT_CHUNK_SIZE;

    @Option(names = {"--queue-capacity"},
        description = "Number of chunks read ahead of hashing for one file. Default: 10.")
    public int queueCapacity = DEFAULT_QUEUE_CAPACITY;

    @Option(names = {"--output-capacity"},
        description = "Number of events buffered for a consumer before hashing waits. Default: 3.")
    public int outputCapacity = DEFAULT_OUTPUT_CAPACITY;

    @Option(names = {"--max-concurrent-files", "--parallelism"},
        description = "Number of files hashed concurrently, other files wait. Default is 50% of available CPUs.")
    public Integer maxConcurrentFiles;

    @Option(names = {"--progress-step"},
        description = "Minimal increase of percentage before a progress event is emitted, 0 emits on every increase. Default: 1.0.")
    public float progressStep = DEFAULT_PROGRESS_STEP;

    @Option(names = {"--report-failures"},
        description = "Emit an event with the kind of failure when a file can not be hashed, by default hashing of such file just stops.")
    public boolean reportFailures;

    public HashSpec() {
        // for picocli
    }

    public HashSpec(final DataSize chunkSize,
                    final int queueCapacity,
                    final int outputCapacity,
                    final Integer maxConcurrentFiles,
                    final float progressStep) {
        this(chunkSize, queueCapacity, outputCapacity, maxConcurrentFiles, progressStep, false);
    }

    public HashSpec(final DataSize chunkSize,
                    final int queueCapacity,
                    final int outputCapacity,
                    final Integer maxConcurrentFiles,
                    final float progressStep,
                    final boolean reportFailures) {
        this.chunkSize = chunkSize;
        this.queueCapacity = queueCapacity;
        this.outputCapacity = outputCapacity;
        this.maxConcurrentFiles = maxConcurrentFiles;
        this.progressStep = progressStep;
        this.reportFailures = reportFailures;
    }

    public int getChunkSizeInBytes() {
        return (int) chunkSize.toBytes();
    }

    public int getMaxConcurrentFiles() {
        return maxConcurrentFiles == null ? Executors.DEFAULT_CONCURRENT_FILES : maxConcurrentFiles;
    }

    public HashSpec validate() {
        if (chunkSize == null || !fitsInChunk(chunkSize)) {
            throw new IllegalArgumentException(format("Chunk size has to be between 1 byte and 2GiB but was %s", chunkSize));
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException(format("Queue capacity has to be greater than 0 but was %s", queueCapacity));
        }
        if (outputCapacity <= 0) {
            throw new IllegalArgumentException(format("Output capacity has to be greater than 0 but was %s", outputCapacity));
        }
        if (maxConcurrentFiles != null && maxConcurrentFiles <= 0) {
            throw new IllegalArgumentException(format("Maximal number of concurrent files has to be greater than 0 but was %s", maxConcurrentFiles));
        }
        if (Float.isNaN(progressStep) || progressStep < 0 || progressStep > 100) {
            throw new IllegalArgumentException(format("Progress step has to be in range [0, 100] but was %s", progressStep));
        }
        return this;
    }

    private static boolean fitsInChunk(final DataSize size) {
        try {
            return size.toBytes() > 0 && size.toBytes() <= Integer.MAX_VALUE;
        } catch (final ArithmeticException ex) {
            return false;
        }
    }

    @Override
    public String toString() {
        return "HashSpec{" +
            "algorithm=" + ALGORITHM +
            ", chunkSize=" + chunkSize +
            ", queueCapacity=" + queueCapacity +
            ", outputCapacity=" + outputCapacity +
            ", maxConcurrentFiles=" + getMaxConcurrentFiles() +
            ", progressStep=" + progressStep +
            ", reportFailures=" + reportFailures +
            '}';
    }
}
