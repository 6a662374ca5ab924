package com.instaclustr.hasher.measure;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import static java.lang.String.format;

public class DataSize {

    private static final Pattern DATA_SIZE_PATTERN = Pattern.compile("^\\s*(\\d+)\\s*([a-zA-Z]*)\\s*$");

    public final Long value;
    public final DataSizeUnit unit;

    @JsonCreator
    public DataSize(@JsonProperty("value") final Long value,
                    @JsonProperty("unit") final DataSizeUnit unit) {
        if (value == null || value < 0) {
            throw new IllegalArgumentException(format("Data size has to be a non-negative number but was %s", value));
        }
        if (unit == null) {
            throw new IllegalArgumentException("Unit of data size can not be null");
        }
        this.value = value;
        this.unit = unit;
    }

    public static DataSize bytes(final long value) {
        return new DataSize(value, DataSizeUnit.BYTES);
    }

    /**
     * Parses values like {@code 512}, {@code 64KiB} or {@code 1MiB}. A value without a unit is in bytes.
     */
    public static DataSize parse(final String value) {
        if (value == null) {
            throw new IllegalArgumentException("Data size to parse can not be null");
        }

        final Matcher matcher = DATA_SIZE_PATTERN.matcher(value);

        if (!matcher.matches()) {
            throw new IllegalArgumentException(format("Unable to parse data size '%s', expected format is e.g. 1MiB", value));
        }

        return new DataSize(Long.parseLong(matcher.group(1)), DataSizeUnit.parse(matcher.group(2)));
    }

    public long toBytes() {
        return Math.multiplyExact(value, unit.bytes);
    }

    public static String bytesToHumanReadable(final long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }

        double value = bytes;
        int exponent = 0;

        while (value >= 1024 && exponent < 6) {
            value /= 1024;
            exponent++;
        }

        return String.format(Locale.ROOT, "%.1f %siB", value, "KMGTPE".charAt(exponent - 1));
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof DataSize)) {
            return false;
        }

        final DataSize other = (DataSize) obj;

        return this.value.equals(other.value) && this.unit == other.unit;
    }

    @Override
    public int hashCode() {
        return 31 * value.hashCode() + unit.hashCode();
    }

    @Override
    public String toString() {
        return value + unit.toString();
    }

    public enum DataSizeUnit {
        BYTES("B", 1L),
        KIBIBYTES("KiB", 1024L),
        MEBIBYTES("MiB", 1024L * 1024L),
        GIBIBYTES("GiB", 1024L * 1024L * 1024L);

        final String unit;
        final long bytes;

        DataSizeUnit(final String unit, final long bytes) {
            this.unit = unit;
            this.bytes = bytes;
        }

        static DataSizeUnit parse(final String value) {
            if (value == null || value.isEmpty()) {
                return BYTES;
            }

            for (final DataSizeUnit candidate : values()) {
                if (candidate.unit.equalsIgnoreCase(value)) {
                    return candidate;
                }
            }

            throw new IllegalArgumentException(format("Unknown data size unit '%s', possible units are B, KiB, MiB and GiB", value));
        }

        @Override
        public String toString() {
            return unit;
        }
    }
}
