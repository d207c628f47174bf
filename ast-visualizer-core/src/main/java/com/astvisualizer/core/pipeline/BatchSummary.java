package com.astvisualizer.core.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of converting a directory of dumps.
 *
 * @param entries one entry per dump file, in processing order
 */
public record BatchSummary(
    List<Entry> entries
) {
    /**
     * Compact constructor with validation.
     */
    public BatchSummary {
        Objects.requireNonNull(entries, "entries must not be null");
        entries = List.copyOf(entries);
    }

    public int total() {
        return entries.size();
    }

    public long succeeded() {
        return entries.stream().filter(Entry::isSuccess).count();
    }

    public long failed() {
        return total() - succeeded();
    }

    public boolean allSucceeded() {
        return failed() == 0;
    }

    /**
     * Conversion outcome of one file: exactly one of {@code result} and {@code failure} is set.
     *
     * @param input dump file
     * @param result conversion result on success
     * @param failure cause on failure
     */
    public record Entry(
        Path input,
        ConversionResult result,
        ConversionException failure
    ) {
        public Entry {
            Objects.requireNonNull(input, "input must not be null");
            if ((result == null) == (failure == null)) {
                throw new IllegalArgumentException("exactly one of result and failure must be set");
            }
        }

        public static Entry success(ConversionResult result) {
            return new Entry(result.input(), result, null);
        }

        public static Entry failure(Path input, ConversionException failure) {
            return new Entry(input, null, failure);
        }

        public boolean isSuccess() {
            return result != null;
        }

        public Optional<ConversionResult> resultIfPresent() {
            return Optional.ofNullable(result);
        }
    }
}
