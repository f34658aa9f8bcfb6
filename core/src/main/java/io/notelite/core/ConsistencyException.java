package io.notelite.core;

import java.util.Objects;

/**
 * Failure raised by the consistency core, tagged with how a caller should react.
 */
public class ConsistencyException extends RuntimeException {

    /**
     * Error taxonomy.
     *  - TRANSIENT:  I/O failure or timeout; the caller may retry.
     *  - STRUCTURAL: needs a decision (manual conflict resolution, checksum mismatch).
     *  - FATAL:      state may be corrupted; the only category worth showing to a human as such.
     */
    public enum Category {
        TRANSIENT,
        STRUCTURAL,
        FATAL
    }

    private final Category category;

    public ConsistencyException(Category category, String message) {
        super(message);
        this.category = Objects.requireNonNull(category, "category");
    }

    public ConsistencyException(Category category, String message, Throwable cause) {
        super(message, cause);
        this.category = Objects.requireNonNull(category, "category");
    }

    public Category category() {
        return category;
    }

    public static ConsistencyException transientFailure(String message, Throwable cause) {
        return new ConsistencyException(Category.TRANSIENT, message, cause);
    }

    public static ConsistencyException structural(String message) {
        return new ConsistencyException(Category.STRUCTURAL, message);
    }

    public static ConsistencyException fatal(String message) {
        return new ConsistencyException(Category.FATAL, message);
    }
}
