package io.notelite.core;

/**
 * Who produced a change.
 * <p>
 * USER edits always outrank DERIVED (background analyzer) edits;
 * SYSTEM covers changes the core synthesizes itself (repairs, cascades, restores).
 */
public enum ChangeOrigin {
    USER(0.95),
    DERIVED(0.75),
    SYSTEM(0.5);

    private final double defaultConfidence;

    ChangeOrigin(double defaultConfidence) {
        this.defaultConfidence = defaultConfidence;
    }

    public double defaultConfidence() {
        return defaultConfidence;
    }
}
