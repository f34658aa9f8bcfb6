package io.notelite.storage.tx;

public enum TransactionType {
    READ_ONLY,
    READ_WRITE,
    WRITE_ONLY;

    public boolean allowsWrites() {
        return this != READ_ONLY;
    }
}
