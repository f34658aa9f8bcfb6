package io.notelite.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Write-then-rename helper for every durable file the core owns.
 * <p>
 * Atomicity:
 *   - bytes go to "name.tmp" first and are forced to disk,
 *   - then the temp file is moved over "name" with ATOMIC_MOVE,
 * so readers see either the old file or the new one, never a partial write.
 */
public final class AtomicFiles {

    private AtomicFiles() {
        // utility
    }

    public static void write(Path dst, byte[] bytes) {
        Path tmp = dst.resolveSibling(dst.getFileName().toString() + ".tmp");
        try {
            Path parent = dst.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel ch = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                ch.force(true);
            }
            try {
                Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, dst, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + dst, e);
        }
    }
}
