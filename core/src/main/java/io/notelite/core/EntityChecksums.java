package io.notelite.core;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * Content checksums over entity collections.
 * <p>
 * IMPORTANT: entities are sorted by id and links by their string form, and every field
 * is written length-prefixed, so the same logical state always hashes to the same value
 * regardless of insertion order in the store.
 */
public final class EntityChecksums {

    private EntityChecksums() {
        // utility
    }

    /** SHA-256 hex digest of the given state. */
    public static String of(Collection<Entity> entities) {
        MessageDigest md = sha256();

        List<Entity> sorted = new ArrayList<>(entities);
        sorted.sort(Comparator.comparing(Entity::id));

        md.update(intBytes(sorted.size()));
        for (Entity e : sorted) {
            digestEntity(md, e);
        }
        return HexFormat.of().formatHex(md.digest());
    }

    /** SHA-256 hex digest of raw bytes, used for backup exports. */
    public static String ofBytes(byte[] data) {
        MessageDigest md = sha256();
        md.update(data);
        return HexFormat.of().formatHex(md.digest());
    }

    /** Checksum of the empty state. */
    public static String empty() {
        return of(List.of());
    }

    private static void digestEntity(MessageDigest md, Entity e) {
        update(md, e.id().toString());
        update(md, e.name());
        md.update(longBytes(e.createdAtMillis()));
        update(md, e.content());
        update(md, e.annotation());
        update(md, e.extractedText());

        md.update(intBytes(e.tags().size()));
        for (String tag : e.tags()) {
            update(md, tag);
        }

        List<String> links = new ArrayList<>(e.links().size());
        for (UUID l : e.links()) {
            links.add(l.toString());
        }
        links.sort(Comparator.naturalOrder());
        md.update(intBytes(links.size()));
        for (String l : links) {
            update(md, l);
        }
    }

    private static void update(MessageDigest md, String s) {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        md.update(intBytes(b.length));
        md.update(b);
    }

    private static byte[] intBytes(int v) {
        return ByteBuffer.allocate(4).putInt(v).array();
    }

    private static byte[] longBytes(long v) {
        return ByteBuffer.allocate(8).putLong(v).array();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to create SHA-256 MessageDigest", e);
        }
    }
}
