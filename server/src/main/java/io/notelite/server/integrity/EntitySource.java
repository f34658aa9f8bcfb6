package io.notelite.server.integrity;

import io.notelite.core.Entity;

import java.util.List;

/** Where validators read entity state from. May throw if the store cannot be read. */
@FunctionalInterface
public interface EntitySource {
    List<Entity> load();
}
