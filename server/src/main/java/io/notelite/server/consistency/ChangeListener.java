package io.notelite.server.consistency;

/** Callback for a collaborator; runs on the notifier thread, never on the owner thread. */
@FunctionalInterface
public interface ChangeListener {
    void onChange(ChangeEvent event) throws Exception;
}
