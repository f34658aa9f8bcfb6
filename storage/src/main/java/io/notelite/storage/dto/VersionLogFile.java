package io.notelite.storage.dto;

import java.util.ArrayList;
import java.util.List;

/** JSON root of the history log. */
public class VersionLogFile {
    public String policy;
    public String cursorVersionId;
    public long nextSequence;
    /** Entries from earlier sessions that can be listed but not replayed. */
    public List<VersionEntryDto> archived = new ArrayList<>();
    public List<VersionEntryDto> versions = new ArrayList<>();
}
