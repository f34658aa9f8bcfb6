package io.notelite.storage.dto;

import java.util.ArrayList;
import java.util.List;

/** JSON root of a {@code <id>.backup} file. */
public class BackupFileDto {
    public String id;
    public long createdAtMillis;
    public String type = "full";
    public String trigger;
    public String checksum;
    public long size;
    public int entityCount;
    public List<EntityDto> entities = new ArrayList<>();
}
