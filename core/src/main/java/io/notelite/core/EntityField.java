package io.notelite.core;

/** Addressable fields of an {@link Entity}, used to decide whether two edits can be merged. */
public enum EntityField {
    NAME,
    CONTENT,
    ANNOTATION,
    EXTRACTED_TEXT,
    TAGS,
    LINKS,
    CREATED_AT
}
