package com.fsnode.app.node;

import java.nio.file.attribute.BasicFileAttributes;

/**
 * What a node currently is on disk.
 */
public enum NodeKind {
    FILE,
    FOLDER,
    /** Missing, unreadable, or neither a regular file nor a directory. */
    ABSENT;

    public static NodeKind of(BasicFileAttributes attrs) {
        if (attrs == null) return ABSENT;
        if (attrs.isRegularFile()) return FILE;
        if (attrs.isDirectory()) return FOLDER;
        return ABSENT;
    }
}
