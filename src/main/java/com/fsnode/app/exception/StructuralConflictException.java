package com.fsnode.app.exception;

/**
 * The requested operation contradicts the current shape of the filesystem,
 * e.g. creating a folder over a file or writing without overwrite onto an existing file.
 */
public class StructuralConflictException extends FsNodeException {

    private final String path;

    public StructuralConflictException(String message, String path) {
        super(message + " at " + path);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
