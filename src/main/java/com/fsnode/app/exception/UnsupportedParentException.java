package com.fsnode.app.exception;

/**
 * Raised when asking for the parent of a filesystem or drive root.
 */
public class UnsupportedParentException extends FsNodeException {

    public UnsupportedParentException(String path) {
        super("Unsupported parent of root " + path);
    }
}
