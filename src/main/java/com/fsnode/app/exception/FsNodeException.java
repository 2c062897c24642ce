package com.fsnode.app.exception;

/**
 * Base type of every error raised by the node layer.
 */
public class FsNodeException extends RuntimeException {

    public FsNodeException(String message) {
        super(message);
    }

    public FsNodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
