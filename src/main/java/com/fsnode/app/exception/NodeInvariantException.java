package com.fsnode.app.exception;

public class NodeInvariantException extends FsNodeException {

    public NodeInvariantException(String message) {
        super(message);
    }
}
