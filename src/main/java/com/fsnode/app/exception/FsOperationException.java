package com.fsnode.app.exception;

import com.fsnode.app.io.IoErrorCode;

/**
 * An I/O failure that survived the retry policy and that the configured mode asked to surface.
 * Can also be thrown by {@link com.fsnode.app.io.FsOperations} implementations to state the
 * classification of a failure explicitly.
 */
public class FsOperationException extends FsNodeException {

    private final IoErrorCode code;

    public FsOperationException(IoErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public FsOperationException(IoErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public IoErrorCode getCode() {
        return code;
    }
}
