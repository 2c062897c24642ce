package com.fsnode.app.io;

import com.fsnode.app.exception.FsOperationException;

import java.io.FileNotFoundException;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Symbolic classification of I/O failures. Only {@link #NOT_FOUND} and {@link #BUSY} are
 * considered transient: entries that appear a moment later and locks held briefly.
 */
public enum IoErrorCode {
    NOT_FOUND("ENOENT", true),
    BUSY("EBUSY", true),
    ACCESS_DENIED("EACCES", false),
    ALREADY_EXISTS("EEXIST", false),
    NOT_DIRECTORY("ENOTDIR", false),
    IS_DIRECTORY("EISDIR", false),
    NOT_EMPTY("ENOTEMPTY", false),
    NO_SPACE("ENOSPC", false),
    IO("EIO", false);

    private final String symbol;
    private final boolean transientError;

    IoErrorCode(String symbol, boolean transientError) {
        this.symbol = symbol;
        this.transientError = transientError;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isTransient() {
        return transientError;
    }

    public static IoErrorCode classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t == null) return IO;
        if (t instanceof FsOperationException foe && foe.getCode() != null) return foe.getCode();
        if (t instanceof NoSuchFileException) return NOT_FOUND;
        if (t instanceof AccessDeniedException) return ACCESS_DENIED;
        if (t instanceof FileAlreadyExistsException) return ALREADY_EXISTS;
        if (t instanceof NotDirectoryException) return NOT_DIRECTORY;
        if (t instanceof DirectoryNotEmptyException) return NOT_EMPTY;

        String reason = t instanceof FileSystemException fse && fse.getReason() != null
                ? fse.getReason()
                : t.getMessage();
        String msg = reason == null ? "" : reason.toLowerCase(Locale.ROOT);

        if (msg.contains("busy") || msg.contains("being used by another process") || msg.contains("locked")) {
            return BUSY;
        }
        if (msg.contains("is a directory")) return IS_DIRECTORY;
        if (msg.contains("not a directory")) return NOT_DIRECTORY;
        if (msg.contains("no space left")) return NO_SPACE;
        if (msg.contains("permission denied") || msg.contains("access is denied")) return ACCESS_DENIED;
        if (t instanceof FileNotFoundException || msg.contains("no such file")) return NOT_FOUND;
        return IO;
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException || t instanceof UncheckedIOException)
                && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
