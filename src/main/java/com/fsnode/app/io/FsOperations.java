package com.fsnode.app.io;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;

/**
 * The operating-system primitives a node relies on, one call per node operation.
 * Injected into {@link com.fsnode.app.node.NodeCache}; tests substitute their own table.
 */
public interface FsOperations {

    BasicFileAttributes stat(Path path) throws IOException;

    /** Entry names of a directory, without the directory prefix. */
    List<String> list(Path path) throws IOException;

    byte[] read(Path path) throws IOException;

    /** Creates or truncates the file. */
    void write(Path path, byte[] data) throws IOException;

    /** Creates the file if needed and appends. */
    void append(Path path, byte[] data) throws IOException;

    /** Creates the directory and every missing ancestor. */
    void createDirectories(Path path) throws IOException;
}
