package com.fsnode.app.path;

/**
 * Anything that already knows its canonical path; accepted as-is by {@link PathResolver}.
 */
public interface PathLike {
    String path();
}
