package com.fsnode.app.path;

/**
 * An argument the resolver could not turn into a path segment.
 *
 * @param index position in the flattened argument list
 * @param value the offending value
 */
public record ArgumentProblem(int index, Object value) {}
