package com.fsnode.app.path;

import java.util.List;

public record ResolvedPath(String path, List<ArgumentProblem> problems) {

    public ResolvedPath {
        problems = List.copyOf(problems);
    }

    public boolean hasProblems() {
        return !problems.isEmpty();
    }
}
