package com.fsnode.app.path;

import org.junit.jupiter.api.Test;

import java.io.File;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PathResolverTest {

    private final PathResolver resolver = new PathResolver(() -> "/work/proj");

    public record Doc(String filePath) {}

    @Test
    void joinsAndNormalizesSegments() {
        ResolvedPath r = resolver.resolve("a", "", "b//c/", "d\\e");

        assertFalse(r.hasProblems());
        assertEquals("./a/b/c/d/e", r.path());
    }

    @Test
    void emptyInputIsTheWorkingDirectory() {
        assertEquals(".", resolver.resolve("").path());
        assertEquals(".", resolver.resolve().path());
        assertEquals(".", resolver.resolve("/work/proj").path());
        assertEquals(".", resolver.resolve("./").path());
    }

    @Test
    void pathsOutsideTheWorkingDirectoryStayAbsolute() {
        assertEquals("/etc/hosts", resolver.resolve("/etc", "hosts").path());
        assertEquals("/work/other", resolver.resolve("/work/proj/../other").path());
        assertEquals("/work", resolver.resolve("..").path());
        assertEquals("/", resolver.resolve("/").path());
        assertEquals("C:/data/x", resolver.resolve("C:\\data\\x").path());
    }

    @Test
    void questionMarksAndDotSegmentsAreDropped() {
        assertEquals("./ab", resolver.resolve("a?b").path());
        assertEquals("./a/c", resolver.resolve("a/./b/../c").path());
    }

    @Test
    void canonicalizeIsIdempotent() {
        for (String raw : List.of("a//b/", "./x/../y", "/tmp/z", ".", "C:/a/b", "/work/proj/q")) {
            String once = resolver.canonicalize(raw);
            assertEquals(once, resolver.canonicalize(once), "canonicalize should be idempotent for " + raw);
        }
    }

    @Test
    void iterationCallbackUsesOnlyTheValue() {
        List<String> names = List.of("w", "x");

        assertEquals("./x", resolver.resolve("x", 1, names).path());
        // index does not point at the value: every argument is a segment
        assertEquals("./x/0/w/x", resolver.resolve("x", 0, names).path());
        assertEquals("./w", resolver.resolve("w", 0, new Object[] { "w", "x" }).path());
    }

    @Test
    void nestedArraysAndIterablesAreFlattened() {
        ResolvedPath r = resolver.resolve("a", new Object[] { "b", List.of("c", 4) });

        assertEquals("./a/b/c/4", r.path());
    }

    @Test
    void pathTypesAndKeyedObjectsContributeTheirPath() {
        assertEquals("./sub/dir", resolver.resolve(Path.of("sub", "dir")).path());
        assertEquals("./f/g", resolver.resolve(new File("f/g")).path());
        assertEquals("./docs", resolver.resolve(Map.of("path", "docs")).path());
        assertEquals("./n", resolver.resolve(Map.of("path", "p", "name", "n")).path(), "name has priority over path");
        assertEquals("./docs/readme.md", resolver.resolve(new Doc("docs/readme.md")).path());

        PathLike like = () -> "/abs/like";
        assertEquals("/abs/like", resolver.resolve(like).path());
    }

    @Test
    void uninterpretableArgumentsAreReportedNotThrown() {
        ResolvedPath r = resolver.resolve("a", Boolean.TRUE, "b<c", Map.of("other", 1), "d");

        assertEquals("./a/d", r.path());
        assertEquals(List.of(1, 2, 3), r.problems().stream().map(ArgumentProblem::index).toList());
        assertEquals("b<c", r.problems().get(1).value());
    }

    @Test
    void nullsAreSkipped() {
        assertEquals("./a/b", resolver.resolve("a", null, "b").path());
        assertFalse(resolver.resolve((Object[]) null).hasProblems());
    }

    @Test
    void rootsAndDirectories() {
        assertTrue(PathResolver.isRoot("/"));
        assertTrue(PathResolver.isRoot("C:/"));
        assertTrue(PathResolver.isRoot("c:"));
        assertFalse(PathResolver.isRoot("/a"));

        assertEquals("/", PathResolver.directoryOf("/a"));
        assertEquals("/a", PathResolver.directoryOf("/a/b"));
        assertEquals("C:/", PathResolver.directoryOf("C:/x"));
        assertEquals("/work/proj/a", resolver.absolute("./a"));
    }
}
