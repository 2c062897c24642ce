package com.fsnode.app.exception;

import com.fsnode.app.path.ArgumentProblem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InvalidArgumentsExceptionTest {

    @Test
    void messageListsProblemsAsJson() {
        var e = new InvalidArgumentsException(List.of(new ArgumentProblem(1, true), new ArgumentProblem(3, "a<b")));

        assertEquals("Invalid arguments: [{\"i\":1,\"arg\":\"true\"},{\"i\":3,\"arg\":\"a<b\"}]", e.getMessage());
        assertEquals(2, e.getProblems().size());
    }

    @Test
    void conflictMessageNamesThePath() {
        var e = new StructuralConflictException("Cannot create folder on an existing file", "./a");

        assertEquals("Cannot create folder on an existing file at ./a", e.getMessage());
        assertEquals("./a", e.getPath());
        assertInstanceOf(FsNodeException.class, e);
    }
}
