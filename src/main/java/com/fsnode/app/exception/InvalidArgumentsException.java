package com.fsnode.app.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fsnode.app.path.ArgumentProblem;

import java.util.List;

/**
 * Arguments that could not be turned into a path, or an invalid child name.
 */
public class InvalidArgumentsException extends FsNodeException {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<ArgumentProblem> problems;

    public InvalidArgumentsException(List<ArgumentProblem> problems) {
        super("Invalid arguments: " + describe(problems));
        this.problems = List.copyOf(problems);
    }

    public InvalidArgumentsException(String message) {
        super(message);
        this.problems = List.of();
    }

    public List<ArgumentProblem> getProblems() {
        return problems;
    }

    /**
     * Renders problems as a JSON array of {@code {"i": index, "arg": value}}.
     */
    public static String describe(List<ArgumentProblem> problems) {
        ArrayNode out = MAPPER.createArrayNode();
        for (ArgumentProblem p : problems) {
            ObjectNode n = out.addObject();
            n.put("i", p.index());
            n.put("arg", String.valueOf(p.value()));
        }
        try {
            return MAPPER.writeValueAsString(out);
        } catch (JsonProcessingException e) {
            return problems.toString();
        }
    }
}
