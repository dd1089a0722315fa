package org.rostilos.gitlabsync.engine.mapping;

import java.util.List;

/**
 * The mapping file could not be read or is invalid. Carries every problem found, not only the first.
 */
public class MirrorMappingException extends RuntimeException {

    private final List<String> problems;

    public MirrorMappingException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public MirrorMappingException(List<String> problems) {
        super("Invalid mirror mapping:" + System.lineSeparator() + "  - "
                + String.join(System.lineSeparator() + "  - ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
