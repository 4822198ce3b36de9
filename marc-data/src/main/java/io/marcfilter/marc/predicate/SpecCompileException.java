package io.marcfilter.marc.predicate;

import java.util.List;

/**
 * A filter or selection specification could not be compiled. Carries every problem found
 * in the single validation pass, each prefixed with its location in the tree.
 */
public class SpecCompileException extends RuntimeException {
    private final List<String> problems;

    public SpecCompileException(String what, List<String> problems) {
        super("Invalid " + what + " (" + problems.size() + " problem" + (problems.size() == 1 ? "" : "s") + "): "
                + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() { return problems; }
}
