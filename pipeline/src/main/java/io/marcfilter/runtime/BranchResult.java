package io.marcfilter.runtime;

/**
 * Final counters of one output.
 */
public record BranchResult(String name, long matched, long written, boolean limitReached) {
    BranchResult plus(BranchResult other) {
        return new BranchResult(name, matched + other.matched, written + other.written, limitReached && other.limitReached);
    }
}
