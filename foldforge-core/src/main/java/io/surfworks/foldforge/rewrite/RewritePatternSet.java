package io.surfworks.foldforge.rewrite;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import io.surfworks.foldforge.tensor.TensorIr.OpKind;

/**
 * Caller-owned, ordered collection of rewrite patterns.
 *
 * <p>Registration entry points add to a set; a driver reads it. Pattern names are unique
 * within a set.
 */
public final class RewritePatternSet {

    private final List<RewritePattern<?>> patterns = new ArrayList<>();

    public RewritePatternSet() {}

    /**
     * Adds a pattern.
     *
     * @param pattern the pattern to add
     * @return this set for chaining
     * @throws IllegalArgumentException if a pattern with the same name is already present
     */
    public RewritePatternSet add(RewritePattern<?> pattern) {
        if (find(pattern.name()).isPresent()) {
            throw new IllegalArgumentException("duplicate pattern name: " + pattern.name());
        }
        patterns.add(pattern);
        return this;
    }

    /**
     * Returns the patterns in registration order.
     */
    public List<RewritePattern<?>> patterns() {
        return List.copyOf(patterns);
    }

    /**
     * Returns the patterns rooted at {@code kind}, highest benefit first, ties in registration
     * order.
     */
    public List<RewritePattern<?>> patternsFor(OpKind kind) {
        return patterns.stream()
                .filter(p -> p.rootKind() == kind)
                .sorted(Comparator.comparingInt((RewritePattern<?> p) -> p.benefit()).reversed())
                .toList();
    }

    public Optional<RewritePattern<?>> find(String name) {
        return patterns.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public List<String> names() {
        return patterns.stream().map(RewritePattern::name).toList();
    }

    public int size() {
        return patterns.size();
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    @Override
    public String toString() {
        return "RewritePatternSet" + names();
    }
}
