package io.surfworks.foldforge.rewrite;

import io.surfworks.foldforge.tensor.TensorIr.Operation;

/**
 * Observer of graph mutations performed through a {@link GraphRewriter}.
 *
 * <p>All methods default to no-ops so listeners implement only what they track.
 */
public interface RewriteListener {

    /** Listener that ignores every notification. */
    RewriteListener NONE = new RewriteListener() {};

    default void operationInserted(Operation op) {}

    /**
     * Called after {@code op}'s uses were redirected to {@code replacement}, before {@code op}
     * is erased.
     */
    default void operationReplaced(Operation op, Operation replacement) {}

    /**
     * Called after an operand of {@code op} was substituted in place.
     */
    default void operationModified(Operation op) {}

    default void operationErased(Operation op) {}

    /**
     * Called when a pattern declines to rewrite {@code op}. Purely advisory.
     */
    default void matchFailed(String patternName, Operation op, String reason) {}
}
