package io.surfworks.foldforge.rewrite;

import io.surfworks.foldforge.tensor.TensorIr.OpKind;
import io.surfworks.foldforge.tensor.TensorIr.Operation;

/**
 * A local rewrite rule rooted at one kind of operation.
 *
 * <p>A RewritePattern is split in two phases:
 * <ul>
 *   <li>{@link #match} inspects the root and its immediate producers and must not mutate
 *       anything; it returns the captured neighborhood or a decline reason</li>
 *   <li>{@link #rewrite} commits exactly one mutation primitive of {@link GraphRewriter}
 *       (plus erasure of producers it left unused)</li>
 * </ul>
 *
 * <p>Patterns are stateless and reentrant. Iteration to a fixpoint is the job of
 * {@link GreedyRewriteDriver}, not of the pattern.
 *
 * <p>Example implementation:
 * <pre>{@code
 * public final class DropIdentityCollapse implements RewritePattern<CollapseShapeOp> {
 *     public String name() { return "drop-identity-collapse"; }
 *     public OpKind rootKind() { return OpKind.COLLAPSE_SHAPE; }
 *
 *     public MatchResult<CollapseShapeOp> match(Operation op, OperationGraph graph) {
 *         CollapseShapeOp collapse = (CollapseShapeOp) op;
 *         if (!collapse.sourceType().equals(collapse.resultType())) {
 *             return MatchResult.failure("collapse changes the type");
 *         }
 *         return MatchResult.success(collapse);
 *     }
 *
 *     public void rewrite(CollapseShapeOp collapse, GraphRewriter rewriter) {
 *         rewriter.replaceAllUses(collapse, collapse.source());
 *     }
 * }
 * }</pre>
 *
 * @param <M> the pattern-specific match captured between the two phases
 */
public interface RewritePattern<M> {

    /**
     * Returns the unique name of this pattern, used in logging, diagnostics and configuration.
     */
    String name();

    /**
     * Returns the kind of operation this pattern is rooted at.
     */
    OpKind rootKind();

    /**
     * Attempts to match this pattern at the given root operation.
     *
     * @param op the root operation; its kind is {@link #rootKind()}
     * @param graph the graph for producer and use-count queries
     * @return the match, or a failure carrying an advisory reason
     */
    MatchResult<M> match(Operation op, OperationGraph graph);

    /**
     * Commits the rewrite for a successful match. New operations are inserted before the root.
     *
     * @param match the value captured by {@link #match}
     * @param rewriter the mutation primitives
     */
    void rewrite(M match, GraphRewriter rewriter);

    /**
     * Returns the priority of this pattern among patterns sharing a root kind.
     * Higher benefit patterns are tried first.
     *
     * @return the benefit (default 1)
     */
    default int benefit() {
        return 1;
    }

    /**
     * Returns a human-readable description of what this pattern rewrites.
     */
    default String description() {
        return name() + " rewrite pattern";
    }

    /**
     * Matches at {@code op} and rewrites on success.
     *
     * @return true if the graph was changed
     */
    default boolean matchAndRewrite(Operation op, GraphRewriter rewriter) {
        if (op.kind() != rootKind()) {
            return false;
        }
        MatchResult<M> result = match(op, rewriter.graph());
        if (result instanceof MatchResult.Success<M> success) {
            rewriter.setInsertionPoint(op);
            rewrite(success.match(), rewriter);
            return true;
        }
        rewriter.notifyMatchFailure(name(), op, ((MatchResult.Failure<M>) result).reason());
        return false;
    }
}
