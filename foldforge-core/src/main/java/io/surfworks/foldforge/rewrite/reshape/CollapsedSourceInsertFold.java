package io.surfworks.foldforge.rewrite.reshape;

import io.surfworks.foldforge.rewrite.GraphRewriter;
import io.surfworks.foldforge.rewrite.MatchResult;
import io.surfworks.foldforge.rewrite.OperationGraph;
import io.surfworks.foldforge.rewrite.RewritePattern;
import io.surfworks.foldforge.tensor.TensorIr.CollapseShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.InsertLikeOp;
import io.surfworks.foldforge.tensor.TensorIr.OpKind;
import io.surfworks.foldforge.tensor.TensorIr.Operation;
import io.surfworks.foldforge.tensor.TensorIr.TensorType;

/**
 * Folds a collapse_shape feeding an insert when the insert's sizes already describe the
 * uncollapsed tensor, so the collapse is undone by the insert's implicit unit expansion.
 *
 * <p>Matches:
 * <pre>
 * %c = tensor.collapse_shape %t [[0, 1], [2]] : tensor&lt;1x4x8xf32&gt; into tensor&lt;4x8xf32&gt;
 * %r = tensor.insert_slice %c into %d[0, 0, 0][1, 4, 8][1, 1, 1] : tensor&lt;4x8xf32&gt; into tensor&lt;2x4x8xf32&gt;
 * </pre>
 * and produces:
 * <pre>
 * %r = tensor.insert_slice %t into %d[0, 0, 0][1, 4, 8][1, 1, 1] : tensor&lt;1x4x8xf32&gt; into tensor&lt;2x4x8xf32&gt;
 * </pre>
 *
 * <p>One instance handles one insert variant; the replacement is of the same variant.
 */
public final class CollapsedSourceInsertFold implements RewritePattern<CollapsedSourceInsertFold.Match> {

    public static final String NAME = "fold-insert-of-collapse";

    private final OpKind rootKind;

    /**
     * @param insert the root
     * @param collapse the producer of the insert's source
     */
    public record Match(InsertLikeOp insert, CollapseShapeOp collapse) {}

    /**
     * @param rootKind {@link OpKind#INSERT_SLICE} or {@link OpKind#PARALLEL_INSERT_SLICE}
     */
    public CollapsedSourceInsertFold(OpKind rootKind) {
        this.rootKind = InsertVariants.requireInsertKind(rootKind);
    }

    @Override
    public String name() {
        return InsertVariants.patternName(NAME, rootKind);
    }

    @Override
    public String description() {
        return "Folds " + rootKind.mnemonic() + "(collapse_shape) into an insert of the uncollapsed tensor";
    }

    @Override
    public OpKind rootKind() {
        return rootKind;
    }

    @Override
    public MatchResult<Match> match(Operation op, OperationGraph graph) {
        if (op.kind() != rootKind || !(op instanceof InsertLikeOp insert)) {
            return MatchResult.failure("root is not a " + rootKind.mnemonic());
        }
        if (!(graph.producer(insert.source()) instanceof CollapseShapeOp collapse)) {
            return MatchResult.failure("source is not produced by a collapse_shape");
        }

        TensorType nonReducing = insert.nonRankReducedSourceType();
        if (!nonReducing.equals(collapse.sourceType())) {
            return MatchResult.failure("insert sizes " + nonReducing.toMlirString()
                    + " differ from uncollapsed type " + collapse.sourceType().toMlirString());
        }
        return MatchResult.success(new Match(insert, collapse));
    }

    @Override
    public void rewrite(Match match, GraphRewriter rewriter) {
        Operation insert = match.insert().asOperation();
        InsertLikeOp replacement = match.insert().withSource(
                match.collapse().source(), rewriter.freshResultsLike(insert));
        rewriter.replaceOp(insert, replacement.asOperation());
    }
}
