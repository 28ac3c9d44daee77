package io.surfworks.foldforge.rewrite.reshape;

import io.surfworks.foldforge.rewrite.GraphRewriter;
import io.surfworks.foldforge.rewrite.MatchResult;
import io.surfworks.foldforge.rewrite.OperationGraph;
import io.surfworks.foldforge.rewrite.RewritePattern;
import io.surfworks.foldforge.tensor.ShapeRelation;
import io.surfworks.foldforge.tensor.TensorIr.ExpandShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.InsertLikeOp;
import io.surfworks.foldforge.tensor.TensorIr.OpKind;
import io.surfworks.foldforge.tensor.TensorIr.Operation;

/**
 * Folds an expand_shape that only adds static unit dimensions into the insert consuming it:
 * the insert reads the unexpanded tensor directly and re-adds the unit dimensions itself.
 *
 * <p>Matches:
 * <pre>
 * %e = tensor.expand_shape %t [[0, 1], [2]] : tensor&lt;4x8xf32&gt; into tensor&lt;1x4x8xf32&gt;
 * %r = tensor.insert_slice %e into %d[0, 0, 0][1, 4, 8][1, 1, 1] : tensor&lt;1x4x8xf32&gt; into tensor&lt;2x4x8xf32&gt;
 * </pre>
 * and rewrites the insert in place to:
 * <pre>
 * %r = tensor.insert_slice %t into %d[0, 0, 0][1, 4, 8][1, 1, 1] : tensor&lt;4x8xf32&gt; into tensor&lt;2x4x8xf32&gt;
 * </pre>
 *
 * <p>Only the source operand changes, so the insert keeps its identity.
 */
public final class PaddingExpandInsertFold implements RewritePattern<PaddingExpandInsertFold.Match> {

    public static final String NAME = "fold-padding-expand-into-insert";

    private final OpKind rootKind;

    /**
     * @param insert the root
     * @param expand the producer of the insert's source
     */
    public record Match(InsertLikeOp insert, ExpandShapeOp expand) {}

    /**
     * @param rootKind {@link OpKind#INSERT_SLICE} or {@link OpKind#PARALLEL_INSERT_SLICE}
     */
    public PaddingExpandInsertFold(OpKind rootKind) {
        this.rootKind = InsertVariants.requireInsertKind(rootKind);
    }

    @Override
    public String name() {
        return InsertVariants.patternName(NAME, rootKind);
    }

    @Override
    public String description() {
        return "Folds a unit-dimension-adding expand_shape into " + rootKind.mnemonic();
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
        if (!(graph.producer(insert.source()) instanceof ExpandShapeOp expand)) {
            return MatchResult.failure("source is not produced by an expand_shape");
        }

        ShapeRelation relation = ShapeRelation.classify(expand.sourceType(), expand.resultType());
        if (!relation.isSingletonExpansion()) {
            return MatchResult.failure("expected rank increasing expansion, got " + relation);
        }
        return MatchResult.success(new Match(insert, expand));
    }

    @Override
    public void rewrite(Match match, GraphRewriter rewriter) {
        rewriter.replaceOperandInPlace(match.insert().asOperation(), InsertLikeOp.SOURCE_OPERAND,
                match.expand().source());
    }
}
