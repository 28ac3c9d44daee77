package io.surfworks.foldforge.rewrite.reshape;

import io.surfworks.foldforge.rewrite.GraphRewriter;
import io.surfworks.foldforge.rewrite.MatchResult;
import io.surfworks.foldforge.rewrite.OperationGraph;
import io.surfworks.foldforge.rewrite.RewritePattern;
import io.surfworks.foldforge.tensor.ShapeRelation;
import io.surfworks.foldforge.tensor.TensorIr.CollapseShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.ExtractSliceOp;
import io.surfworks.foldforge.tensor.TensorIr.OpKind;
import io.surfworks.foldforge.tensor.TensorIr.Operation;

/**
 * Folds a collapse_shape that only removes static unit dimensions into the extract_slice
 * producing its source, turning the slice into a rank-reducing one.
 *
 * <p>Matches:
 * <pre>
 * %slice = tensor.extract_slice %src[0, 0, 0][8, 1, 4][1, 1, 1] : tensor&lt;8x2x4xf32&gt; to tensor&lt;8x1x4xf32&gt;
 * %r = tensor.collapse_shape %slice [[0], [1, 2]] : tensor&lt;8x1x4xf32&gt; into tensor&lt;8x4xf32&gt;
 * </pre>
 * and produces:
 * <pre>
 * %r = tensor.extract_slice %src[0, 0, 0][8, 1, 4][1, 1, 1] : tensor&lt;8x2x4xf32&gt; to tensor&lt;8x4xf32&gt;
 * </pre>
 *
 * <p>The slice must have the collapse as its only use; otherwise it would have to be
 * duplicated.
 */
public final class UnpaddingCollapseExtractFold implements RewritePattern<UnpaddingCollapseExtractFold.Match> {

    public static final String NAME = "fold-unpadding-collapse";

    /**
     * @param collapse the root
     * @param extract the single-use producer of the collapse's source
     */
    public record Match(CollapseShapeOp collapse, ExtractSliceOp extract) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Folds a unit-dimension-dropping collapse_shape into its extract_slice";
    }

    @Override
    public OpKind rootKind() {
        return OpKind.COLLAPSE_SHAPE;
    }

    @Override
    public MatchResult<Match> match(Operation op, OperationGraph graph) {
        if (!(op instanceof CollapseShapeOp collapse)) {
            return MatchResult.failure("root is not a collapse_shape");
        }
        if (!(graph.producer(collapse.source()) instanceof ExtractSliceOp extract)) {
            return MatchResult.failure("source is not produced by an extract_slice");
        }
        if (!graph.hasSingleUse(extract.result())) {
            return MatchResult.failure("extract_slice has " + graph.useCount(extract.result()) + " uses");
        }

        ShapeRelation relation = ShapeRelation.classify(extract.resultType(), collapse.resultType());
        if (!relation.isSingletonReduction()) {
            return MatchResult.failure("expected unpadding collapse, got " + relation);
        }
        return MatchResult.success(new Match(collapse, extract));
    }

    @Override
    public void rewrite(Match match, GraphRewriter rewriter) {
        ExtractSliceOp extract = match.extract();
        ExtractSliceOp unpadded = new ExtractSliceOp(
                rewriter.freshValue(match.collapse().resultType()),
                extract.source(),
                extract.mixedOffsets(),
                extract.mixedSizes(),
                extract.mixedStrides());
        rewriter.replaceOp(match.collapse(), unpadded);
        rewriter.eraseIfUnused(extract);
    }
}
