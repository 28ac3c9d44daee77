package io.surfworks.foldforge.rewrite.reshape;

import io.surfworks.foldforge.rewrite.GraphRewriter;
import io.surfworks.foldforge.rewrite.MatchResult;
import io.surfworks.foldforge.rewrite.OperationGraph;
import io.surfworks.foldforge.rewrite.RewritePattern;
import io.surfworks.foldforge.tensor.TensorIr.ExpandShapeOp;
import io.surfworks.foldforge.tensor.TensorIr.ExtractSliceOp;
import io.surfworks.foldforge.tensor.TensorIr.OpKind;
import io.surfworks.foldforge.tensor.TensorIr.Operation;
import io.surfworks.foldforge.tensor.TensorIr.TensorType;

/**
 * Folds an expand_shape that only restores the unit dimensions dropped by a rank-reducing
 * extract_slice.
 *
 * <p>Matches:
 * <pre>
 * %slice = tensor.extract_slice %src[0, 0, 0][16, 1, 4][1, 1, 1] : tensor&lt;16x8x4xf32&gt; to tensor&lt;16x4xf32&gt;
 * %r = tensor.expand_shape %slice [[0, 1], [2]] : tensor&lt;16x4xf32&gt; into tensor&lt;16x1x4xf32&gt;
 * </pre>
 * and produces:
 * <pre>
 * %r = tensor.extract_slice %src[0, 0, 0][16, 1, 4][1, 1, 1] : tensor&lt;16x8x4xf32&gt; to tensor&lt;16x1x4xf32&gt;
 * </pre>
 *
 * <p>Only fires when the slice without rank reduction has exactly the expand's result type.
 * A result that differs from it by unit dimensions alone is not folded.
 */
public final class RankReducingExtractExpandFold implements RewritePattern<RankReducingExtractExpandFold.Match> {

    public static final String NAME = "fold-expand-of-extract";

    /**
     * @param expand the root
     * @param extract the producer of the expand's source
     */
    public record Match(ExpandShapeOp expand, ExtractSliceOp extract) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Folds expand_shape(extract_slice) into a non-rank-reducing extract_slice";
    }

    @Override
    public OpKind rootKind() {
        return OpKind.EXPAND_SHAPE;
    }

    @Override
    public MatchResult<Match> match(Operation op, OperationGraph graph) {
        if (!(op instanceof ExpandShapeOp expand)) {
            return MatchResult.failure("root is not an expand_shape");
        }
        if (!(graph.producer(expand.source()) instanceof ExtractSliceOp extract)) {
            return MatchResult.failure("source is not produced by an extract_slice");
        }

        TensorType nonReducing = extract.nonRankReducedType();
        if (!nonReducing.equals(expand.resultType())) {
            return MatchResult.failure("non-rank-reducing slice type " + nonReducing.toMlirString()
                    + " differs from expanded type " + expand.resultType().toMlirString());
        }
        return MatchResult.success(new Match(expand, extract));
    }

    @Override
    public void rewrite(Match match, GraphRewriter rewriter) {
        ExtractSliceOp extract = match.extract();
        ExtractSliceOp slice = new ExtractSliceOp(
                rewriter.freshValue(match.expand().resultType()),
                extract.source(),
                extract.mixedOffsets(),
                extract.mixedSizes(),
                extract.mixedStrides());
        rewriter.replaceOp(match.expand(), slice);
        rewriter.eraseIfUnused(extract);
    }
}
